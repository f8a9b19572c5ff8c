package com.geoengine.data;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;

/**
 * Attribute value with an explicit kind. Values of different kinds are never equal, so
 * {@code ofLong(1)} and {@code ofDouble(1.0)} are distinct.
 */
public final class AttributeValue {

    public enum Kind {
        STRING,
        INTEGER,
        DOUBLE,
        BOOLEAN,
        DATE_TIME,
        BYTES,
        NULL
    }

    public static final AttributeValue NULL = new AttributeValue(Kind.NULL, null);

    private final Kind kind;
    private final Object value;

    private AttributeValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static AttributeValue ofString(String value) {
        return value == null ? NULL : new AttributeValue(Kind.STRING, value);
    }

    public static AttributeValue ofLong(long value) {
        return new AttributeValue(Kind.INTEGER, value);
    }

    public static AttributeValue ofDouble(double value) {
        return new AttributeValue(Kind.DOUBLE, value);
    }

    public static AttributeValue ofBoolean(boolean value) {
        return new AttributeValue(Kind.BOOLEAN, value);
    }

    public static AttributeValue ofInstant(Instant value) {
        return value == null ? NULL : new AttributeValue(Kind.DATE_TIME, value);
    }

    public static AttributeValue ofBytes(byte[] value) {
        return value == null ? NULL : new AttributeValue(Kind.BYTES, value.clone());
    }

    /**
     * Converts a plain Java value. Supported: String, integral and floating numbers, Boolean,
     * Instant, Date, byte[], AttributeValue (returned as-is) and null.
     *
     * @throws IllegalArgumentException for any other type
     */
    public static AttributeValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof AttributeValue av) {
            return av;
        }
        if (value instanceof String s) {
            return ofString(s);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ofLong(((Number) value).longValue());
        }
        if (value instanceof BigInteger bi) {
            return ofLong(bi.longValueExact());
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return ofDouble(((Number) value).doubleValue());
        }
        if (value instanceof Boolean b) {
            return ofBoolean(b);
        }
        if (value instanceof Instant i) {
            return ofInstant(i);
        }
        if (value instanceof Date d) {
            return ofInstant(d.toInstant());
        }
        if (value instanceof byte[] bytes) {
            return ofBytes(bytes);
        }
        throw new IllegalArgumentException("Unsupported attribute value type: " + value.getClass().getName());
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /** Raw value (String, Long, Double, Boolean, Instant, byte[] copy) or null. */
    public Object getValue() {
        if (kind == Kind.BYTES) {
            return ((byte[]) value).clone();
        }
        return value;
    }

    public Optional<String> asString() {
        return kind == Kind.STRING ? Optional.of((String) value) : Optional.empty();
    }

    public Optional<Long> asLong() {
        return kind == Kind.INTEGER ? Optional.of((Long) value) : Optional.empty();
    }

    /** Double value; integers widen. */
    public Optional<Double> asDouble() {
        if (kind == Kind.DOUBLE) {
            return Optional.of((Double) value);
        }
        if (kind == Kind.INTEGER) {
            return Optional.of(((Long) value).doubleValue());
        }
        return Optional.empty();
    }

    public Optional<Boolean> asBoolean() {
        return kind == Kind.BOOLEAN ? Optional.of((Boolean) value) : Optional.empty();
    }

    public Optional<Instant> asInstant() {
        return kind == Kind.DATE_TIME ? Optional.of((Instant) value) : Optional.empty();
    }

    public Optional<byte[]> asBytes() {
        return kind == Kind.BYTES ? Optional.of(((byte[]) value).clone()) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeValue)) return false;
        AttributeValue that = (AttributeValue) o;
        if (kind != that.kind) return false;
        if (kind == Kind.BYTES) {
            return Arrays.equals((byte[]) value, (byte[]) that.value);
        }
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        int h = kind.hashCode();
        return 31 * h + (kind == Kind.BYTES ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value));
    }

    @Override
    public String toString() {
        if (kind == Kind.NULL) {
            return "null";
        }
        if (kind == Kind.BYTES) {
            return "bytes[" + ((byte[]) value).length + "]";
        }
        return String.valueOf(value);
    }
}
