package com.geoengine.data;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered name → value mapping attached to a feature. Names are case-sensitive and unique;
 * enumeration and index access follow insertion order. Re-putting an existing name replaces
 * its value in place without moving it.
 * <p>
 * Lookups by a missing name return {@code null} (or an empty Optional for typed accessors);
 * index accessors throw {@link IndexOutOfBoundsException} when out of range.
 * <p>
 * Not thread-safe.
 */
public final class AttributeTable {

    private final LinkedHashMap<String, AttributeValue> values = new LinkedHashMap<>();

    public AttributeTable() {
    }

    /** Table from alternating name/value pairs, e.g. {@code of("name", "A1", "lanes", 2)}. */
    public static AttributeTable of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("of() expects name/value pairs");
        }
        AttributeTable table = new AttributeTable();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            Object name = namesAndValues[i];
            if (!(name instanceof String)) {
                throw new IllegalArgumentException("Attribute name must be a String at position " + i);
            }
            table.put((String) name, namesAndValues[i + 1]);
        }
        return table;
    }

    public AttributeTable put(String name, AttributeValue value) {
        values.put(requireName(name), value == null ? AttributeValue.NULL : value);
        return this;
    }

    /** Puts a plain Java value, converted with {@link AttributeValue#of(Object)}. */
    public AttributeTable put(String name, Object value) {
        return put(name, AttributeValue.of(value));
    }

    /** Value for {@code name}, or null when the name is not present. */
    public AttributeValue get(String name) {
        return values.get(requireName(name));
    }

    public AttributeValue get(int index) {
        return values.get(nameAt(index));
    }

    /** Replaces the value at {@code index}, keeping its name and position. */
    public void set(int index, AttributeValue value) {
        values.put(nameAt(index), value == null ? AttributeValue.NULL : value);
    }

    public String nameAt(int index) {
        if (index < 0 || index >= values.size()) {
            throw new IndexOutOfBoundsException("Attribute index " + index + " out of range [0, " + values.size() + ")");
        }
        int i = 0;
        for (String name : values.keySet()) {
            if (i++ == index) {
                return name;
            }
        }
        throw new IllegalStateException("unreachable");
    }

    public boolean exists(String name) {
        return values.containsKey(requireName(name));
    }

    public boolean remove(String name) {
        return values.remove(requireName(name)) != null;
    }

    public void clear() {
        values.clear();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Names in insertion order (snapshot). */
    public List<String> names() {
        return List.copyOf(values.keySet());
    }

    /** Entries in insertion order (unmodifiable view). */
    public Map<String, AttributeValue> entries() {
        return Collections.unmodifiableMap(values);
    }

    public Optional<String> getString(String name) {
        AttributeValue v = get(name);
        if (v == null || v.isNull()) {
            return Optional.empty();
        }
        return Optional.of(v.asString().orElseGet(v::toString));
    }

    public Optional<Long> getLong(String name) {
        AttributeValue v = get(name);
        if (v == null) {
            return Optional.empty();
        }
        Optional<Long> direct = v.asLong();
        if (direct.isPresent()) {
            return direct;
        }
        Optional<Double> d = v.asDouble();
        if (d.isPresent() && d.get() == Math.rint(d.get()) && !d.get().isInfinite()) {
            return Optional.of(d.get().longValue());
        }
        return v.asString().flatMap(AttributeTable::parseLong);
    }

    public Optional<Double> getDouble(String name) {
        AttributeValue v = get(name);
        if (v == null) {
            return Optional.empty();
        }
        Optional<Double> direct = v.asDouble();
        if (direct.isPresent()) {
            return direct;
        }
        return v.asString().flatMap(AttributeTable::parseDouble);
    }

    public Optional<Boolean> getBoolean(String name) {
        AttributeValue v = get(name);
        if (v == null) {
            return Optional.empty();
        }
        Optional<Boolean> direct = v.asBoolean();
        if (direct.isPresent()) {
            return direct;
        }
        return v.asString().flatMap(s -> {
            String t = s.trim();
            if ("true".equalsIgnoreCase(t)) return Optional.of(Boolean.TRUE);
            if ("false".equalsIgnoreCase(t)) return Optional.of(Boolean.FALSE);
            return Optional.empty();
        });
    }

    public Optional<Instant> getInstant(String name) {
        AttributeValue v = get(name);
        if (v == null) {
            return Optional.empty();
        }
        Optional<Instant> direct = v.asInstant();
        if (direct.isPresent()) {
            return direct;
        }
        return v.asString().flatMap(s -> {
            try {
                return Optional.of(Instant.parse(s.trim()));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        });
    }

    /** Deep copy: the new table shares no mutable state with this one. */
    public AttributeTable copy() {
        AttributeTable copy = new AttributeTable();
        copy.values.putAll(values);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeTable)) return false;
        return new ArrayList<>(values.entrySet()).equals(new ArrayList<>(((AttributeTable) o).values.entrySet()));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    private static String requireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Attribute name must not be null");
        }
        return name;
    }

    private static Optional<Long> parseLong(String s) {
        try {
            return Optional.of(Long.parseLong(s.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Double> parseDouble(String s) {
        try {
            return Optional.of(Double.parseDouble(s.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
