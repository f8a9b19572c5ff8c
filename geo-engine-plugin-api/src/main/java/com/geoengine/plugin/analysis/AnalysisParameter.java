package com.geoengine.plugin.analysis;

import java.util.List;
import java.util.Objects;

/**
 * Declares one input of an analysis: name, type, whether it is required, a default, and an
 * optional numeric range or list of allowed values. {@link #check(Object)} applies those rules.
 */
public final class AnalysisParameter {

    public enum DataType {
        STRING,
        INTEGER,
        DOUBLE,
        BOOLEAN,
        LAYER
    }

    private final String name;
    private final String displayName;
    private final String description;
    private final DataType dataType;
    private final Object defaultValue;
    private final boolean required;
    private final Double min;
    private final Double max;
    private final List<Object> allowedValues;

    private AnalysisParameter(Builder b) {
        this.name = b.name;
        this.displayName = b.displayName != null ? b.displayName : b.name;
        this.description = b.description != null ? b.description : "";
        this.dataType = b.dataType;
        this.defaultValue = b.defaultValue;
        this.required = b.required;
        this.min = b.min;
        this.max = b.max;
        this.allowedValues = List.copyOf(b.allowedValues);
    }

    public static Builder builder(String name, DataType dataType) {
        return new Builder(name, dataType);
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public DataType getDataType() {
        return dataType;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isRequired() {
        return required;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public List<Object> getAllowedValues() {
        return allowedValues;
    }

    /** Error message for {@code value}, or null when it is acceptable. */
    public String check(Object value) {
        if (value == null) {
            return required && defaultValue == null ? "Missing required parameter: " + name : null;
        }
        switch (dataType) {
            case STRING:
            case LAYER:
                if (!(value instanceof String) || ((String) value).isBlank()) {
                    return "Parameter " + name + " must be a non-blank string";
                }
                break;
            case INTEGER:
                if (!(value instanceof Integer || value instanceof Long)) {
                    return "Parameter " + name + " must be an integer";
                }
                break;
            case DOUBLE:
                if (!(value instanceof Number)) {
                    return "Parameter " + name + " must be a number";
                }
                break;
            case BOOLEAN:
                if (!(value instanceof Boolean)) {
                    return "Parameter " + name + " must be a boolean";
                }
                break;
            default:
                break;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (min != null && d < min) {
                return "Parameter " + name + " must be >= " + min;
            }
            if (max != null && d > max) {
                return "Parameter " + name + " must be <= " + max;
            }
        }
        if (!allowedValues.isEmpty() && !allowedValues.contains(value)) {
            return "Parameter " + name + " must be one of " + allowedValues;
        }
        return null;
    }

    @Override
    public String toString() {
        return "AnalysisParameter[" + name + ": " + dataType + (required ? ", required" : "") + "]";
    }

    public static final class Builder {
        private final String name;
        private final DataType dataType;
        private String displayName;
        private String description;
        private Object defaultValue;
        private boolean required;
        private Double min;
        private Double max;
        private List<Object> allowedValues = List.of();

        private Builder(String name, DataType dataType) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Parameter name must be non-blank");
            }
            this.name = name;
            this.dataType = Objects.requireNonNull(dataType, "dataType");
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder range(double min, double max) {
            if (min > max) {
                throw new IllegalArgumentException("min must not exceed max");
            }
            this.min = min;
            this.max = max;
            return this;
        }

        public Builder allowedValues(List<?> allowedValues) {
            this.allowedValues = List.copyOf(allowedValues);
            return this;
        }

        public AnalysisParameter build() {
            return new AnalysisParameter(this);
        }
    }
}
