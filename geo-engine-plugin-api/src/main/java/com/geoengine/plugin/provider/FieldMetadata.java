package com.geoengine.plugin.provider;

import com.geoengine.data.AttributeValue;

import java.util.Objects;

/**
 * Schema of one attribute field in a data source.
 */
public record FieldMetadata(String name,
                            AttributeValue.Kind dataType,
                            int length,
                            int precision,
                            boolean nullable,
                            boolean primaryKey,
                            boolean indexed) {

    public FieldMetadata {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name must be non-blank");
        }
        Objects.requireNonNull(dataType, "dataType");
    }

    /** Nullable, non-key, unindexed field with no length or precision. */
    public static FieldMetadata of(String name, AttributeValue.Kind dataType) {
        return new FieldMetadata(name, dataType, 0, 0, true, false, false);
    }
}
