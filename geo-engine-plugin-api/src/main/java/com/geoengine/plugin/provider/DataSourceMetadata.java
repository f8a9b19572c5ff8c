package com.geoengine.plugin.provider;

import com.geoengine.geometry.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Description of a data source reported by a provider without opening it for editing.
 */
public final class DataSourceMetadata {

    private final String name;
    private final String description;
    private final DataSourceType type;
    private final Envelope extent;
    private final String spatialReference;
    private final long featureCount;
    private final List<FieldMetadata> fields;
    private final Map<String, String> properties;

    private DataSourceMetadata(Builder b) {
        this.name = b.name;
        this.description = b.description != null ? b.description : "";
        this.type = b.type;
        this.extent = b.extent;
        this.spatialReference = b.spatialReference;
        this.featureCount = b.featureCount;
        this.fields = Collections.unmodifiableList(new ArrayList<>(b.fields));
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
    }

    public static Builder builder(String name, DataSourceType type) {
        return new Builder(name, type);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public DataSourceType getType() {
        return type;
    }

    /** Null when unknown or the source holds no geometry. */
    public Envelope getExtent() {
        return extent;
    }

    public String getSpatialReference() {
        return spatialReference;
    }

    /** -1 when unknown. */
    public long getFeatureCount() {
        return featureCount;
    }

    public List<FieldMetadata> getFields() {
        return fields;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public static final class Builder {
        private final String name;
        private final DataSourceType type;
        private String description;
        private Envelope extent;
        private String spatialReference;
        private long featureCount = -1;
        private final List<FieldMetadata> fields = new ArrayList<>();
        private final Map<String, String> properties = new LinkedHashMap<>();

        private Builder(String name, DataSourceType type) {
            this.name = Objects.requireNonNull(name, "name");
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder extent(Envelope extent) {
            this.extent = extent;
            return this;
        }

        public Builder spatialReference(String spatialReference) {
            this.spatialReference = spatialReference;
            return this;
        }

        public Builder featureCount(long featureCount) {
            this.featureCount = featureCount;
            return this;
        }

        public Builder field(FieldMetadata field) {
            fields.add(Objects.requireNonNull(field, "field"));
            return this;
        }

        public Builder property(String key, String value) {
            properties.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public DataSourceMetadata build() {
            return new DataSourceMetadata(this);
        }
    }
}
