package com.geoengine.plugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Identity and static metadata of a plugin: id, display data, version, plugin types, minimum
 * engine version and the ids of plugins it depends on (in declaration order).
 */
public final class PluginDescriptor {

    private static final SemanticVersion DEFAULT_MIN_ENGINE_VERSION = new SemanticVersion(1, 0, 0);

    private final String id;
    private final String name;
    private final String description;
    private final SemanticVersion version;
    private final String author;
    private final Set<PluginType> types;
    private final SemanticVersion minEngineVersion;
    private final List<String> dependencies;

    private PluginDescriptor(Builder b) {
        this.id = b.id;
        this.name = b.name != null ? b.name : b.id;
        this.description = b.description != null ? b.description : "";
        this.version = b.version;
        this.author = b.author != null ? b.author : "";
        this.types = Collections.unmodifiableSet(EnumSet.copyOf(b.types));
        this.minEngineVersion = b.minEngineVersion;
        this.dependencies = List.copyOf(b.dependencies);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public SemanticVersion getVersion() {
        return version;
    }

    public String getAuthor() {
        return author;
    }

    public Set<PluginType> getTypes() {
        return types;
    }

    public boolean hasType(PluginType type) {
        return types.contains(type);
    }

    public SemanticVersion getMinEngineVersion() {
        return minEngineVersion;
    }

    /** Ids of plugins that must be started before this one. */
    public List<String> getDependencies() {
        return dependencies;
    }

    @Override
    public String toString() {
        return "PluginDescriptor[" + id + " " + version + " " + types + "]";
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private SemanticVersion version = new SemanticVersion(1, 0, 0);
        private String author;
        private final Set<PluginType> types = EnumSet.noneOf(PluginType.class);
        private SemanticVersion minEngineVersion = DEFAULT_MIN_ENGINE_VERSION;
        private final List<String> dependencies = new ArrayList<>();

        private Builder(String id) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Plugin id must be non-blank");
            }
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = SemanticVersion.parse(version);
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder type(PluginType type) {
            types.add(Objects.requireNonNull(type, "type"));
            return this;
        }

        public Builder types(Set<PluginType> types) {
            for (PluginType t : types) {
                type(t);
            }
            return this;
        }

        public Builder minEngineVersion(String minEngineVersion) {
            this.minEngineVersion = SemanticVersion.parse(minEngineVersion);
            return this;
        }

        public Builder dependsOn(String... pluginIds) {
            for (String dep : pluginIds) {
                if (dep == null || dep.isBlank()) {
                    throw new IllegalArgumentException("Dependency id must be non-blank");
                }
                if (dep.equals(id)) {
                    throw new IllegalArgumentException("Plugin " + id + " cannot depend on itself");
                }
                if (!dependencies.contains(dep)) {
                    dependencies.add(dep);
                }
            }
            return this;
        }

        public PluginDescriptor build() {
            if (types.isEmpty()) {
                throw new IllegalArgumentException("Plugin " + id + " must declare at least one type");
            }
            return new PluginDescriptor(this);
        }
    }
}
