package com.geoengine.plugin;

import java.util.List;

/**
 * A plugin's dependencies cannot be satisfied: a dependency is missing, disabled, failed, or part
 * of a cycle. {@link #getPath()} holds the dependency chain that led to the failure, when known.
 */
public class DependencyException extends PluginException {

    private final List<String> path;

    public DependencyException(String pluginId, String message) {
        this(pluginId, message, List.of());
    }

    public DependencyException(String pluginId, String message, List<String> path) {
        super(pluginId, message);
        this.path = path != null ? List.copyOf(path) : List.of();
    }

    public List<String> getPath() {
        return path;
    }
}
