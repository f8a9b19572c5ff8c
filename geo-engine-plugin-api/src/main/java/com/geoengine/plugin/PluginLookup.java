package com.geoengine.plugin;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the plugin manager handed to plugins through their context.
 */
public interface PluginLookup {

    Optional<Plugin> getPlugin(String pluginId);

    /** All managed plugins in registration order. */
    List<Plugin> getPlugins();

    /** Plugins declaring every type in {@code types}. */
    List<Plugin> getPlugins(Set<PluginType> types);

    /** Capability implementations of STARTED plugins, in registration order. */
    <T> List<T> getExtensions(Class<T> extensionType);
}
