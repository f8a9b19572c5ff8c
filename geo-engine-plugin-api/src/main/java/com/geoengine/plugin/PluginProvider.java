package com.geoengine.plugin;

/**
 * Service-provider interface for plugins. Internal providers are registered explicitly; community
 * providers are discovered with {@link java.util.ServiceLoader} from JARs in the plugins directory
 * ({@code META-INF/services/com.geoengine.plugin.PluginProvider}).
 */
public interface PluginProvider {

    /** Id of the plugin this provider creates; must match the created descriptor's id. */
    String getPluginId();

    /** Creates a new plugin instance in state NOT_INITIALIZED. */
    Plugin createPlugin();

    /** Disabled providers are skipped at load. */
    default boolean isEnabled() {
        return true;
    }
}
