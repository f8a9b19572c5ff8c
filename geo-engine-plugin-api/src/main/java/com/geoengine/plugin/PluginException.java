package com.geoengine.plugin;

/**
 * Base of all plugin runtime errors. Carries the id of the plugin involved, when known.
 */
public class PluginException extends RuntimeException {

    private final String pluginId;

    public PluginException(String pluginId, String message) {
        super(message);
        this.pluginId = pluginId;
    }

    public PluginException(String pluginId, String message, Throwable cause) {
        super(message, cause);
        this.pluginId = pluginId;
    }

    /** Id of the plugin the error relates to, or null. */
    public String getPluginId() {
        return pluginId;
    }
}
