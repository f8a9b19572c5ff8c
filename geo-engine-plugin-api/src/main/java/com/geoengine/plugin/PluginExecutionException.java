package com.geoengine.plugin;

/** Plugin code failed while doing work on the host's behalf. */
public class PluginExecutionException extends PluginException {

    public PluginExecutionException(String pluginId, String message) {
        super(pluginId, message);
    }

    public PluginExecutionException(String pluginId, String message, Throwable cause) {
        super(pluginId, message, cause);
    }
}
