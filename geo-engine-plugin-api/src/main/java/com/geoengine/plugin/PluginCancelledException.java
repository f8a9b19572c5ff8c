package com.geoengine.plugin;

/** Work was abandoned because its cancellation signal was raised. */
public class PluginCancelledException extends PluginException {

    public PluginCancelledException(String pluginId) {
        super(pluginId, "Cancelled" + (pluginId != null ? ": " + pluginId : ""));
    }
}
