package com.geoengine.plugin;

/**
 * Thrown when a lifecycle operation is not legal in the plugin's current state, or when another
 * transition for the same plugin is still in flight.
 */
public class InvalidStateException extends PluginException {

    private final PluginState state;

    public InvalidStateException(String pluginId, PluginState state, String operation) {
        super(pluginId, "Plugin " + pluginId + " cannot " + operation + " in state " + state);
        this.state = state;
    }

    public InvalidStateException(String pluginId, PluginState state, String operation, String detail) {
        super(pluginId, "Plugin " + pluginId + " cannot " + operation + " in state " + state + ": " + detail);
        this.state = state;
    }

    /** State the plugin was in when the operation was rejected. */
    public PluginState getState() {
        return state;
    }
}
