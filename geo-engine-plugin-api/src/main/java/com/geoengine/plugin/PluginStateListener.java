package com.geoengine.plugin;

/** Notified after each state change of a plugin. */
@FunctionalInterface
public interface PluginStateListener {

    void stateChanged(Plugin plugin, PluginState oldState, PluginState newState);
}
