package com.geoengine.plugin;

/**
 * Lifecycle states of a plugin.
 * <pre>
 * NOT_INITIALIZED -> INITIALIZING -> INITIALIZED -> STARTED <-> STOPPED
 *                         |              |            |
 *                         +--------------+------------+--> ERROR
 * any state except DISABLED --disable()--> DISABLED --enable()--> NOT_INITIALIZED
 * </pre>
 */
public enum PluginState {
    NOT_INITIALIZED,
    INITIALIZING,
    INITIALIZED,
    STARTED,
    STOPPED,
    ERROR,
    DISABLED;

    public boolean canStart() {
        return this == INITIALIZED || this == STOPPED;
    }

    public boolean isActive() {
        return this == STARTED;
    }

    /** ERROR and DISABLED: the plugin takes no further part until enabled or reloaded. */
    public boolean isTerminal() {
        return this == ERROR || this == DISABLED;
    }
}
