package com.geoengine.plugin.event;

import com.geoengine.plugin.PluginState;

import java.util.Objects;

/**
 * Published by the plugin manager whenever a plugin is loaded, unloaded, changes state or fails.
 */
public final class PluginLifecycleEvent {

    public enum Kind {
        LOADED,
        UNLOADED,
        STATE_CHANGED,
        ERROR
    }

    /** Severity of {@link Kind#ERROR} events. */
    public enum Severity {
        INFO,
        WARNING,
        ERROR,
        FATAL
    }

    private final Kind kind;
    private final String pluginId;
    private final PluginState oldState;
    private final PluginState newState;
    private final Throwable error;
    private final Severity severity;

    private PluginLifecycleEvent(Kind kind, String pluginId, PluginState oldState, PluginState newState,
                                 Throwable error, Severity severity) {
        this.kind = kind;
        this.pluginId = Objects.requireNonNull(pluginId, "pluginId");
        this.oldState = oldState;
        this.newState = newState;
        this.error = error;
        this.severity = severity;
    }

    public static PluginLifecycleEvent loaded(String pluginId) {
        return new PluginLifecycleEvent(Kind.LOADED, pluginId, null, null, null, Severity.INFO);
    }

    public static PluginLifecycleEvent unloaded(String pluginId) {
        return new PluginLifecycleEvent(Kind.UNLOADED, pluginId, null, null, null, Severity.INFO);
    }

    public static PluginLifecycleEvent stateChanged(String pluginId, PluginState oldState, PluginState newState) {
        return new PluginLifecycleEvent(Kind.STATE_CHANGED, pluginId, oldState, newState, null, Severity.INFO);
    }

    public static PluginLifecycleEvent error(String pluginId, Throwable error, Severity severity) {
        return new PluginLifecycleEvent(Kind.ERROR, pluginId, null, null, error, severity);
    }

    public Kind getKind() {
        return kind;
    }

    public String getPluginId() {
        return pluginId;
    }

    public PluginState getOldState() {
        return oldState;
    }

    public PluginState getNewState() {
        return newState;
    }

    public Throwable getError() {
        return error;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        switch (kind) {
            case STATE_CHANGED:
                return "PluginLifecycleEvent[" + pluginId + " " + oldState + " -> " + newState + "]";
            case ERROR:
                return "PluginLifecycleEvent[" + pluginId + " " + severity + ": " + (error != null ? error.getMessage() : "") + "]";
            default:
                return "PluginLifecycleEvent[" + kind + " " + pluginId + "]";
        }
    }
}
