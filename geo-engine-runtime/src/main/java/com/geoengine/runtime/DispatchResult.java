package com.geoengine.runtime;

import java.util.Optional;

/**
 * Result of dispatching one input event to the active tools: whether a tool claimed it and which.
 */
public final class DispatchResult {

    private static final DispatchResult UNHANDLED = new DispatchResult(null);

    private final String pluginId;

    private DispatchResult(String pluginId) {
        this.pluginId = pluginId;
    }

    public static DispatchResult handled(String pluginId) {
        if (pluginId == null) {
            throw new IllegalArgumentException("pluginId must not be null");
        }
        return new DispatchResult(pluginId);
    }

    public static DispatchResult unhandled() {
        return UNHANDLED;
    }

    public boolean isHandled() {
        return pluginId != null;
    }

    /** Id of the plugin whose tool claimed the event. */
    public Optional<String> getPluginId() {
        return Optional.ofNullable(pluginId);
    }

    @Override
    public String toString() {
        return pluginId != null ? "DispatchResult[handled by " + pluginId + "]" : "DispatchResult[unhandled]";
    }
}
