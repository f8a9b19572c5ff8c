package com.geoengine.runtime;

import com.geoengine.plugin.PluginState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link PluginManager#startAll()}: the ids that reached STARTED, in start order, and
 * the final state of every plugin that did not.
 */
public final class StartupReport {

    private final List<String> started;
    private final Map<String, PluginState> notStarted;

    StartupReport(List<String> started, Map<String, PluginState> notStarted) {
        this.started = List.copyOf(started);
        this.notStarted = Collections.unmodifiableMap(new LinkedHashMap<>(notStarted));
    }

    public List<String> getStarted() {
        return started;
    }

    public Map<String, PluginState> getNotStarted() {
        return notStarted;
    }

    public boolean isComplete() {
        return notStarted.isEmpty();
    }

    @Override
    public String toString() {
        return "StartupReport[started=" + started + ", notStarted=" + notStarted + "]";
    }
}
