package com.geoengine.runtime;

import com.geoengine.plugin.DependencyException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Start order for plugins whose dependencies are satisfiable, plus the reason every other
 * plugin was left out.
 */
public final class DependencyResolution {

    private final List<String> order;
    private final Map<String, DependencyException> failures;

    DependencyResolution(List<String> order, Map<String, DependencyException> failures) {
        this.order = List.copyOf(order);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /** Plugin ids with every dependency before its dependents. */
    public List<String> getOrder() {
        return order;
    }

    public Map<String, DependencyException> getFailures() {
        return failures;
    }

    public boolean isResolved(String pluginId) {
        return order.contains(pluginId);
    }

    @Override
    public String toString() {
        return "DependencyResolution[order=" + order + ", failed=" + failures.keySet() + "]";
    }
}
