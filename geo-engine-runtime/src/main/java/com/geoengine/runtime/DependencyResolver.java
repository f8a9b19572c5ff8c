package com.geoengine.runtime;

import com.geoengine.plugin.DependencyException;
import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders plugins so that each comes after its dependencies (depth-first post-order, visiting
 * plugins in registration order).
 * <p>
 * A plugin fails resolution when a dependency is not registered, is disabled or in ERROR, when it
 * sits on a dependency cycle (every member of the cycle fails), or when any dependency failed.
 * Plugins outside the affected subgraph are unaffected. Disabled and failed plugins are skipped.
 */
final class DependencyResolver {

    private enum Mark { VISITING, DONE }

    private final Map<String, Plugin> plugins;
    private final Map<String, Mark> marks = new HashMap<>();
    private final Map<String, DependencyException> failures = new LinkedHashMap<>();
    private final List<String> order = new ArrayList<>();
    private final Deque<String> path = new ArrayDeque<>();

    private DependencyResolver(Map<String, Plugin> plugins) {
        this.plugins = plugins;
    }

    /** @param plugins plugins by id, in registration order */
    static DependencyResolution resolve(Map<String, Plugin> plugins) {
        DependencyResolver resolver = new DependencyResolver(plugins);
        for (Plugin plugin : plugins.values()) {
            if (isAvailable(plugin)) {
                resolver.visit(plugin.getId());
            }
        }
        return new DependencyResolution(resolver.order, resolver.failures);
    }

    private static boolean isAvailable(Plugin plugin) {
        PluginState state = plugin.getState();
        return state != PluginState.DISABLED && state != PluginState.ERROR;
    }

    /** Returns true when {@code id} and all its dependencies resolved. */
    private boolean visit(String id) {
        if (failures.containsKey(id)) {
            return false;
        }
        Mark mark = marks.get(id);
        if (mark == Mark.DONE) {
            return true;
        }
        if (mark == Mark.VISITING) {
            failCycle(id);
            return false;
        }
        marks.put(id, Mark.VISITING);
        path.addLast(id);
        try {
            for (String dep : plugins.get(id).getDescriptor().getDependencies()) {
                Plugin target = plugins.get(dep);
                if (target == null) {
                    fail(id, "Plugin " + id + " depends on missing plugin " + dep);
                    return false;
                }
                if (!isAvailable(target)) {
                    fail(id, "Plugin " + id + " depends on " + dep + " which is " + target.getState());
                    return false;
                }
                if (!visit(dep)) {
                    fail(id, "Plugin " + id + " depends on " + dep + " which failed dependency resolution");
                    return false;
                }
            }
            order.add(id);
            return true;
        } finally {
            path.removeLast();
            marks.put(id, Mark.DONE);
        }
    }

    private void failCycle(String start) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String element : path) {
            if (element.equals(start)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(element);
            }
        }
        cycle.add(start);
        String message = "Dependency cycle detected: " + String.join(" -> ", cycle);
        for (String member : cycle) {
            failures.putIfAbsent(member, new DependencyException(member, message, cycle));
        }
    }

    private void fail(String id, String message) {
        failures.putIfAbsent(id, new DependencyException(id, message, new ArrayList<>(path)));
    }
}
