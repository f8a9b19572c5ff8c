package com.geoengine.runtime;

import com.geoengine.plugin.InvalidStateException;
import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginExecutionException;
import com.geoengine.plugin.PluginLookup;
import com.geoengine.plugin.PluginState;
import com.geoengine.plugin.tool.MapKeyEvent;
import com.geoengine.plugin.tool.MapMouseEvent;
import com.geoengine.plugin.tool.ToolExtension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Routes map input to active tools. The most recently activated tool is offered each event
 * first; the first handler returning true claims it. Tools whose plugin is no longer STARTED
 * are skipped, and a handler that throws is logged and treated as not handling the event.
 * <p>
 * Dispatch runs on the caller's thread.
 */
public final class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final PluginLookup plugins;
    private final Deque<String> active = new ArrayDeque<>();

    public ToolDispatcher(PluginLookup plugins) {
        if (plugins == null) {
            throw new IllegalArgumentException("plugins must not be null");
        }
        this.plugins = plugins;
    }

    /**
     * Activates the tool of {@code pluginId} and puts it in front of the dispatch order.
     *
     * @throws IllegalArgumentException when the plugin is unknown
     * @throws InvalidStateException when the plugin is not STARTED
     * @throws PluginExecutionException when the plugin has no tool
     */
    public void activate(String pluginId) {
        Plugin plugin = plugins.getPlugin(pluginId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown plugin: " + pluginId));
        if (plugin.getState() != PluginState.STARTED) {
            throw new InvalidStateException(pluginId, plugin.getState(), "activate tool");
        }
        ToolExtension tool = plugin.getExtension(ToolExtension.class)
                .orElseThrow(() -> new PluginExecutionException(pluginId, "Plugin " + pluginId + " is not a tool"));
        synchronized (active) {
            active.remove(pluginId);
            active.addFirst(pluginId);
        }
        tool.activate();
        log.info("Activated tool {} ({})", tool.getToolName(), pluginId);
    }

    /** Deactivates the tool of {@code pluginId}; false when it was not active. */
    public boolean deactivate(String pluginId) {
        boolean removed;
        synchronized (active) {
            removed = active.remove(pluginId);
        }
        if (removed) {
            toolOf(pluginId).ifPresent(tool -> {
                try {
                    tool.deactivate();
                } catch (RuntimeException e) {
                    log.warn("Tool {} failed to deactivate: {}", pluginId, e.getMessage(), e);
                }
            });
        }
        return removed;
    }

    /** Active tool plugin ids, most recent first. */
    public List<String> getActiveTools() {
        synchronized (active) {
            return new ArrayList<>(active);
        }
    }

    public DispatchResult dispatchMouseDown(MapMouseEvent event) {
        return dispatch("mouseDown", tool -> tool.onMouseDown(event));
    }

    public DispatchResult dispatchMouseMove(MapMouseEvent event) {
        return dispatch("mouseMove", tool -> tool.onMouseMove(event));
    }

    public DispatchResult dispatchMouseUp(MapMouseEvent event) {
        return dispatch("mouseUp", tool -> tool.onMouseUp(event));
    }

    public DispatchResult dispatchKeyDown(MapKeyEvent event) {
        return dispatch("keyDown", tool -> tool.onKeyDown(event));
    }

    private DispatchResult dispatch(String eventName, Predicate<ToolExtension> handler) {
        for (String pluginId : getActiveTools()) {
            Optional<ToolExtension> tool = toolOf(pluginId);
            if (tool.isEmpty()) {
                continue;
            }
            try {
                if (handler.test(tool.get())) {
                    return DispatchResult.handled(pluginId);
                }
            } catch (RuntimeException e) {
                log.error("Tool {} failed handling {} (skipping): {}", pluginId, eventName, e.getMessage(), e);
            }
        }
        return DispatchResult.unhandled();
    }

    private Optional<ToolExtension> toolOf(String pluginId) {
        return plugins.getPlugin(pluginId)
                .filter(p -> p.getState() == PluginState.STARTED)
                .flatMap(p -> p.getExtension(ToolExtension.class));
    }
}
