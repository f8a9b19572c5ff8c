package com.geoengine.plugin;

import com.geoengine.data.layer.LayerCollection;
import com.geoengine.plugin.event.EventBus;
import org.slf4j.Logger;

import java.util.concurrent.Executor;

/**
 * Everything a plugin may reach in the host. One instance per plugin, handed over at
 * {@link Plugin#initialize(PluginContext)} and valid for the plugin's lifetime.
 */
public interface PluginContext {

    MapCanvas getMapCanvas();

    /** Layer collection shared with the host and every other plugin. */
    LayerCollection getLayers();

    PluginLookup getPluginManager();

    EventBus getEventBus();

    /** Logger scoped to this plugin. */
    Logger getLogger();

    /** Directory reserved for this plugin's files; created on first use. */
    String getDataDirectory();

    /** Host-owned executor for the plugin's background work; shut down with the host. */
    Executor getExecutor();
}
