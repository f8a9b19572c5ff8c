package com.geoengine.bootstrap;

import com.geoengine.analysis.statistics.AttributeStatisticsProvider;
import com.geoengine.plugin.PluginProvider;
import com.geoengine.provider.memory.InMemoryDataProviderProvider;
import com.geoengine.tool.measure.MeasureToolProvider;

import java.util.List;

/**
 * Providers shipped with the engine. Unlike community plugins, a failure to create or register
 * one of these stops startup.
 */
public final class InternalPlugins {

    private InternalPlugins() {
    }

    public static List<PluginProvider> providers() {
        return List.of(
                new InMemoryDataProviderProvider(),
                new MeasureToolProvider(),
                new AttributeStatisticsProvider());
    }
}
