package com.geoengine.analysis.statistics;

import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginProvider;

public class AttributeStatisticsProvider implements PluginProvider {

    @Override
    public String getPluginId() {
        return AttributeStatisticsPlugin.PLUGIN_ID;
    }

    @Override
    public Plugin createPlugin() {
        return new AttributeStatisticsPlugin();
    }
}
