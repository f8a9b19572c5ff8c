package com.geoengine.tool.measure;

import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginProvider;

public class MeasureToolProvider implements PluginProvider {

    @Override
    public String getPluginId() {
        return MeasureToolPlugin.PLUGIN_ID;
    }

    @Override
    public Plugin createPlugin() {
        return new MeasureToolPlugin();
    }
}
