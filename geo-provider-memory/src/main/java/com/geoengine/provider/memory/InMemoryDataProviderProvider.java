package com.geoengine.provider.memory;

import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginProvider;

public class InMemoryDataProviderProvider implements PluginProvider {

    @Override
    public String getPluginId() {
        return InMemoryDataProviderPlugin.PLUGIN_ID;
    }

    @Override
    public Plugin createPlugin() {
        return new InMemoryDataProviderPlugin();
    }
}
