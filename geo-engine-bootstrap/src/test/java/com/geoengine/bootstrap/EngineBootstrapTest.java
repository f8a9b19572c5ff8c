package com.geoengine.bootstrap;

import com.geoengine.analysis.statistics.AttributeStatisticsPlugin;
import com.geoengine.config.EngineConfig;
import com.geoengine.data.AttributeTable;
import com.geoengine.data.Feature;
import com.geoengine.data.FeatureStore;
import com.geoengine.geometry.jts.JtsGeometry;
import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginState;
import com.geoengine.plugin.analysis.AnalysisResult;
import com.geoengine.plugin.provider.DataProviderCapability;
import com.geoengine.plugin.provider.DataProviderExtension;
import com.geoengine.plugin.tool.MapMouseEvent;
import com.geoengine.plugin.tool.MouseButton;
import com.geoengine.provider.memory.InMemoryDataProviderPlugin;
import com.geoengine.tool.measure.MeasureToolPlugin;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineBootstrapTest {

    @TempDir
    Path dir;

    private EngineConfig config(List<String> disabled) {
        return EngineConfig.builder()
                .pluginsDir(dir.resolve("plugins").toString())
                .pluginDataDir(dir.resolve("data").toString())
                .pluginSettingsDir(dir.resolve("settings").toString())
                .disabledPlugins(disabled)
                .build();
    }

    @Test
    void initialize_startsInternalPlugins() {
        try (EngineRuntime runtime = EngineBootstrap.initialize(config(List.of()))) {
            assertTrue(runtime.getStartupReport().isComplete());
            assertEquals(Set.of(InMemoryDataProviderPlugin.PLUGIN_ID, MeasureToolPlugin.PLUGIN_ID,
                    AttributeStatisticsPlugin.PLUGIN_ID), Set.copyOf(runtime.getStartupReport().getStarted()));
        }
    }

    @Test
    void pluginsWorkTogether() {
        try (EngineRuntime runtime = EngineBootstrap.initialize(config(List.of()))) {
            DataProviderExtension memory = runtime.getPluginManager()
                    .findDataProviders(DataProviderCapability.CREATE).get(0);
            FeatureStore parcels = memory.open("memory://parcels", Map.of("create", "true")).orElseThrow();
            parcels.add(new Feature(JtsGeometry.point(0, 0), AttributeTable.of("area", 10)));
            parcels.add(new Feature(JtsGeometry.point(1, 1), AttributeTable.of("area", 30)));

            AnalysisResult result = runtime.getAnalysisExecutor().execute(AttributeStatisticsPlugin.PLUGIN_ID,
                    Map.of("layer", "parcels", "attribute", "area"), null, null).join();
            assertTrue(result.isSuccess());
            assertEquals(20.0, (Double) result.getResults().get("mean"), 1e-9);

            runtime.getToolDispatcher().activate(MeasureToolPlugin.PLUGIN_ID);
            assertTrue(runtime.getToolDispatcher()
                    .dispatchMouseDown(MapMouseEvent.at(0, 0, MouseButton.LEFT, 0, 0)).isHandled());
        }
    }

    @Test
    void close_stopsPluginsAndSavesSettings() {
        EngineRuntime runtime = EngineBootstrap.initialize(config(List.of()));
        Plugin measure = runtime.getPluginManager().getPlugin(MeasureToolPlugin.PLUGIN_ID).orElseThrow();

        runtime.close();
        runtime.close();

        assertTrue(runtime.isClosed());
        assertEquals(PluginState.STOPPED, measure.getState());
        assertTrue(Files.isRegularFile(dir.resolve("settings").resolve(MeasureToolPlugin.PLUGIN_ID + ".json")));
        assertTrue(runtime.getPluginManager().getPlugins().isEmpty());
    }

    @Test
    void initialize_honoursDisabledPlugins() {
        try (EngineRuntime runtime = EngineBootstrap.initialize(config(List.of(MeasureToolPlugin.PLUGIN_ID)))) {
            assertEquals(Map.of(MeasureToolPlugin.PLUGIN_ID, PluginState.DISABLED),
                    runtime.getStartupReport().getNotStarted());
            assertTrue(runtime.getToolDispatcher().getActiveTools().isEmpty());
        }
    }
}
