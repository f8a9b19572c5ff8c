package com.geoengine.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineConfigTest {

    @Test
    void fromEnvironment_appliesDefaultsWhenUnset() {
        EngineConfig config = EngineConfig.fromEnvironment(key -> null);

        assertEquals(EngineConfig.DEFAULT_ENGINE_VERSION, config.getEngineVersion());
        assertEquals(Path.of("plugins"), config.getPluginsDir());
        assertEquals(Path.of("plugin-data"), config.getPluginDataDir());
        assertEquals(Path.of("plugin-settings"), config.getPluginSettingsDir());
        assertFalse(config.isParallelStartup());
        assertEquals(30, config.getStopTimeoutSeconds());
        assertTrue(config.getDisabledPlugins().isEmpty());
    }

    @Test
    void fromEnvironment_readsVariables() {
        Map<String, String> env = Map.of(
                "GEO_ENGINE_VERSION", " 1.5 ",
                "GEO_PLUGINS_DIR", "/opt/geo/plugins",
                "GEO_PLUGIN_PARALLEL_STARTUP", "1",
                "GEO_PLUGIN_STOP_TIMEOUT_SECONDS", "5",
                "GEO_DISABLED_PLUGINS", "a, b,,c");

        EngineConfig config = EngineConfig.fromEnvironment(env::get);

        assertEquals("1.5", config.getEngineVersion());
        assertEquals(Path.of("/opt/geo/plugins"), config.getPluginsDir());
        assertTrue(config.isParallelStartup());
        assertEquals(5, config.getStopTimeoutSeconds());
        assertEquals(List.of("a", "b", "c"), config.getDisabledPlugins());
    }

    @Test
    void fromEnvironment_ignoresMalformedNumbers() {
        EngineConfig config = EngineConfig.fromEnvironment(Map.of("GEO_PLUGIN_STOP_TIMEOUT_SECONDS", "soon")::get);

        assertEquals(30, config.getStopTimeoutSeconds());
    }

    @Test
    void builder_leavesOptionalDirectoriesUnset() {
        EngineConfig config = EngineConfig.builder().engineVersion("2.0").build();

        assertNull(config.getPluginsDir());
        assertNull(config.getPluginSettingsDir());
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().stopTimeoutSeconds(0));
    }
}
