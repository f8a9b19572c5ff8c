package com.geoengine.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Engine configuration loaded from environment variables.
 * <p>
 * Host version: GEO_ENGINE_VERSION (compared against each plugin's minimum engine version).
 * Directories: GEO_PLUGINS_DIR (community plugin JARs), GEO_PLUGIN_DATA_DIR (per-plugin data),
 * GEO_PLUGIN_SETTINGS_DIR (persisted plugin settings).
 * Startup: GEO_PLUGIN_PARALLEL_STARTUP, GEO_PLUGIN_STOP_TIMEOUT_SECONDS, GEO_DISABLED_PLUGINS (comma-separated ids).
 */
public final class EngineConfig {

    private static final String ENV_ENGINE_VERSION = "GEO_ENGINE_VERSION";
    private static final String ENV_PLUGINS_DIR = "GEO_PLUGINS_DIR";
    private static final String ENV_PLUGIN_DATA_DIR = "GEO_PLUGIN_DATA_DIR";
    private static final String ENV_PLUGIN_SETTINGS_DIR = "GEO_PLUGIN_SETTINGS_DIR";
    private static final String ENV_PARALLEL_STARTUP = "GEO_PLUGIN_PARALLEL_STARTUP";
    private static final String ENV_STOP_TIMEOUT_SECONDS = "GEO_PLUGIN_STOP_TIMEOUT_SECONDS";
    private static final String ENV_DISABLED_PLUGINS = "GEO_DISABLED_PLUGINS";

    public static final String DEFAULT_ENGINE_VERSION = "1.0.0";
    private static final String DEFAULT_PLUGINS_DIR = "plugins";
    private static final String DEFAULT_PLUGIN_DATA_DIR = "plugin-data";
    private static final String DEFAULT_PLUGIN_SETTINGS_DIR = "plugin-settings";
    private static final int DEFAULT_STOP_TIMEOUT_SECONDS = 30;

    private final String engineVersion;
    private final String pluginsDir;
    private final String pluginDataDir;
    private final String pluginSettingsDir;
    private final boolean parallelStartup;
    private final int stopTimeoutSeconds;
    private final List<String> disabledPlugins;

    private EngineConfig(Builder b) {
        this.engineVersion = b.engineVersion;
        this.pluginsDir = b.pluginsDir;
        this.pluginDataDir = b.pluginDataDir;
        this.pluginSettingsDir = b.pluginSettingsDir;
        this.parallelStartup = b.parallelStartup;
        this.stopTimeoutSeconds = b.stopTimeoutSeconds;
        this.disabledPlugins = Collections.unmodifiableList(new ArrayList<>(b.disabledPlugins));
    }

    /** Version this host reports to plugins, e.g. {@code 1.5.0}. */
    public String getEngineVersion() {
        return engineVersion;
    }

    /** Directory scanned for community plugin JARs; null disables JAR loading. */
    public Path getPluginsDir() {
        return pluginsDir != null ? Path.of(pluginsDir) : null;
    }

    public Path getPluginDataDir() {
        return Path.of(pluginDataDir);
    }

    /** Directory holding {@code <pluginId>.json} settings files; null disables persistence. */
    public Path getPluginSettingsDir() {
        return pluginSettingsDir != null ? Path.of(pluginSettingsDir) : null;
    }

    /** When true, independent dependency subgraphs start concurrently. */
    public boolean isParallelStartup() {
        return parallelStartup;
    }

    /** Upper bound for a single plugin's stop during shutdown. */
    public int getStopTimeoutSeconds() {
        return stopTimeoutSeconds;
    }

    /** Plugin ids registered in the disabled state. */
    public List<String> getDisabledPlugins() {
        return disabledPlugins;
    }

    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Same as {@link #fromEnvironment()} with an explicit variable lookup. */
    public static EngineConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .engineVersion(getEnv(env, ENV_ENGINE_VERSION, DEFAULT_ENGINE_VERSION))
                .pluginsDir(getEnv(env, ENV_PLUGINS_DIR, DEFAULT_PLUGINS_DIR))
                .pluginDataDir(getEnv(env, ENV_PLUGIN_DATA_DIR, DEFAULT_PLUGIN_DATA_DIR))
                .pluginSettingsDir(getEnv(env, ENV_PLUGIN_SETTINGS_DIR, DEFAULT_PLUGIN_SETTINGS_DIR))
                .parallelStartup(parseBoolean(env.apply(ENV_PARALLEL_STARTUP), false))
                .stopTimeoutSeconds(parseInt(env.apply(ENV_STOP_TIMEOUT_SECONDS), DEFAULT_STOP_TIMEOUT_SECONDS))
                .disabledPlugins(parseCommaSeparated(env.apply(ENV_DISABLED_PLUGINS)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return v != null && !v.isBlank() ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String engineVersion = DEFAULT_ENGINE_VERSION;
        private String pluginsDir;
        private String pluginDataDir = DEFAULT_PLUGIN_DATA_DIR;
        private String pluginSettingsDir;
        private boolean parallelStartup;
        private int stopTimeoutSeconds = DEFAULT_STOP_TIMEOUT_SECONDS;
        private List<String> disabledPlugins = List.of();

        public Builder engineVersion(String engineVersion) {
            this.engineVersion = Objects.requireNonNull(engineVersion, "engineVersion");
            return this;
        }

        public Builder pluginsDir(String pluginsDir) {
            this.pluginsDir = pluginsDir;
            return this;
        }

        public Builder pluginDataDir(String pluginDataDir) {
            this.pluginDataDir = Objects.requireNonNull(pluginDataDir, "pluginDataDir");
            return this;
        }

        public Builder pluginSettingsDir(String pluginSettingsDir) {
            this.pluginSettingsDir = pluginSettingsDir;
            return this;
        }

        public Builder parallelStartup(boolean parallelStartup) {
            this.parallelStartup = parallelStartup;
            return this;
        }

        public Builder stopTimeoutSeconds(int stopTimeoutSeconds) {
            if (stopTimeoutSeconds <= 0) {
                throw new IllegalArgumentException("stopTimeoutSeconds must be positive");
            }
            this.stopTimeoutSeconds = stopTimeoutSeconds;
            return this;
        }

        public Builder disabledPlugins(List<String> disabledPlugins) {
            this.disabledPlugins = disabledPlugins != null ? disabledPlugins : List.of();
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
