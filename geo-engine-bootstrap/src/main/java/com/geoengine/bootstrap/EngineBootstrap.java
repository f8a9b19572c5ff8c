package com.geoengine.bootstrap;

import com.geoengine.config.EngineConfig;
import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginProvider;
import com.geoengine.runtime.PluginLoader;
import com.geoengine.runtime.PluginManager;
import com.geoengine.runtime.RegistrationReport;
import com.geoengine.runtime.StartupReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds and starts the engine: configuration, plugin manager, internal plugins, community plugins
 * from the plugins directory, then dependency-ordered startup.
 */
public final class EngineBootstrap {

    private static final Logger log = LoggerFactory.getLogger(EngineBootstrap.class);

    private EngineBootstrap() {
    }

    /** {@link #initialize(EngineConfig)} with configuration from the environment. */
    public static EngineRuntime initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(EngineConfig.fromEnvironment());
    }

    /**
     * Registers internal plugins (any failure is fatal), loads community plugins (failures are
     * logged and skipped) and starts everything. Plugins that fail to start are reported, not thrown.
     */
    public static EngineRuntime initialize(EngineConfig config) {
        log.info("Bootstrap: engine {} pluginsDir={} dataDir={} settingsDir={} parallelStartup={}",
                config.getEngineVersion(), config.getPluginsDir(), config.getPluginDataDir(),
                config.getPluginSettingsDir(), config.isParallelStartup());
        PluginManager manager = PluginManager.builder(config).build();
        PluginLoader loader = new PluginLoader();
        try {
            List<PluginProvider> internal = InternalPlugins.providers();
            List<Plugin> internalPlugins = loader.createPlugins(internal);
            if (internalPlugins.size() != internal.size()) {
                throw new IllegalStateException("Internal plugins failed to load: expected "
                        + internal.size() + ", got " + internalPlugins.size());
            }
            for (Plugin plugin : internalPlugins) {
                manager.register(plugin);
            }

            List<Plugin> community = loader.loadFromDirectory(config.getPluginsDir());
            RegistrationReport report = manager.registerAll(community);
            report.getRejected().forEach((id, e) ->
                    log.error("Community plugin {} rejected (skipping): {}", id, e.getMessage()));
            log.info("Plugins: {} internal, {} community", internalPlugins.size(), report.getAccepted().size());

            StartupReport startup = manager.startAll().join();
            if (!startup.isComplete()) {
                log.warn("Some plugins did not start: {}", startup.getNotStarted());
            }
            return new EngineRuntime(config, manager, startup);
        } catch (RuntimeException e) {
            log.error("Bootstrap failed: {}", e.getMessage(), e);
            manager.shutdown();
            throw e;
        }
    }
}
