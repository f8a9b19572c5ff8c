package com.geoengine.bootstrap;

import com.geoengine.config.EngineConfig;
import com.geoengine.runtime.AnalysisExecutor;
import com.geoengine.runtime.PluginManager;
import com.geoengine.runtime.StartupReport;
import com.geoengine.runtime.ToolDispatcher;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A started engine: the configuration it was built from, its plugin manager and the services
 * hosts use to drive plugins. {@link #close()} stops and unloads every plugin once.
 */
public final class EngineRuntime implements AutoCloseable {

    private final EngineConfig config;
    private final PluginManager pluginManager;
    private final ToolDispatcher toolDispatcher;
    private final AnalysisExecutor analysisExecutor;
    private final StartupReport startupReport;
    private final AtomicBoolean closed = new AtomicBoolean();

    EngineRuntime(EngineConfig config, PluginManager pluginManager, StartupReport startupReport) {
        this.config = Objects.requireNonNull(config, "config");
        this.pluginManager = Objects.requireNonNull(pluginManager, "pluginManager");
        this.toolDispatcher = new ToolDispatcher(pluginManager);
        this.analysisExecutor = new AnalysisExecutor(pluginManager);
        this.startupReport = startupReport;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public PluginManager getPluginManager() {
        return pluginManager;
    }

    public ToolDispatcher getToolDispatcher() {
        return toolDispatcher;
    }

    public AnalysisExecutor getAnalysisExecutor() {
        return analysisExecutor;
    }

    public StartupReport getStartupReport() {
        return startupReport;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            pluginManager.shutdown();
        }
    }
}
