package com.geoengine.runtime;

import com.geoengine.data.layer.LayerCollection;
import com.geoengine.plugin.MapCanvas;
import com.geoengine.plugin.PluginContext;
import com.geoengine.plugin.PluginLookup;
import com.geoengine.plugin.event.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Context handed to one plugin. The logger is named {@code geoengine.plugin.<id>}; the data
 * directory is {@code <pluginDataDir>/<id>} and is created on first access.
 */
public final class DefaultPluginContext implements PluginContext {

    private static final String LOGGER_PREFIX = "geoengine.plugin.";

    private final MapCanvas mapCanvas;
    private final LayerCollection layers;
    private final PluginLookup pluginManager;
    private final EventBus eventBus;
    private final Logger logger;
    private final Path dataDirectory;
    private final Executor executor;

    public DefaultPluginContext(String pluginId, MapCanvas mapCanvas, LayerCollection layers,
                                PluginLookup pluginManager, EventBus eventBus, Path pluginDataRoot,
                                Executor executor) {
        Objects.requireNonNull(pluginId, "pluginId");
        this.mapCanvas = Objects.requireNonNull(mapCanvas, "mapCanvas");
        this.layers = Objects.requireNonNull(layers, "layers");
        this.pluginManager = Objects.requireNonNull(pluginManager, "pluginManager");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.logger = LoggerFactory.getLogger(LOGGER_PREFIX + pluginId);
        this.dataDirectory = Objects.requireNonNull(pluginDataRoot, "pluginDataRoot").resolve(pluginId);
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public MapCanvas getMapCanvas() {
        return mapCanvas;
    }

    @Override
    public LayerCollection getLayers() {
        return layers;
    }

    @Override
    public PluginLookup getPluginManager() {
        return pluginManager;
    }

    @Override
    public EventBus getEventBus() {
        return eventBus;
    }

    @Override
    public Logger getLogger() {
        return logger;
    }

    @Override
    public String getDataDirectory() {
        try {
            Files.createDirectories(dataDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create plugin data directory " + dataDirectory, e);
        }
        return dataDirectory.toString();
    }

    @Override
    public Executor getExecutor() {
        return executor;
    }
}
