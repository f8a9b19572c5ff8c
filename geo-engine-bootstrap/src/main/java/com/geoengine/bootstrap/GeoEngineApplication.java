package com.geoengine.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Headless engine entry point. Configuration comes from the environment (see
 * {@link com.geoengine.config.EngineConfig}); the main thread blocks until the JVM is asked to exit,
 * and a shutdown hook stops and unloads all plugins.
 */
public final class GeoEngineApplication {

    private static final Logger log = LoggerFactory.getLogger(GeoEngineApplication.class);

    private GeoEngineApplication() {
    }

    public static void main(String[] args) {
        EngineRuntime runtime = EngineBootstrap.initialize();
        log.info("Engine started; plugins running: {}", runtime.getStartupReport().getStarted());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down engine...");
            runtime.close();
        }, "geo-engine-shutdown"));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down engine...");
            runtime.close();
        }
    }
}
