package com.geoengine.plugin;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A unit of extension managed by the host.
 * <p>
 * Lifecycle methods check their precondition synchronously and throw
 * {@link InvalidStateException} when it does not hold; the returned future completes when the
 * transition's work finishes, exceptionally if it failed (the plugin is then in
 * {@link PluginState#ERROR}).
 * <p>
 * Capabilities beyond the lifecycle (tool input, analysis, data access) are queried with
 * {@link #getExtension(Class)}.
 *
 * @see AbstractPlugin
 */
public interface Plugin {

    PluginDescriptor getDescriptor();

    default String getId() {
        return getDescriptor().getId();
    }

    PluginState getState();

    /** First error that moved the plugin to ERROR, or null. */
    Throwable getLastError();

    /** NOT_INITIALIZED → INITIALIZING → INITIALIZED (or ERROR). */
    CompletableFuture<Void> initialize(PluginContext context);

    /** INITIALIZED or STOPPED → STARTED (or ERROR). Staged settings become active. */
    CompletableFuture<Void> start();

    /** STARTED → STOPPED (or ERROR). Raises the stop signal observed by in-flight work. */
    CompletableFuture<Void> stop();

    /** Any state except DISABLED → DISABLED. */
    void disable();

    /** DISABLED → NOT_INITIALIZED, clearing the last error; the plugin must be initialized again. */
    void enable();

    /** Moves to ERROR recording {@code cause}; an existing error is kept. */
    void markFailed(Throwable cause);

    /** Staged settings, or empty for plugins without settings. */
    Optional<PluginSettings> getSettings();

    /**
     * Stages {@code settings}; they take effect at the next {@link #start()}.
     *
     * @throws IllegalArgumentException when the settings do not validate
     */
    void applySettings(PluginSettings settings);

    <T> Optional<T> getExtension(Class<T> extensionType);

    void addStateListener(PluginStateListener listener);

    /** Releases resources; called once when the plugin is unloaded. */
    default void close() {
    }
}
