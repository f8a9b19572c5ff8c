package com.geoengine.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lifecycle state machine shared by all plugins. Subclasses implement the hooks
 * {@link #onInitialize(PluginContext)}, {@link #onStart()} and {@link #onStop()}; a hook that
 * throws or returns a failed future moves the plugin to ERROR.
 * <p>
 * At most one transition runs at a time; a second call while one is in flight fails with
 * {@link InvalidStateException}. {@link #disable()} and {@link #markFailed(Throwable)} win over
 * an in-flight transition: its completion no longer changes the state.
 */
public abstract class AbstractPlugin implements Plugin {

    private static final Logger log = LoggerFactory.getLogger(AbstractPlugin.class);

    private final PluginDescriptor descriptor;
    private final List<PluginStateListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean transitionInFlight = new AtomicBoolean();
    private final Object stateLock = new Object();

    private volatile PluginState state = PluginState.NOT_INITIALIZED;
    private volatile Throwable lastError;
    private volatile PluginContext context;
    private volatile CancellationSignal stopSignal = new CancellationSignal();
    private volatile PluginSettings stagedSettings;
    private volatile PluginSettings activeSettings;
    private volatile boolean settingsCreated;

    protected AbstractPlugin(PluginDescriptor descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    }

    @Override
    public final PluginDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public final PluginState getState() {
        return state;
    }

    @Override
    public final Throwable getLastError() {
        return lastError;
    }

    @Override
    public final CompletableFuture<Void> initialize(PluginContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        PluginState from = beginTransition("initialize", EnumSet.of(PluginState.NOT_INITIALIZED));
        this.context = context;
        if (transition(from, PluginState.INITIALIZING)) {
            fireStateChanged(from, PluginState.INITIALIZING);
        }
        return runHook(() -> onInitialize(context), PluginState.INITIALIZING, PluginState.INITIALIZED);
    }

    @Override
    public final CompletableFuture<Void> start() {
        PluginState from = beginTransition("start", EnumSet.of(PluginState.INITIALIZED, PluginState.STOPPED));
        stopSignal = new CancellationSignal();
        return runHook(() -> {
            ensureSettings();
            if (stagedSettings != null) {
                activeSettings = stagedSettings;
            }
            return onStart();
        }, from, PluginState.STARTED);
    }

    @Override
    public final CompletableFuture<Void> stop() {
        PluginState from = beginTransition("stop", EnumSet.of(PluginState.STARTED));
        stopSignal.cancel();
        return runHook(this::onStop, from, PluginState.STOPPED);
    }

    @Override
    public final void disable() {
        PluginState from;
        synchronized (stateLock) {
            from = state;
            if (from == PluginState.DISABLED) {
                throw new InvalidStateException(getId(), from, "disable");
            }
            state = PluginState.DISABLED;
        }
        stopSignal.cancel();
        fireStateChanged(from, PluginState.DISABLED);
    }

    @Override
    public final void enable() {
        synchronized (stateLock) {
            if (state != PluginState.DISABLED) {
                throw new InvalidStateException(getId(), state, "enable");
            }
            state = PluginState.NOT_INITIALIZED;
            lastError = null;
        }
        fireStateChanged(PluginState.DISABLED, PluginState.NOT_INITIALIZED);
    }

    @Override
    public final void markFailed(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        PluginState from;
        synchronized (stateLock) {
            from = state;
            if (from == PluginState.DISABLED) {
                throw new InvalidStateException(getId(), from, "fail");
            }
            if (from == PluginState.ERROR) {
                return;
            }
            lastError = cause;
            state = PluginState.ERROR;
        }
        stopSignal.cancel();
        fireStateChanged(from, PluginState.ERROR);
    }

    @Override
    public final Optional<PluginSettings> getSettings() {
        ensureSettings();
        return Optional.ofNullable(stagedSettings);
    }

    @Override
    public final void applySettings(PluginSettings settings) {
        Objects.requireNonNull(settings, "settings");
        ValidationResult result = settings.validate();
        if (!result.isValid()) {
            throw new IllegalArgumentException("Invalid settings for " + getId() + ": " + result.getMessage().orElse(""));
        }
        ensureSettings();
        stagedSettings = settings;
    }

    /** Settings in effect since the last start; staged settings before the first start. */
    protected final Optional<PluginSettings> getActiveSettings() {
        ensureSettings();
        return Optional.ofNullable(activeSettings != null ? activeSettings : stagedSettings);
    }

    @Override
    public <T> Optional<T> getExtension(Class<T> extensionType) {
        Objects.requireNonNull(extensionType, "extensionType");
        return extensionType.isInstance(this) ? Optional.of(extensionType.cast(this)) : Optional.empty();
    }

    @Override
    public final void addStateListener(PluginStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** Context received at initialize; null before. */
    protected final PluginContext getContext() {
        return context;
    }

    /** Signal raised by {@link #stop()}, {@link #disable()} or failure; replaced on each start. */
    protected final CancellationSignal getStopSignal() {
        return stopSignal;
    }

    protected final boolean isStopRequested() {
        return stopSignal.isCancelled();
    }

    /** Default settings for this plugin, or null when it has none. */
    protected PluginSettings createDefaultSettings() {
        return null;
    }

    protected CompletableFuture<Void> onInitialize(PluginContext context) {
        return CompletableFuture.completedFuture(null);
    }

    protected CompletableFuture<Void> onStart() {
        return CompletableFuture.completedFuture(null);
    }

    protected CompletableFuture<Void> onStop() {
        return CompletableFuture.completedFuture(null);
    }

    private void ensureSettings() {
        if (settingsCreated) {
            return;
        }
        synchronized (stateLock) {
            if (!settingsCreated) {
                stagedSettings = createDefaultSettings();
                settingsCreated = true;
            }
        }
    }

    private PluginState beginTransition(String operation, EnumSet<PluginState> allowed) {
        synchronized (stateLock) {
            PluginState current = state;
            if (!allowed.contains(current)) {
                throw new InvalidStateException(getId(), current, operation);
            }
            if (!transitionInFlight.compareAndSet(false, true)) {
                throw new InvalidStateException(getId(), current, operation, "another transition is in progress");
            }
            return current;
        }
    }

    private CompletableFuture<Void> runHook(Supplier<CompletableFuture<Void>> hook, PluginState expected, PluginState onSuccess) {
        CompletableFuture<Void> work;
        try {
            work = hook.get();
            if (work == null) {
                work = CompletableFuture.completedFuture(null);
            }
        } catch (RuntimeException | Error e) {
            work = CompletableFuture.failedFuture(e);
        }
        return work.handle((ignored, error) -> {
            try {
                if (error == null) {
                    if (transition(expected, onSuccess)) {
                        fireStateChanged(expected, onSuccess);
                    }
                    return null;
                }
                Throwable cause = unwrap(error);
                boolean failed;
                synchronized (stateLock) {
                    failed = state == expected;
                    if (failed) {
                        lastError = cause;
                        state = PluginState.ERROR;
                    }
                }
                stopSignal.cancel();
                if (failed) {
                    fireStateChanged(expected, PluginState.ERROR);
                }
                log.error("Plugin {} failed while moving from {} to {}: {}", getId(), expected, onSuccess, cause.getMessage(), cause);
                throw new CompletionException(cause instanceof PluginException ? cause
                        : new PluginExecutionException(getId(), cause.getMessage(), cause));
            } finally {
                transitionInFlight.set(false);
            }
        });
    }

    /** Sets {@code to} only if the state is still {@code from}. */
    private boolean transition(PluginState from, PluginState to) {
        synchronized (stateLock) {
            if (state != from) {
                return false;
            }
            state = to;
            return true;
        }
    }

    private void fireStateChanged(PluginState from, PluginState to) {
        log.debug("Plugin {} state {} -> {}", getId(), from, to);
        for (PluginStateListener l : listeners) {
            try {
                l.stateChanged(this, from, to);
            } catch (RuntimeException e) {
                log.warn("State listener failed for plugin {}: {}", getId(), e.getMessage(), e);
            }
        }
    }

    private static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getId() + ", " + state + "]";
    }
}
