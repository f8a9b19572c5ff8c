package com.geoengine.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot cooperative cancellation flag. Work polls {@link #isCancelled()} or calls
 * {@link #throwIfCancelled(String)}; hosts may register callbacks that run once on cancel.
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    public boolean isCancelled() {
        return cancelled;
    }

    /** Raises the signal and runs registered callbacks; later calls do nothing. */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable r : toRun) {
            try {
                r.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed: {}", e.getMessage(), e);
            }
        }
    }

    /** Runs {@code callback} on cancel, or immediately when already cancelled. */
    public void onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    public void throwIfCancelled(String pluginId) {
        if (cancelled) {
            throw new PluginCancelledException(pluginId);
        }
    }
}
