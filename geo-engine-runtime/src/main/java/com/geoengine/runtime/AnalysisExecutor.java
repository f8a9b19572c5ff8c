package com.geoengine.runtime;

import com.geoengine.plugin.CancellationSignal;
import com.geoengine.plugin.InvalidStateException;
import com.geoengine.plugin.Plugin;
import com.geoengine.plugin.PluginCancelledException;
import com.geoengine.plugin.PluginExecutionException;
import com.geoengine.plugin.PluginLookup;
import com.geoengine.plugin.PluginState;
import com.geoengine.plugin.ValidationResult;
import com.geoengine.plugin.analysis.AnalysisExtension;
import com.geoengine.plugin.analysis.AnalysisParameters;
import com.geoengine.plugin.analysis.AnalysisResult;
import com.geoengine.plugin.analysis.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs analyses of started plugins. Parameters are validated (and defaults filled in) before the
 * plugin sees them; invalid parameters, plugin failures and cancellation are all reported as an
 * {@link AnalysisResult} rather than a failed future.
 */
public final class AnalysisExecutor {

    private static final Logger log = LoggerFactory.getLogger(AnalysisExecutor.class);

    private final PluginLookup plugins;

    public AnalysisExecutor(PluginLookup plugins) {
        if (plugins == null) {
            throw new IllegalArgumentException("plugins must not be null");
        }
        this.plugins = plugins;
    }

    public ValidationResult validate(String pluginId, Map<String, Object> parameters) {
        return analysisOf(pluginId, false).validateParameters(parameters != null ? parameters : Map.of());
    }

    /**
     * Executes the analysis of {@code pluginId}. Raising {@code cancellation} settles the returned
     * future with a cancelled result immediately, even if the plugin keeps running.
     *
     * @throws IllegalArgumentException when the plugin is unknown
     * @throws PluginExecutionException when the plugin has no analysis
     * @throws InvalidStateException when the plugin is not STARTED
     */
    public CompletableFuture<AnalysisResult> execute(String pluginId, Map<String, Object> parameters,
                                                     CancellationSignal cancellation, ProgressListener progress) {
        AnalysisExtension analysis = analysisOf(pluginId, true);
        Map<String, Object> supplied = parameters != null ? parameters : Map.of();
        CancellationSignal signal = cancellation != null ? cancellation : new CancellationSignal();
        long startNanos = System.nanoTime();

        ValidationResult validation = analysis.validateParameters(supplied);
        if (!validation.isValid()) {
            log.warn("Analysis {} rejected parameters: {}", pluginId, validation.getErrors());
            return CompletableFuture.completedFuture(
                    AnalysisResult.failure(validation.getMessage().orElse("Invalid parameters"), Duration.ZERO));
        }
        Map<String, Object> effective = AnalysisParameters.withDefaults(analysis.getParameters(), supplied);

        CompletableFuture<AnalysisResult> result = new CompletableFuture<>();
        signal.onCancel(() -> {
            if (result.complete(AnalysisResult.cancelled(elapsedSince(startNanos)))) {
                log.info("Analysis {} cancelled", pluginId);
            }
        });

        log.info("Running analysis {} ({}) with {}", analysis.getAnalysisName(), pluginId, effective.keySet());
        CompletableFuture<AnalysisResult> work;
        try {
            work = analysis.execute(effective, signal, guarded(pluginId, progress));
        } catch (RuntimeException e) {
            work = CompletableFuture.failedFuture(e);
        }
        if (work == null) {
            work = CompletableFuture.failedFuture(new PluginExecutionException(pluginId, "Analysis returned no result"));
        }
        work.whenComplete((r, error) -> {
            Duration elapsed = elapsedSince(startNanos);
            if (error == null) {
                AnalysisResult out = r != null ? r : AnalysisResult.failure("Analysis returned no result", elapsed);
                if (out.getExecutionTime().isZero()) {
                    out = out.withExecutionTime(elapsed);
                }
                result.complete(out);
                return;
            }
            Throwable cause = PluginManager.unwrap(error);
            if (cause instanceof PluginCancelledException || signal.isCancelled()) {
                result.complete(AnalysisResult.cancelled(elapsed));
            } else {
                log.error("Analysis {} failed: {}", pluginId, cause.getMessage(), cause);
                result.complete(AnalysisResult.failure(
                        cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), elapsed));
            }
        });
        return result;
    }

    private AnalysisExtension analysisOf(String pluginId, boolean requireStarted) {
        Plugin plugin = plugins.getPlugin(pluginId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown plugin: " + pluginId));
        AnalysisExtension analysis = plugin.getExtension(AnalysisExtension.class)
                .orElseThrow(() -> new PluginExecutionException(pluginId, "Plugin " + pluginId + " is not an analysis"));
        if (requireStarted && plugin.getState() != PluginState.STARTED) {
            throw new InvalidStateException(pluginId, plugin.getState(), "execute analysis");
        }
        return analysis;
    }

    private static ProgressListener guarded(String pluginId, ProgressListener listener) {
        if (listener == null) {
            return ProgressListener.NONE;
        }
        return event -> {
            try {
                listener.onProgress(event);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed for analysis {}: {}", pluginId, e.getMessage(), e);
            }
        };
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
