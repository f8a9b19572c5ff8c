package com.geoengine.plugin.analysis;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of an analysis run. A cancelled run is unsuccessful and flagged {@link #isCancelled()}.
 */
public final class AnalysisResult {

    private final boolean success;
    private final boolean cancelled;
    private final String errorMessage;
    private final Map<String, Object> results;
    private final Duration executionTime;

    private AnalysisResult(boolean success, boolean cancelled, String errorMessage,
                           Map<String, Object> results, Duration executionTime) {
        this.success = success;
        this.cancelled = cancelled;
        this.errorMessage = errorMessage;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.executionTime = executionTime != null ? executionTime : Duration.ZERO;
    }

    public static AnalysisResult success(Map<String, Object> results, Duration executionTime) {
        return new AnalysisResult(true, false, null, Objects.requireNonNull(results, "results"), executionTime);
    }

    public static AnalysisResult failure(String errorMessage, Duration executionTime) {
        return new AnalysisResult(false, false, Objects.requireNonNull(errorMessage, "errorMessage"), Map.of(), executionTime);
    }

    public static AnalysisResult cancelled(Duration executionTime) {
        return new AnalysisResult(false, true, "Cancelled", Map.of(), executionTime);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Null on success. */
    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getResults() {
        return results;
    }

    public Duration getExecutionTime() {
        return executionTime;
    }

    /** Copy with a different execution time. */
    public AnalysisResult withExecutionTime(Duration executionTime) {
        return new AnalysisResult(success, cancelled, errorMessage, results, executionTime);
    }

    @Override
    public String toString() {
        if (success) {
            return "AnalysisResult[success, " + results.keySet() + ", " + executionTime.toMillis() + "ms]";
        }
        return "AnalysisResult[" + (cancelled ? "cancelled" : "failed: " + errorMessage) + "]";
    }
}
