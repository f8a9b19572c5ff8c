package com.geoengine.plugin.analysis;

import com.geoengine.plugin.CancellationSignal;
import com.geoengine.plugin.ValidationResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Long-running computation over engine data.
 * <p>
 * {@link #validateParameters(Map)} has no side effects. {@link #execute} should poll the
 * cancellation signal and either return a cancelled result or throw
 * {@link com.geoengine.plugin.PluginCancelledException}; the host settles the caller's future
 * as cancelled as soon as the signal is raised either way.
 */
public interface AnalysisExtension {

    String getAnalysisName();

    List<AnalysisParameter> getParameters();

    /** Checks {@code parameters} against {@link #getParameters()}; plugins may add their own rules. */
    default ValidationResult validateParameters(Map<String, Object> parameters) {
        return AnalysisParameters.validate(getParameters(), parameters);
    }

    CompletableFuture<AnalysisResult> execute(Map<String, Object> parameters,
                                              CancellationSignal cancellation,
                                              ProgressListener progress);
}
