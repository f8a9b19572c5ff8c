package com.geoengine.analysis.statistics;

import com.geoengine.data.Feature;
import com.geoengine.data.layer.Layer;
import com.geoengine.plugin.AbstractPlugin;
import com.geoengine.plugin.CancellationSignal;
import com.geoengine.plugin.PluginContext;
import com.geoengine.plugin.PluginDescriptor;
import com.geoengine.plugin.PluginType;
import com.geoengine.plugin.ValidationResult;
import com.geoengine.plugin.analysis.AnalysisExtension;
import com.geoengine.plugin.analysis.AnalysisParameter;
import com.geoengine.plugin.analysis.AnalysisParameters;
import com.geoengine.plugin.analysis.AnalysisResult;
import com.geoengine.plugin.analysis.ProgressEvent;
import com.geoengine.plugin.analysis.ProgressListener;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Count, sum, min, max and mean of a numeric attribute over one layer. Values that are missing or
 * not numeric are counted as skipped. The run stops with a cancelled result when the caller's
 * signal is raised or the plugin is stopped.
 */
public final class AttributeStatisticsPlugin extends AbstractPlugin implements AnalysisExtension {

    public static final String PLUGIN_ID = "geo.statistics";

    static final String LAYER = "layer";
    static final String ATTRIBUTE = "attribute";

    private static final List<AnalysisParameter> PARAMETERS = List.of(
            AnalysisParameter.builder(LAYER, AnalysisParameter.DataType.LAYER)
                    .displayName("Layer")
                    .description("Layer whose features are read")
                    .required(true)
                    .build(),
            AnalysisParameter.builder(ATTRIBUTE, AnalysisParameter.DataType.STRING)
                    .displayName("Attribute")
                    .description("Numeric attribute to summarize")
                    .required(true)
                    .build());

    public AttributeStatisticsPlugin() {
        super(PluginDescriptor.builder(PLUGIN_ID)
                .name("Attribute Statistics")
                .description("Summary statistics of a numeric attribute")
                .version("1.0.0")
                .author("geo-engine")
                .type(PluginType.ANALYSIS)
                .build());
    }

    @Override
    public String getAnalysisName() {
        return "Attribute Statistics";
    }

    @Override
    public List<AnalysisParameter> getParameters() {
        return PARAMETERS;
    }

    @Override
    public ValidationResult validateParameters(Map<String, Object> parameters) {
        ValidationResult declared = AnalysisParameters.validate(PARAMETERS, parameters);
        List<String> errors = new ArrayList<>(declared.getErrors());
        Object layerName = parameters != null ? parameters.get(LAYER) : null;
        if (layerName instanceof String name && !name.isBlank() && findLayer(name).isEmpty()) {
            errors.add("Unknown layer: " + name);
        }
        return ValidationResult.of(errors);
    }

    @Override
    public CompletableFuture<AnalysisResult> execute(Map<String, Object> parameters, CancellationSignal cancellation,
                                                     ProgressListener progress) {
        String layerName = (String) parameters.get(LAYER);
        String attribute = (String) parameters.get(ATTRIBUTE);
        CancellationSignal stop = getStopSignal();
        return CompletableFuture.supplyAsync(() -> summarize(layerName, attribute, cancellation, stop, progress),
                getContext().getExecutor());
    }

    private AnalysisResult summarize(String layerName, String attribute, CancellationSignal cancellation,
                                     CancellationSignal stop, ProgressListener progress) {
        long started = System.nanoTime();
        Layer layer = findLayer(layerName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown layer: " + layerName));
        List<Feature> features = layer.getFeatures().toList();
        progress.onProgress(new ProgressEvent(0, "Reading " + features.size() + " features", true));

        Summary summary = new Summary();
        int lastReported = 0;
        for (int i = 0; i < features.size(); i++) {
            if (cancellation.isCancelled() || stop.isCancelled()) {
                return AnalysisResult.cancelled(Duration.ofNanos(System.nanoTime() - started));
            }
            Optional<Double> value = features.get(i).getAttributes().exists(attribute)
                    ? features.get(i).getAttributes().getDouble(attribute)
                    : Optional.empty();
            if (value.isPresent() && !value.get().isNaN()) {
                summary.add(value.get());
            } else {
                summary.skipped++;
            }
            int percent = (int) ((i + 1) * 100L / features.size());
            if (percent >= lastReported + 10 && percent < 100) {
                lastReported = percent - percent % 10;
                progress.onProgress(new ProgressEvent(lastReported, null, true));
            }
        }
        progress.onProgress(new ProgressEvent(100, "Done", false));

        PluginContext context = getContext();
        if (context != null) {
            context.getLogger().info("Statistics of {}.{}: count={}, skipped={}", layerName, attribute,
                    summary.count, summary.skipped);
        }
        return AnalysisResult.success(summary.toResults(), Duration.ofNanos(System.nanoTime() - started));
    }

    private Optional<Layer> findLayer(String name) {
        PluginContext context = getContext();
        return context != null ? context.getLayers().get(name) : Optional.empty();
    }

    private static final class Summary {
        long count;
        long skipped;
        double sum;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;

        void add(double v) {
            count++;
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        Map<String, Object> toResults() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("count", count);
            out.put("skipped", skipped);
            out.put("sum", sum);
            if (count > 0) {
                out.put("min", min);
                out.put("max", max);
                out.put("mean", sum / count);
            }
            return out;
        }
    }
}
