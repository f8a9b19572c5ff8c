package com.geoengine.tool.measure;

import com.geoengine.geometry.jts.JtsGeometry;
import com.geoengine.plugin.AbstractPlugin;
import com.geoengine.plugin.PluginContext;
import com.geoengine.plugin.PluginDescriptor;
import com.geoengine.plugin.PluginSettings;
import com.geoengine.plugin.PluginType;
import com.geoengine.plugin.tool.Key;
import com.geoengine.plugin.tool.MapKeyEvent;
import com.geoengine.plugin.tool.MapMouseEvent;
import com.geoengine.plugin.tool.MouseButton;
import com.geoengine.plugin.tool.ToolExtension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Distance measurement tool. While active: left click adds a vertex at the world coordinate,
 * right click or double click finishes the path, Escape clears it. Each change is published as a
 * {@link MeasurementEvent}. Clicks without a world coordinate are left to other tools.
 */
public final class MeasureToolPlugin extends AbstractPlugin implements ToolExtension {

    private static final Logger log = LoggerFactory.getLogger(MeasureToolPlugin.class);

    public static final String PLUGIN_ID = "geo.measure";

    private final List<double[]> vertices = new ArrayList<>();
    private volatile boolean active;

    public MeasureToolPlugin() {
        super(PluginDescriptor.builder(PLUGIN_ID)
                .name("Measure")
                .description("Measures planar distance along clicked points")
                .version("1.0.0")
                .author("geo-engine")
                .type(PluginType.TOOL)
                .build());
    }

    @Override
    protected PluginSettings createDefaultSettings() {
        return new MeasureSettings();
    }

    @Override
    protected CompletableFuture<Void> onInitialize(PluginContext context) {
        context.getLogger().debug("Measure tool initialized");
        return CompletableFuture.completedFuture(null);
    }

    @Override
    protected CompletableFuture<Void> onStop() {
        deactivate();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String getToolName() {
        return "Measure Distance";
    }

    @Override
    public String getToolIcon() {
        return "measure.png";
    }

    @Override
    public String getToolCategory() {
        return "Measurement";
    }

    @Override
    public void activate() {
        active = true;
    }

    @Override
    public void deactivate() {
        active = false;
        synchronized (vertices) {
            vertices.clear();
        }
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public boolean onMouseDown(MapMouseEvent event) {
        if (!active) {
            return false;
        }
        Optional<double[]> world = event.getWorldCoordinate();
        if (event.getButton() == MouseButton.RIGHT) {
            return finish();
        }
        if (event.getButton() != MouseButton.LEFT || world.isEmpty()) {
            return false;
        }
        MeasurementEvent update;
        synchronized (vertices) {
            vertices.add(world.get().clone());
            update = snapshot(false);
        }
        publish(update);
        if (event.getClickCount() >= 2) {
            finish();
        }
        return true;
    }

    @Override
    public boolean onKeyDown(MapKeyEvent event) {
        if (!active || event.getKey() != Key.ESCAPE) {
            return false;
        }
        synchronized (vertices) {
            vertices.clear();
        }
        refreshCanvas();
        return true;
    }

    /** Length of the current path in the configured unit; 0 with fewer than two vertices. */
    public double getMeasuredLength() {
        synchronized (vertices) {
            return planarLength(vertices) * settings().getUnitsPerMapUnit();
        }
    }

    public int getVertexCount() {
        synchronized (vertices) {
            return vertices.size();
        }
    }

    private boolean finish() {
        MeasurementEvent last;
        synchronized (vertices) {
            if (vertices.isEmpty()) {
                return false;
            }
            last = snapshot(true);
            vertices.clear();
        }
        getLogger().info("Measured {}", last);
        publish(last);
        return true;
    }

    private MeasurementEvent snapshot(boolean finished) {
        MeasureSettings s = settings();
        return new MeasurementEvent(vertices, planarLength(vertices) * s.getUnitsPerMapUnit(), s.getUnit(), finished);
    }

    private void publish(MeasurementEvent event) {
        PluginContext context = getContext();
        if (context != null) {
            context.getEventBus().publish(event);
        }
        refreshCanvas();
    }

    private void refreshCanvas() {
        PluginContext context = getContext();
        if (context != null && context.getMapCanvas() != null) {
            context.getMapCanvas().refresh();
        }
    }

    private MeasureSettings settings() {
        return (MeasureSettings) getActiveSettings().orElseGet(MeasureSettings::new);
    }

    private Logger getLogger() {
        PluginContext context = getContext();
        return context != null ? context.getLogger() : log;
    }

    static double planarLength(List<double[]> path) {
        if (path.size() < 2) {
            return 0.0;
        }
        double[] xy = new double[path.size() * 2];
        for (int i = 0; i < path.size(); i++) {
            xy[2 * i] = path.get(i)[0];
            xy[2 * i + 1] = path.get(i)[1];
        }
        return JtsGeometry.lineString(xy).unwrap().getLength();
    }
}
