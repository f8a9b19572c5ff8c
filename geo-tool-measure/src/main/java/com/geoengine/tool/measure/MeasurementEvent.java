package com.geoengine.tool.measure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Published on the event bus by the measure tool each time the measured path changes.
 * {@link #getLength()} is the cumulative planar length converted to the configured unit.
 */
public final class MeasurementEvent {

    private final List<double[]> vertices;
    private final double length;
    private final String unit;
    private final boolean finished;

    MeasurementEvent(List<double[]> vertices, double length, String unit, boolean finished) {
        List<double[]> copy = new ArrayList<>(vertices.size());
        for (double[] v : vertices) {
            copy.add(v.clone());
        }
        this.vertices = Collections.unmodifiableList(copy);
        this.length = length;
        this.unit = unit;
        this.finished = finished;
    }

    /** Path vertices as {x, y} pairs, in click order. */
    public List<double[]> getVertices() {
        return vertices;
    }

    public int getVertexCount() {
        return vertices.size();
    }

    public double getLength() {
        return length;
    }

    public String getUnit() {
        return unit;
    }

    /** True for the final event of a measurement (right click or double click). */
    public boolean isFinished() {
        return finished;
    }

    @Override
    public String toString() {
        return "MeasurementEvent[" + String.format("%.3f", length) + " " + unit + ", vertices="
                + vertices.size() + (finished ? ", finished" : "") + "]";
    }
}
