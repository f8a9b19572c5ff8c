package com.geoengine.geometry;

import java.util.Objects;

/**
 * Immutable axis-aligned rectangle. Edges are inclusive: rectangles that only touch intersect.
 */
public final class Envelope {

    private final double minX;
    private final double minY;
    private final double maxX;
    private final double maxY;

    public Envelope(double minX, double minY, double maxX, double maxY) {
        if (Double.isNaN(minX) || Double.isNaN(minY) || Double.isNaN(maxX) || Double.isNaN(maxY)) {
            throw new IllegalArgumentException("Envelope bounds must not be NaN");
        }
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException("Envelope min must not exceed max: ["
                    + minX + ", " + minY + ", " + maxX + ", " + maxY + "]");
        }
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    /** Builds an envelope from two opposite corners given in any order. */
    public static Envelope of(double x1, double y1, double x2, double y2) {
        return new Envelope(Math.min(x1, x2), Math.min(y1, y2), Math.max(x1, x2), Math.max(y1, y2));
    }

    public static Envelope ofPoint(double x, double y) {
        return new Envelope(x, y, x, y);
    }

    public double getMinX() {
        return minX;
    }

    public double getMinY() {
        return minY;
    }

    public double getMaxX() {
        return maxX;
    }

    public double getMaxY() {
        return maxY;
    }

    public double getWidth() {
        return maxX - minX;
    }

    public double getHeight() {
        return maxY - minY;
    }

    public boolean intersects(Envelope other) {
        Objects.requireNonNull(other, "other");
        return other.minX <= maxX && other.maxX >= minX
                && other.minY <= maxY && other.maxY >= minY;
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    /** Smallest envelope covering both this and {@code other}. */
    public Envelope union(Envelope other) {
        Objects.requireNonNull(other, "other");
        return new Envelope(Math.min(minX, other.minX), Math.min(minY, other.minY),
                Math.max(maxX, other.maxX), Math.max(maxY, other.maxY));
    }

    /** Planar distance between the closest edges; 0 when the envelopes intersect. */
    public double distance(Envelope other) {
        Objects.requireNonNull(other, "other");
        double dx = Math.max(0, Math.max(other.minX - maxX, minX - other.maxX));
        double dy = Math.max(0, Math.max(other.minY - maxY, minY - other.maxY));
        return Math.hypot(dx, dy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Envelope)) return false;
        Envelope that = (Envelope) o;
        return Double.compare(minX, that.minX) == 0
                && Double.compare(minY, that.minY) == 0
                && Double.compare(maxX, that.maxX) == 0
                && Double.compare(maxY, that.maxY) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minX, minY, maxX, maxY);
    }

    @Override
    public String toString() {
        return "Envelope[" + minX + ", " + minY + ", " + maxX + ", " + maxY + "]";
    }
}
