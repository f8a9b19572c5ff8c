package com.geoengine.geometry;

/**
 * Geometry capability consumed by the feature model. Implementations own all geometric
 * algorithms; the engine only needs bounds, intersection against a rectangle, distance,
 * deep copy, a type tag and a validity check.
 *
 * @see com.geoengine.geometry.jts.JtsGeometry
 */
public interface Geometry {

    /** Axis-aligned bounds; null for an empty geometry. */
    Envelope getEnvelope();

    boolean intersects(Envelope envelope);

    /** Minimum planar distance to {@code other}. */
    double distance(Geometry other);

    /** Deep copy; the result shares no mutable state with this geometry. */
    Geometry copy();

    GeometryType getGeometryType();

    boolean isValid();
}
