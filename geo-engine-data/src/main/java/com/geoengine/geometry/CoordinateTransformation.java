package com.geoengine.geometry;

/**
 * Reprojects a geometry from one coordinate reference system to another.
 * Projection math lives outside the engine; features only apply the result.
 */
@FunctionalInterface
public interface CoordinateTransformation {

    Geometry transform(Geometry geometry);
}
