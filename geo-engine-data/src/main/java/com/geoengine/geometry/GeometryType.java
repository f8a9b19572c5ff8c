package com.geoengine.geometry;

/**
 * Geometry kinds understood by feature queries. {@link #NONE} is reported by empty geometries;
 * {@link #UNKNOWN} by implementations that cannot classify themselves.
 */
public enum GeometryType {
    UNKNOWN,
    POINT,
    LINE_STRING,
    LINEAR_RING,
    POLYGON,
    MULTI_POINT,
    MULTI_LINE_STRING,
    MULTI_POLYGON,
    GEOMETRY_COLLECTION,
    NONE
}
