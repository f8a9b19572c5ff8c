package com.geoengine.data;

/**
 * Opaque rendering style. Features hold a shared reference; copies keep the same instance.
 */
public interface Style {

    String getName();
}
