package com.geoengine.data.layer;

import java.util.List;
import java.util.Optional;

/**
 * Ordered set of layers shared by the host and all plugins. Layer names are unique.
 */
public interface LayerCollection {

    /**
     * @throws IllegalArgumentException when a layer with the same name exists
     */
    void add(Layer layer);

    /** Removes the layer named {@code name}; returns it if it was present. */
    Optional<Layer> remove(String name);

    Optional<Layer> get(String name);

    /** Snapshot in insertion order. */
    List<Layer> getLayers();

    int size();
}
