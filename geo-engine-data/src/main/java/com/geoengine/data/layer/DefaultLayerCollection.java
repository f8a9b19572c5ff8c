package com.geoengine.data.layer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe layer collection; reads never block and see a consistent snapshot.
 */
public final class DefaultLayerCollection implements LayerCollection {

    private final CopyOnWriteArrayList<Layer> layers = new CopyOnWriteArrayList<>();

    @Override
    public synchronized void add(Layer layer) {
        Objects.requireNonNull(layer, "layer");
        if (get(layer.getName()).isPresent()) {
            throw new IllegalArgumentException("Duplicate layer name: " + layer.getName());
        }
        layers.add(layer);
    }

    @Override
    public synchronized Optional<Layer> remove(String name) {
        Optional<Layer> existing = get(name);
        existing.ifPresent(layers::remove);
        return existing;
    }

    @Override
    public Optional<Layer> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (Layer layer : layers) {
            if (layer.getName().equals(name)) {
                return Optional.of(layer);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Layer> getLayers() {
        return List.copyOf(layers);
    }

    @Override
    public int size() {
        return layers.size();
    }
}
