package com.geoengine.data.layer;

import com.geoengine.data.FeatureStore;

import java.util.Objects;

/**
 * Named feature store as seen by plugins through the layer collection.
 */
public final class Layer {

    private final String name;
    private final FeatureStore features;
    private volatile boolean visible = true;

    public Layer(String name) {
        this(name, new FeatureStore());
    }

    public Layer(String name, FeatureStore features) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Layer name must be non-blank");
        }
        this.name = name;
        this.features = Objects.requireNonNull(features, "features");
    }

    public String getName() {
        return name;
    }

    public FeatureStore getFeatures() {
        return features;
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    @Override
    public String toString() {
        return "Layer[" + name + ", features=" + features.size() + (visible ? "" : ", hidden") + "]";
    }
}
