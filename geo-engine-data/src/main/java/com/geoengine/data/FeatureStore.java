package com.geoengine.data;

import com.geoengine.geometry.Envelope;
import com.geoengine.geometry.GeometryType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Ordered in-memory collection of feature references with spatial and attribute queries.
 * <ul>
 *   <li>Order is insertion order; {@link #get(int)} and iteration follow it.</li>
 *   <li>A given feature instance is held at most once; adding it again is a no-op.
 *       Distinct instances sharing an id are allowed.</li>
 *   <li>{@link #remove(Feature)} matches by reference, not by id.</li>
 *   <li>Queries return lazy {@link FeatureView}s evaluated against the current contents on
 *       each iteration. Features without geometry never match spatial or geometry-type queries.</li>
 *   <li>{@link #getExtent()} is recomputed on every call.</li>
 * </ul>
 * Concurrent reads are safe; any mutation must be externally synchronized with readers.
 */
public final class FeatureStore implements Iterable<Feature> {

    private final List<Feature> features = new ArrayList<>();
    private final Set<Feature> members = Collections.newSetFromMap(new IdentityHashMap<>());

    public FeatureStore() {
    }

    /** Store pre-populated from {@code source}, keeping its order. */
    public FeatureStore(Iterable<Feature> source) {
        addAll(source);
    }

    /**
     * Appends {@code feature}.
     *
     * @return false when this exact instance is already in the store
     * @throws IllegalArgumentException when feature is null
     */
    public boolean add(Feature feature) {
        if (feature == null) {
            throw new IllegalArgumentException("feature must not be null");
        }
        if (!members.add(feature)) {
            return false;
        }
        features.add(feature);
        return true;
    }

    /** Adds every feature in order; returns how many were actually added. */
    public int addAll(Iterable<Feature> source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        int added = 0;
        for (Feature f : source) {
            if (add(f)) {
                added++;
            }
        }
        return added;
    }

    /** Removes this exact instance; a different instance with an equal id is not removed. */
    public boolean remove(Feature feature) {
        if (feature == null || !members.remove(feature)) {
            return false;
        }
        for (int i = 0; i < features.size(); i++) {
            if (features.get(i) == feature) {
                features.remove(i);
                return true;
            }
        }
        return true;
    }

    public void clear() {
        features.clear();
        members.clear();
    }

    public int size() {
        return features.size();
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    /** True when this exact instance is held. */
    public boolean contains(Feature feature) {
        return feature != null && members.contains(feature);
    }

    public Feature get(int index) {
        checkIndex(index);
        return features.get(index);
    }

    /**
     * Replaces the feature at {@code index}.
     *
     * @throws IllegalArgumentException when feature is null or held at another index
     */
    public void set(int index, Feature feature) {
        if (feature == null) {
            throw new IllegalArgumentException("feature must not be null");
        }
        checkIndex(index);
        Feature previous = features.get(index);
        if (previous == feature) {
            return;
        }
        if (members.contains(feature)) {
            throw new IllegalArgumentException("feature " + feature.getId() + " is already in the store at another index");
        }
        members.remove(previous);
        members.add(feature);
        features.set(index, feature);
    }

    /** First feature whose id equals {@code id}, or null. */
    public Feature getById(Object id) {
        for (Feature f : features) {
            if (Objects.equals(f.getId(), id)) {
                return f;
            }
        }
        return null;
    }

    /** Union of all bounding boxes; null when no feature has geometry. */
    public Envelope getExtent() {
        Envelope extent = null;
        for (Feature f : features) {
            Envelope box = f.getBoundingBox();
            if (box != null) {
                extent = extent == null ? box : extent.union(box);
            }
        }
        return extent;
    }

    /** Features whose bounding box intersects {@code extent}. */
    public FeatureView getInExtent(Envelope extent) {
        if (extent == null) {
            throw new IllegalArgumentException("extent must not be null");
        }
        return view(f -> {
            Envelope box = f.getBoundingBox();
            return box != null && extent.intersects(box);
        });
    }

    /** Features having attribute {@code name} equal to {@code value}. */
    public FeatureView filterByAttribute(String name, AttributeValue value) {
        if (name == null) {
            throw new IllegalArgumentException("name must not be null");
        }
        AttributeValue expected = value == null ? AttributeValue.NULL : value;
        return view(f -> f.getAttributes().exists(name) && expected.equals(f.getAttributes().get(name)));
    }

    /** Plain-value overload; {@code value} is converted with {@link AttributeValue#of(Object)}. */
    public FeatureView filterByAttribute(String name, Object value) {
        return filterByAttribute(name, AttributeValue.of(value));
    }

    public FeatureView filterByGeometryType(GeometryType type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        return view(f -> f.getGeometry() != null && f.getGeometry().getGeometryType() == type);
    }

    /** Snapshot of the current contents. */
    public List<Feature> toList() {
        return List.copyOf(features);
    }

    public Stream<Feature> stream() {
        return features.stream();
    }

    /** Read-only iterator; use {@link #remove(Feature)} to remove. */
    @Override
    public Iterator<Feature> iterator() {
        Iterator<Feature> it = features.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public Feature next() {
                if (!it.hasNext()) {
                    throw new NoSuchElementException();
                }
                return it.next();
            }
        };
    }

    private FeatureView view(Predicate<Feature> filter) {
        return new FeatureView(features::iterator, filter);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= features.size()) {
            throw new IndexOutOfBoundsException("Feature index " + index + " out of range [0, " + features.size() + ")");
        }
    }
}
