package com.geoengine.data;

import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy query result over a {@link FeatureStore}. Nothing is evaluated until iteration, and every
 * iteration re-runs the query against the store's current contents.
 */
public final class FeatureView implements Iterable<Feature> {

    private final Supplier<Iterator<Feature>> source;
    private final Predicate<Feature> filter;

    FeatureView(Supplier<Iterator<Feature>> source, Predicate<Feature> filter) {
        this.source = source;
        this.filter = filter;
    }

    @Override
    public Iterator<Feature> iterator() {
        return stream().iterator();
    }

    public Stream<Feature> stream() {
        Iterable<Feature> all = source::get;
        return StreamSupport.stream(all.spliterator(), false).filter(filter);
    }

    public List<Feature> toList() {
        return stream().collect(Collectors.toUnmodifiableList());
    }

    public long count() {
        return stream().count();
    }

    public boolean isEmpty() {
        return !iterator().hasNext();
    }
}
