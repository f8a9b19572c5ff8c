package com.geoengine.plugin.event;

/** Handle returned by {@link EventBus#subscribe}; closing it stops delivery. */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
