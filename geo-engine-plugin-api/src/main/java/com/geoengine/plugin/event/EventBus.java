package com.geoengine.plugin.event;

import java.util.function.Consumer;

/**
 * Publish/subscribe channel shared by the host and plugins. Subscribers receive events of the
 * subscribed type and its subtypes.
 */
public interface EventBus {

    <T> Subscription subscribe(Class<T> eventType, Consumer<? super T> handler);

    void publish(Object event);
}
