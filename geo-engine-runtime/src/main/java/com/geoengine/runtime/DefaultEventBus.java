package com.geoengine.runtime;

import com.geoengine.plugin.event.EventBus;
import com.geoengine.plugin.event.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous, type-based event bus. Events are delivered in the order they were published:
 * an event published from inside a handler is queued and delivered after the current event has
 * reached every subscriber. A failing handler is logged and does not affect other handlers.
 */
public final class DefaultEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventBus.class);

    private final List<Listener<?>> listeners = new CopyOnWriteArrayList<>();
    private final Queue<Object> pending = new ArrayDeque<>();
    private boolean draining;

    private static final class Listener<T> {
        final Class<T> type;
        final Consumer<? super T> handler;

        Listener(Class<T> type, Consumer<? super T> handler) {
            this.type = type;
            this.handler = handler;
        }

        void deliver(Object event) {
            if (type.isInstance(event)) {
                handler.accept(type.cast(event));
            }
        }
    }

    @Override
    public <T> Subscription subscribe(Class<T> eventType, Consumer<? super T> handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        Listener<T> listener = new Listener<>(eventType, handler);
        listeners.add(listener);
        log.debug("Subscribed handler to {}", eventType.getSimpleName());
        return () -> listeners.remove(listener);
    }

    @Override
    public void publish(Object event) {
        Objects.requireNonNull(event, "event");
        synchronized (pending) {
            pending.add(event);
            if (draining) {
                return;
            }
            draining = true;
        }
        while (true) {
            Object next;
            synchronized (pending) {
                next = pending.poll();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            dispatch(next);
        }
    }

    /** Number of active subscriptions. */
    public int getSubscriberCount() {
        return listeners.size();
    }

    private void dispatch(Object event) {
        for (Listener<?> listener : listeners) {
            try {
                listener.deliver(event);
            } catch (RuntimeException e) {
                log.error("Event handler for {} failed (continuing with other handlers): {}",
                        event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
