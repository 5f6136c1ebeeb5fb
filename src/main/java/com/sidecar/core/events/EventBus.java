package com.sidecar.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for node events.
 * <p>
 * Each published event gets the next id from a process-wide sequence and is delivered, in
 * the publisher's thread, to every subscriber whose filter accepts its type. Thread-safe for
 * concurrent publish and subscribe operations. No buffering, replay or retry.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final AtomicLong nextId = new AtomicLong();

    private final CopyOnWriteArrayList<Registration> subscribers = new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers.
     *
     * @param event the event to publish; must not be {@link ApiVersion}, which streams send
     *              on their own as the handshake
     * @return the event with its assigned id
     */
    public PublishedEvent publish(SseData event) {
        if (event instanceof ApiVersion) {
            throw new IllegalArgumentException("ApiVersion is sent per subscription and cannot be published");
        }
        PublishedEvent published = new PublishedEvent(nextId.getAndIncrement(), event);
        log.debug("Publishing event {} with id {}", event.type().wireName(), published.id());

        for (Registration registration : subscribers) {
            if (registration.filter().accepts(event.type())) {
                deliverSafely(registration.consumer(), published);
            }
        }
        return published;
    }

    /**
     * Subscribe to the events a filter accepts.
     *
     * @param filter   which event types to receive
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(EventFilter filter, Consumer<PublishedEvent> consumer) {
        Registration registration = new Registration(filter, consumer);
        subscribers.add(registration);
        log.debug("Subscribed to {} events", filter);
        return () -> subscribers.remove(registration);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PublishedEvent> subscriber, PublishedEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {} ({}): {}",
                    event.id(), event.data().type().wireName(), e.getMessage(), e);
        }
    }

    // Identity equality so that two registrations of the same consumer stay distinct.
    private static final class Registration {
        private final EventFilter filter;
        private final Consumer<PublishedEvent> consumer;

        Registration(EventFilter filter, Consumer<PublishedEvent> consumer) {
            this.filter = filter;
            this.consumer = consumer;
        }

        EventFilter filter() {
            return filter;
        }

        Consumer<PublishedEvent> consumer() {
            return consumer;
        }
    }
}
