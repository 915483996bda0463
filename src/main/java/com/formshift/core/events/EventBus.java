package com.formshift.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for conversion events.
 * <p>
 * A subscription may be narrowed to one run, to a set of event types, or both. Events are
 * delivered synchronously on the publishing thread, in subscription order; with parallel
 * conversion, subscribers are called from worker threads. A failing subscriber is logged
 * and never affects the publisher or the other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    /**
     * Delivers {@code event} to every matching subscriber.
     *
     * @return the number of subscribers the event was delivered to
     */
    public int publish(ConversionEvent event) {
        int delivered = 0;
        for (Registration registration : registrations) {
            if (registration.matches(event)) {
                deliverSafely(registration.consumer(), event);
                delivered++;
            }
        }
        log.debug("Published {} for run {} to {} subscriber(s)", event.eventType(), event.runId(), delivered);
        return delivered;
    }

    /** Receives every event of run {@code runId}. */
    public Subscription subscribe(String runId, Consumer<ConversionEvent> consumer) {
        return register(new Registration(Objects.requireNonNull(runId, "runId"), Set.of(), consumer));
    }

    /** Receives every event of every run. */
    public Subscription subscribeAll(Consumer<ConversionEvent> consumer) {
        return register(new Registration(null, Set.of(), consumer));
    }

    /** Receives the events of the given types from every run. */
    public Subscription subscribeTo(Collection<String> eventTypes, Consumer<ConversionEvent> consumer) {
        if (eventTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        return register(new Registration(null, Set.copyOf(eventTypes), consumer));
    }

    public int subscriberCount() {
        return registrations.size();
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private Subscription register(Registration registration) {
        Objects.requireNonNull(registration.consumer(), "consumer");
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    private void deliverSafely(Consumer<ConversionEvent> subscriber, ConversionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
        }
    }

    /** An empty type set matches every type; a null run id matches every run. */
    private record Registration(String runId, Set<String> eventTypes, Consumer<ConversionEvent> consumer) {

        boolean matches(ConversionEvent event) {
            return (runId == null || runId.equals(event.runId()))
                    && (eventTypes.isEmpty() || eventTypes.contains(event.eventType()));
        }

        // identity, so unsubscribing removes exactly this registration
        @Override
        public boolean equals(Object other) {
            return this == other;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this);
        }
    }
}
