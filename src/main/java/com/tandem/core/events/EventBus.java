package com.tandem.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for delegation events.
 * <p>
 * Supports per-session subscriptions and global subscriptions that receive all events.
 * Thread-safe: worker monitors publish concurrently with the orchestrating caller.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<TandemEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<TandemEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (session-specific and global).
     */
    public void publish(TandemEvent event) {
        log.debug("Publishing event: {} for session {}", event.eventType(), event.sessionId());

        if (event.sessionId() != null) {
            List<Consumer<TandemEvent>> sessionSubs = sessionSubscribers.get(event.sessionId());
            if (sessionSubs != null) {
                for (Consumer<TandemEvent> subscriber : sessionSubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<TandemEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific orchestration session.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String sessionId, Consumer<TandemEvent> consumer) {
        sessionSubscribers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to session {}", sessionId);
        return () -> {
            CopyOnWriteArrayList<Consumer<TandemEvent>> subs = sessionSubscribers.get(sessionId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    sessionSubscribers.remove(sessionId, subs);
                }
            }
        };
    }

    /**
     * Subscribe to the given event types of one session.
     */
    public Subscription subscribe(String sessionId, Set<String> eventTypes, Consumer<TandemEvent> consumer) {
        Set<String> types = Set.copyOf(eventTypes);
        return subscribe(sessionId, event -> {
            if (types.contains(event.eventType())) {
                consumer.accept(event);
            }
        });
    }

    /**
     * Subscribe to events from all sessions and from ad-hoc workers.
     */
    public Subscription subscribeAll(Consumer<TandemEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription; closing it unsubscribes.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private void deliverSafely(Consumer<TandemEvent> subscriber, TandemEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
