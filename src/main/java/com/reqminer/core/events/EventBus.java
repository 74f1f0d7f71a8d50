package com.reqminer.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for mining session events.
 * <p>
 * Supports per-session subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-session subscribers keyed by sessionId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<MiningEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<MiningEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * Publish an event to the subscribers of its session and to all global subscribers.
     */
    public void publish(MiningEvent event) {
        log.debug("Publishing event: {} for session {}", event.eventType(), event.sessionId());

        List<Consumer<MiningEvent>> sessionSubs = sessionSubscribers.get(event.sessionId());
        if (sessionSubs != null) {
            for (Consumer<MiningEvent> subscriber : sessionSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<MiningEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String sessionId, Consumer<MiningEvent> consumer) {
        sessionSubscribers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to session {}", sessionId);
        return () -> {
            CopyOnWriteArrayList<Consumer<MiningEvent>> subs = sessionSubscribers.get(sessionId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<MiningEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Drops every subscriber of a discarded session.
     */
    public void releaseSession(String sessionId) {
        sessionSubscribers.remove(sessionId);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<MiningEvent> subscriber, MiningEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
