package com.deepresearch.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for research progress events.
 * <p>
 * Supports per-session subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations. A failing subscriber
 * never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-session subscribers keyed by research id. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ProgressEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ProgressEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to the session's subscribers and to all global subscribers.
     */
    public void publish(ProgressEvent event) {
        log.debug("Publishing {} #{} for research {}", event.stage(), event.sequence(), event.researchId());

        List<Consumer<ProgressEvent>> sessionSubs = sessionSubscribers.get(event.researchId());
        if (sessionSubs != null) {
            for (Consumer<ProgressEvent> subscriber : sessionSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<ProgressEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }

        if (event.isTerminal()) {
            // no more events will arrive for this session
            sessionSubscribers.remove(event.researchId());
        }
    }

    /**
     * Subscribe to events for a single research session.
     *
     * @param researchId the session to subscribe to
     * @param consumer   callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String researchId, Consumer<ProgressEvent> consumer) {
        sessionSubscribers.computeIfAbsent(researchId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to research {}", researchId);
        return () -> {
            CopyOnWriteArrayList<Consumer<ProgressEvent>> subs = sessionSubscribers.get(researchId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all sessions.
     */
    public Subscription subscribeAll(Consumer<ProgressEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all research events");
        return () -> globalSubscribers.remove(consumer);
    }

    int subscriberCount(String researchId) {
        List<Consumer<ProgressEvent>> subs = sessionSubscribers.get(researchId);
        return subs != null ? subs.size() : 0;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ProgressEvent> subscriber, ProgressEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {} for research {}: {}",
                    event.stage(), event.researchId(), e.getMessage(), e);
        }
    }
}
