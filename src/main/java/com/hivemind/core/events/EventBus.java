package com.hivemind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for agent and orchestration events.
 * <p>
 * Supports per-agent subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-agent subscribers keyed by agentId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<HivemindEvent>>> agentSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all agents. */
    private final CopyOnWriteArrayList<Consumer<HivemindEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (agent-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(HivemindEvent event) {
        if (!"agent.text".equals(event.eventType())) {
            log.debug("Publishing event: {} for agent {}", event.eventType(), event.agentId());
        }

        if (event.agentId() != null) {
            List<Consumer<HivemindEvent>> agentSubs = agentSubscribers.get(event.agentId());
            if (agentSubs != null) {
                for (Consumer<HivemindEvent> subscriber : agentSubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<HivemindEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific agent.
     *
     * @param agentId  the agent to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String agentId, Consumer<HivemindEvent> consumer) {
        agentSubscribers.computeIfAbsent(agentId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to agent {}", agentId);
        return () -> {
            CopyOnWriteArrayList<Consumer<HivemindEvent>> subs = agentSubscribers.get(agentId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all agents (global subscription).
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<HivemindEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<HivemindEvent> subscriber, HivemindEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
