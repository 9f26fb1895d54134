package com.example.pipeline.server.router;

import com.example.pipeline.shared.model.EventFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live subscriptions keyed by subscriber id, capped at a fixed maximum.
 * <p>
 * Mutations are serialized on a single lock so the capacity check and the insert are
 * one step; reads go straight to the map. Entries are immutable {@link Subscription}
 * values, so a snapshot can never expose a half-written entry.
 */
@Slf4j
public class SubscriptionRegistry {

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final Object mutationLock = new Object();
    private final int maxSubscribers;

    public SubscriptionRegistry(int maxSubscribers) {
        if (maxSubscribers <= 0) {
            throw new IllegalArgumentException("maxSubscribers must be positive: " + maxSubscribers);
        }
        this.maxSubscribers = maxSubscribers;
    }

    /**
     * @return false, without any change, when the registry is full or the id is already live
     */
    public boolean subscribe(String subscriberId, SubscriberConnection connection, EventFilter filter) {
        EventFilter effectiveFilter = filter != null ? filter : EventFilter.matchAll();
        synchronized (mutationLock) {
            if (subscriptions.size() >= maxSubscribers) {
                log.warn("Subscriber rejected (at capacity {}): {}", maxSubscribers, subscriberId);
                return false;
            }
            if (subscriptions.containsKey(subscriberId)) {
                log.warn("Subscriber rejected (id already active): {}", subscriberId);
                return false;
            }
            subscriptions.put(subscriberId, new Subscription(subscriberId, connection, effectiveFilter));
        }
        log.info("Subscriber added: {} filters={}", subscriberId, effectiveFilter);
        return true;
    }

    /**
     * Idempotent: removing an unknown id is a no-op.
     *
     * @return whether a subscription was removed
     */
    public boolean unsubscribe(String subscriberId) {
        Subscription removed;
        synchronized (mutationLock) {
            removed = subscriptions.remove(subscriberId);
        }
        if (removed != null) {
            log.info("Subscriber removed: {}", subscriberId);
        }
        return removed != null;
    }

    /**
     * Removes the subscription only while it is still bound to {@code connection}.
     * Used by the dispatch loop so a failure seen on an old snapshot cannot evict a newer
     * subscription that happens to reuse the same id.
     */
    boolean unsubscribe(String subscriberId, SubscriberConnection connection) {
        boolean removed;
        synchronized (mutationLock) {
            Subscription current = subscriptions.get(subscriberId);
            removed = current != null && current.getConnection() == connection;
            if (removed) {
                subscriptions.remove(subscriberId);
            }
        }
        if (removed) {
            log.info("Subscriber removed after failed delivery: {}", subscriberId);
        }
        return removed;
    }

    /**
     * Replaces the filter wholesale.
     *
     * @return false if the subscriber is not registered
     */
    public boolean updateFilter(String subscriberId, EventFilter filter) {
        EventFilter effectiveFilter = filter != null ? filter : EventFilter.matchAll();
        Subscription updated;
        synchronized (mutationLock) {
            updated = subscriptions.computeIfPresent(subscriberId, (id, current) -> current.withFilter(effectiveFilter));
        }
        if (updated == null) {
            log.debug("Filter update ignored for unknown subscriber: {}", subscriberId);
            return false;
        }
        log.info("Subscriber {} filters updated: {}", subscriberId, effectiveFilter);
        return true;
    }

    public boolean contains(String subscriberId) {
        return subscriptions.containsKey(subscriberId);
    }

    public int count() {
        return subscriptions.size();
    }

    public int getMaxSubscribers() {
        return maxSubscribers;
    }

    /**
     * Point-in-time copy for iteration by the dispatch loop.
     */
    public List<Subscription> snapshot() {
        synchronized (mutationLock) {
            return List.copyOf(subscriptions.values());
        }
    }
}
