package com.example.pipeline.server.router;

import com.example.pipeline.shared.dto.RouterStats;
import com.example.pipeline.shared.model.Event;
import com.example.pipeline.shared.model.EventFilter;
import com.example.pipeline.shared.util.Constants;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory pub/sub engine: a bounded queue in front of a single dispatch thread that fans
 * events out to the subscriptions whose filters match.
 * <p>
 * Capacities are fixed at construction. {@link #publish(Event)} and {@link #subscribe}
 * report backpressure as {@code false}; they never block and never throw for capacity.
 * Events still queued when the router stops are dropped, and subscriber connections are
 * left open for their owners to close.
 */
@Slf4j
public class EventRouter {

    private final RouterProperties properties;
    private final SubscriptionRegistry registry;
    private final BoundedEventQueue queue;
    private final EventDispatcher dispatcher;

    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();

    private volatile ExecutorService dispatchExecutor;

    public EventRouter(RouterProperties properties) {
        this.properties = properties;
        this.registry = new SubscriptionRegistry(properties.getMaxSubscribers());
        this.queue = new BoundedEventQueue(properties.getMaxQueueSize());
        this.dispatcher = new EventDispatcher(queue, registry);
    }

    public synchronized void start() {
        if (dispatchExecutor != null) {
            log.debug("Event router already started");
            return;
        }
        dispatchExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "event-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
        dispatchExecutor.execute(dispatcher);
        log.info("Event router started (max queue size {}, max subscribers {})",
                properties.getMaxQueueSize(), properties.getMaxSubscribers());
    }

    /**
     * Stops the dispatch thread and waits for it to finish. Safe to call before
     * {@link #start()} or more than once.
     */
    public synchronized void stop() {
        dispatcher.stop();
        int dropped = queue.size();
        queue.close();
        if (dispatchExecutor == null) {
            return;
        }
        dispatchExecutor.shutdown();
        Duration timeout = properties.getShutdownTimeout();
        try {
            if (!dispatchExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Event dispatcher did not terminate within {}", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for event dispatcher to stop");
        }
        if (dropped > 0) {
            log.warn("Event router stopped with {} undelivered event(s) dropped", dropped);
        }
        log.info("Event router stopped");
    }

    public String newSubscriberId() {
        return Constants.SUBSCRIBER_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public boolean subscribe(String subscriberId, SubscriberConnection connection, EventFilter filter) {
        return registry.subscribe(subscriberId, connection, filter);
    }

    public boolean unsubscribe(String subscriberId) {
        return registry.unsubscribe(subscriberId);
    }

    public boolean isSubscribed(String subscriberId) {
        return registry.contains(subscriberId);
    }

    public boolean updateFilter(String subscriberId, EventFilter filter) {
        return registry.updateFilter(subscriberId, filter);
    }

    /**
     * Enqueues the event for live delivery.
     *
     * @return false when the queue is full (or the router is stopped); the event is not queued
     */
    public boolean publish(Event event) {
        if (!queue.offer(event)) {
            rejectedCount.incrementAndGet();
            if (queue.isClosed()) {
                log.warn("Event router stopped, dropping event {} ({})", event.getId(), event.getEventType());
            } else {
                log.warn("Event queue full ({}), dropping event {} ({})",
                        queue.capacity(), event.getId(), event.getEventType());
            }
            return false;
        }
        publishedCount.incrementAndGet();
        return true;
    }

    public RouterStats getStats() {
        return new RouterStats(registry.count(), queue.size());
    }

    public boolean isRunning() {
        return dispatchExecutor != null && !dispatchExecutor.isShutdown();
    }

    public long getPublishedCount() {
        return publishedCount.get();
    }

    public long getRejectedCount() {
        return rejectedCount.get();
    }

    public long getDeliveredCount() {
        return dispatcher.getDeliveredCount();
    }

    public long getFailedDeliveryCount() {
        return dispatcher.getFailedCount();
    }

    public RouterProperties getProperties() {
        return properties;
    }
}
