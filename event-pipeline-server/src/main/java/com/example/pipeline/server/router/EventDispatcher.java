package com.example.pipeline.server.router;

import com.example.pipeline.shared.model.Event;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The dispatch loop: drains the queue on one worker thread and hands each event to every
 * subscriber whose filter matches.
 * <p>
 * Subscribers whose delivery fails are collected during the pass and removed once the pass
 * is over, so the snapshot being iterated is never mutated. A fault while processing one
 * event is logged and never ends the loop.
 */
@Slf4j
public class EventDispatcher implements Runnable {

    private final BoundedEventQueue queue;
    private final SubscriptionRegistry registry;

    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private volatile boolean running = true;

    public EventDispatcher(BoundedEventQueue queue, SubscriptionRegistry registry) {
        this.queue = queue;
        this.registry = registry;
    }

    @Override
    public void run() {
        log.info("Event dispatcher started");
        try {
            while (running) {
                Optional<Event> next = queue.take();
                if (next.isEmpty()) {
                    break;
                }
                try {
                    dispatch(next.get());
                } catch (RuntimeException e) {
                    log.error("Error dispatching event {}", next.get().getId(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Event dispatcher interrupted");
        }
        log.info("Event dispatcher stopped");
    }

    /**
     * Delivers one event to all matching subscribers.
     *
     * @return number of successful deliveries
     */
    int dispatch(Event event) {
        List<Subscription> failed = new ArrayList<>();
        int delivered = 0;
        for (Subscription subscription : registry.snapshot()) {
            if (!subscription.getFilter().matches(event)) {
                continue;
            }
            if (deliver(subscription, event)) {
                delivered++;
            } else {
                failed.add(subscription);
            }
        }
        for (Subscription subscription : failed) {
            registry.unsubscribe(subscription.getSubscriberId(), subscription.getConnection());
        }
        deliveredCount.addAndGet(delivered);
        failedCount.addAndGet(failed.size());
        log.debug("Event {} ({}) delivered to {} subscriber(s), {} failed",
                event.getId(), event.getEventType(), delivered, failed.size());
        return delivered;
    }

    private boolean deliver(Subscription subscription, Event event) {
        try {
            DeliveryResult result = subscription.getConnection().send(event);
            if (result == null || result.isFailure()) {
                log.warn("Failed to deliver event {} to {} ({})", event.getId(),
                        subscription.getSubscriberId(), subscription.getConnection().describe());
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to deliver event {} to {}: {}", event.getId(),
                    subscription.getSubscriberId(), e.getMessage());
            return false;
        }
    }

    /**
     * Signals the loop to finish. The worker notices at its next wait on the queue.
     */
    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public long getDeliveredCount() {
        return deliveredCount.get();
    }

    public long getFailedCount() {
        return failedCount.get();
    }
}
