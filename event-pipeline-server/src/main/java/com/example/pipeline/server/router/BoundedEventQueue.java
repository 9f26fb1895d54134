package com.example.pipeline.server.router;

import com.example.pipeline.shared.model.Event;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-capacity FIFO between publishers and the dispatch loop.
 * <p>
 * Publishers never block: when the queue is full the newest event is rejected and nothing
 * already queued is evicted. The single consumer blocks in {@link #take()} until an event
 * arrives or the queue is closed.
 */
public class BoundedEventQueue {

    private static final long POLL_INTERVAL_MS = 100;

    private final BlockingQueue<Event> queue;
    private final int capacity;
    private volatile boolean closed;

    public BoundedEventQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * @return false when the queue is full or closed
     */
    public boolean offer(Event event) {
        if (closed) {
            return false;
        }
        return queue.offer(event);
    }

    /**
     * Waits for the next event. Returns empty once the queue has been closed.
     */
    public Optional<Event> take() throws InterruptedException {
        while (!closed) {
            Event event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (event != null) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    /**
     * Stops accepting events and wakes the consumer. Events still queued are discarded.
     */
    public void close() {
        closed = true;
        queue.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }
}
