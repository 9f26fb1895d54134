package com.example.pipeline.server.router;

import com.example.pipeline.shared.model.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedEventQueueTest {

    @Test
    @DisplayName("Offer at capacity rejects the newest event and keeps the queued ones")
    void rejectsNewestWhenFull() throws Exception {
        BoundedEventQueue queue = new BoundedEventQueue(2);
        Event first = TestEvents.event("quiz_started");
        Event second = TestEvents.event("quiz_completed");

        assertThat(queue.offer(first)).isTrue();
        assertThat(queue.offer(second)).isTrue();
        assertThat(queue.offer(TestEvents.event("timer_tick"))).isFalse();
        assertThat(queue.size()).isEqualTo(2);

        assertThat(queue.take()).contains(first);
        assertThat(queue.take()).contains(second);
    }

    @Test
    @DisplayName("Take waits until an event arrives")
    void takeBlocksUntilOffer() throws Exception {
        BoundedEventQueue queue = new BoundedEventQueue(4);
        CompletableFuture<Optional<Event>> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(150);
        assertThat(taken).isNotDone();

        Event event = TestEvents.event("timer_tick");
        queue.offer(event);
        assertThat(taken.get(2, TimeUnit.SECONDS)).contains(event);
    }

    @Test
    @DisplayName("Closing wakes a waiting consumer and refuses further offers")
    void closeWakesConsumer() throws Exception {
        BoundedEventQueue queue = new BoundedEventQueue(4);
        CompletableFuture<Optional<Event>> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        queue.close();

        assertThat(taken.get(2, TimeUnit.SECONDS)).isEmpty();
        assertThat(queue.offer(TestEvents.event("timer_tick"))).isFalse();
        assertThat(queue.isClosed()).isTrue();
    }
}
