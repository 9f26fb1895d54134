package com.example.pipeline.server.router;

import com.example.pipeline.shared.model.EventFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionRegistryTest {

    @Test
    @DisplayName("Subscribing beyond capacity returns false and leaves the count unchanged")
    void rejectsBeyondCapacity() {
        SubscriptionRegistry registry = new SubscriptionRegistry(2);

        assertThat(registry.subscribe("sub-1", new RecordingConnection(), null)).isTrue();
        assertThat(registry.subscribe("sub-2", new RecordingConnection(), null)).isTrue();
        assertThat(registry.subscribe("sub-3", new RecordingConnection(), null)).isFalse();

        assertThat(registry.count()).isEqualTo(2);
        assertThat(registry.contains("sub-3")).isFalse();
    }

    @Test
    @DisplayName("A live id cannot be registered twice")
    void rejectsDuplicateLiveId() {
        SubscriptionRegistry registry = new SubscriptionRegistry(5);
        RecordingConnection first = new RecordingConnection();

        assertThat(registry.subscribe("sub-1", first, null)).isTrue();
        assertThat(registry.subscribe("sub-1", new RecordingConnection(), null)).isFalse();

        assertThat(registry.snapshot()).singleElement()
                .satisfies(s -> assertThat(s.getConnection()).isSameAs(first));
    }

    @Test
    @DisplayName("A missing filter is stored as match-all")
    void nullFilterBecomesMatchAll() {
        SubscriptionRegistry registry = new SubscriptionRegistry(5);
        registry.subscribe("sub-1", new RecordingConnection(), null);

        assertThat(registry.snapshot()).singleElement()
                .satisfies(s -> assertThat(s.getFilter()).isEqualTo(EventFilter.matchAll()));
    }

    @Test
    void unsubscribeIsIdempotent() {
        SubscriptionRegistry registry = new SubscriptionRegistry(5);
        registry.subscribe("sub-1", new RecordingConnection(), null);

        assertThat(registry.unsubscribe("sub-1")).isTrue();
        assertThat(registry.unsubscribe("sub-1")).isFalse();
        assertThat(registry.unsubscribe("never-there")).isFalse();
        assertThat(registry.count()).isZero();
    }

    @Test
    @DisplayName("Conditional removal leaves a newer subscription with the same id alone")
    void conditionalRemovalChecksConnection() {
        SubscriptionRegistry registry = new SubscriptionRegistry(5);
        RecordingConnection stale = new RecordingConnection();
        RecordingConnection current = new RecordingConnection();
        registry.subscribe("sub-1", current, null);

        assertThat(registry.unsubscribe("sub-1", stale)).isFalse();
        assertThat(registry.contains("sub-1")).isTrue();
        assertThat(registry.unsubscribe("sub-1", current)).isTrue();
    }

    @Test
    @DisplayName("Filters are replaced wholesale")
    void updateFilterReplaces() {
        SubscriptionRegistry registry = new SubscriptionRegistry(5);
        registry.subscribe("sub-1", new RecordingConnection(),
                EventFilter.builder().eventTypes(List.of("quiz_started")).sessionId("s-1").build());

        EventFilter replacement = EventFilter.builder().userId("u-1").build();
        assertThat(registry.updateFilter("sub-1", replacement)).isTrue();
        assertThat(registry.updateFilter("unknown", replacement)).isFalse();

        EventFilter stored = registry.snapshot().get(0).getFilter();
        assertThat(stored.getEventTypes()).isEmpty();
        assertThat(stored.getSessionId()).isNull();
        assertThat(stored.getUserId()).isEqualTo("u-1");
    }

    @Test
    @DisplayName("A snapshot is not affected by later changes")
    void snapshotIsACopy() {
        SubscriptionRegistry registry = new SubscriptionRegistry(5);
        registry.subscribe("sub-1", new RecordingConnection(), null);

        List<Subscription> snapshot = registry.snapshot();
        registry.subscribe("sub-2", new RecordingConnection(), null);
        registry.unsubscribe("sub-1");

        assertThat(snapshot).extracting(Subscription::getSubscriberId).containsExactly("sub-1");
        assertThatThrownBy(() -> snapshot.add(snapshot.get(0))).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Concurrent subscribers never push the count past capacity")
    void capacityHoldsUnderContention() throws Exception {
        int capacity = 50;
        SubscriptionRegistry registry = new SubscriptionRegistry(capacity);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();

        try {
            for (int i = 0; i < 200; i++) {
                String id = "sub-" + i;
                executor.submit(() -> {
                    start.await();
                    if (registry.subscribe(id, new RecordingConnection(), null)) {
                        accepted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(accepted.get()).isEqualTo(capacity);
        assertThat(registry.count()).isEqualTo(capacity);
    }
}
