package com.example.pipeline.shared.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventFilterTest {

    private static Event event(String type, String sessionId, String userId) {
        return Event.builder()
                .id("evt_000000000001")
                .eventType(type)
                .source("quiz-engine")
                .sessionId(sessionId)
                .userId(userId)
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("An empty filter matches every event")
    void emptyFilterMatchesEverything() {
        EventFilter filter = EventFilter.builder().build();

        assertThat(filter).isEqualTo(EventFilter.matchAll());
        assertThat(filter.matches(event("quiz_started", null, null))).isTrue();
        assertThat(filter.matches(event("timer_tick", "s-1", "u-1"))).isTrue();
    }

    @Test
    @DisplayName("Empty dimensions place no constraint")
    void emptyDimensionsAreIgnored() {
        EventFilter filter = EventFilter.builder()
                .eventTypes(List.of())
                .sessionId("")
                .userId(null)
                .build();

        assertThat(filter).isEqualTo(EventFilter.matchAll());
        assertThat(filter.matches(event("answer_changed", "s-9", "u-9"))).isTrue();
    }

    @Test
    @DisplayName("Event type dimension is a membership test")
    void eventTypeMembership() {
        EventFilter filter = EventFilter.builder()
                .eventTypes(List.of("quiz_started", "quiz_completed"))
                .build();

        assertThat(filter.matches(event("quiz_started", null, null))).isTrue();
        assertThat(filter.matches(event("quiz_completed", null, null))).isTrue();
        assertThat(filter.matches(event("answer_submitted", null, null))).isFalse();
    }

    @Test
    @DisplayName("Session and user are compared exactly and case-sensitively")
    void exactSessionAndUser() {
        EventFilter filter = EventFilter.builder().sessionId("s-1").userId("u-1").build();

        assertThat(filter.matches(event("timer_tick", "s-1", "u-1"))).isTrue();
        assertThat(filter.matches(event("timer_tick", "S-1", "u-1"))).isFalse();
        assertThat(filter.matches(event("timer_tick", "s-1", "u-2"))).isFalse();
        assertThat(filter.matches(event("timer_tick", null, "u-1"))).isFalse();
    }

    @Test
    @DisplayName("All present dimensions must hold at once")
    void dimensionsAreAnded() {
        EventFilter filter = EventFilter.builder()
                .eventTypes(List.of("answer_submitted"))
                .sessionId("s-1")
                .build();

        assertThat(filter.matches(event("answer_submitted", "s-1", "anyone"))).isTrue();
        assertThat(filter.matches(event("answer_submitted", "s-2", "anyone"))).isFalse();
        assertThat(filter.matches(event("quiz_started", "s-1", "anyone"))).isFalse();
    }

    @Test
    @DisplayName("The event type set is copied and cannot be changed afterwards")
    void eventTypesAreImmutable() {
        List<String> types = new java.util.ArrayList<>(List.of("quiz_started"));
        EventFilter filter = EventFilter.builder().eventTypes(types).build();
        types.add("timer_tick");

        assertThat(filter.getEventTypes()).containsExactly("quiz_started");
        assertThat(filter.matches(event("timer_tick", null, null))).isFalse();
    }
}
