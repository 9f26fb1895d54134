package com.example.pipeline.server.controller;

import com.example.pipeline.server.service.EventIngestionService;
import com.example.pipeline.server.service.EventQueryService;
import com.example.pipeline.server.service.PublishResult;
import com.example.pipeline.shared.dto.EventQuery;
import com.example.pipeline.shared.exception.GlobalExceptionHandler;
import com.example.pipeline.shared.exception.InvalidEventException;
import com.example.pipeline.shared.exception.ResourceNotFoundException;
import com.example.pipeline.shared.model.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventControllerTest {

    @Mock
    private EventIngestionService ingestionService;
    @Mock
    private EventQueryService queryService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new EventController(ingestionService, queryService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static Event storedEvent() {
        return Event.builder()
                .id("evt_0123456789ab")
                .eventType("quiz_started")
                .source("quiz-engine")
                .sessionId("s-1")
                .userId("u-1")
                .payload(Map.of("quiz_id", "qz-1"))
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("POST /api/v1/events answers 201 with the stored event")
    void publishReturnsCreated() {
        when(ingestionService.publish(any())).thenReturn(Mono.just(new PublishResult(storedEvent(), true)));

        client.post().uri("/api/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"event_type": "quiz_started", "source": "quiz-engine",
                         "session_id": "s-1", "user_id": "u-1", "payload": {"quiz_id": "qz-1"}}
                        """)
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo("evt_0123456789ab")
                .jsonPath("$.event_type").isEqualTo("quiz_started")
                .jsonPath("$.session_id").isEqualTo("s-1")
                .jsonPath("$.payload.quiz_id").isEqualTo("qz-1")
                .jsonPath("$.timestamp").isEqualTo("2024-05-01T10:00:00Z");
    }

    @Test
    @DisplayName("The unversioned alias behaves the same")
    void publishAlias() {
        when(ingestionService.publish(any())).thenReturn(Mono.just(new PublishResult(storedEvent(), false)));

        client.post().uri("/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("event_type", "quiz_started", "source", "quiz-engine"))
                .exchange()
                .expectStatus().isCreated();
    }

    @Test
    @DisplayName("Validation failures from ingestion map to 400")
    void invalidEventIsBadRequest() {
        when(ingestionService.publish(any())).thenReturn(Mono.error(new InvalidEventException("Unknown event_type 'nope'")));

        client.post().uri("/api/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("event_type", "nope", "source", "quiz-engine"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.message").isEqualTo("Unknown event_type 'nope'");
    }

    @Test
    @DisplayName("A body missing required fields never reaches ingestion")
    void missingSourceIsBadRequest() {
        client.post().uri("/api/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("event_type", "quiz_started"))
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(ingestionService);
    }

    @Test
    @DisplayName("Query parameters are passed through to the store query")
    void queryPassesFilters() {
        when(queryService.query(any())).thenReturn(Mono.just(List.of(storedEvent())));

        client.get().uri("/api/v1/events?event_type=quiz_started&session_id=s-1&since=2024-05-01T09:00:00Z&limit=5")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo("evt_0123456789ab");

        ArgumentCaptor<EventQuery> captor = ArgumentCaptor.forClass(EventQuery.class);
        verify(queryService).query(captor.capture());
        EventQuery query = captor.getValue();
        assertThat(query.getEventType()).isEqualTo("quiz_started");
        assertThat(query.getSessionId()).isEqualTo("s-1");
        assertThat(query.getUserId()).isNull();
        assertThat(query.getSince()).isEqualTo(Instant.parse("2024-05-01T09:00:00Z"));
        assertThat(query.getLimit()).isEqualTo(5);
    }

    @Test
    void queryDefaultsLimit() {
        when(queryService.query(any())).thenReturn(Mono.just(List.of()));

        client.get().uri("/events").exchange().expectStatus().isOk();

        ArgumentCaptor<EventQuery> captor = ArgumentCaptor.forClass(EventQuery.class);
        verify(queryService).query(captor.capture());
        assertThat(captor.getValue().getLimit()).isEqualTo(EventQuery.DEFAULT_LIMIT);
    }

    @Test
    @DisplayName("Malformed timestamps and out-of-range limits are rejected")
    void badQueryParameters() {
        client.get().uri("/api/v1/events?since=yesterday").exchange().expectStatus().isBadRequest();
        client.get().uri("/api/v1/events?limit=0").exchange().expectStatus().isBadRequest();
        client.get().uri("/api/v1/events?limit=1001").exchange().expectStatus().isBadRequest();
        client.delete().uri("/api/v1/events?before=not-a-date").exchange().expectStatus().isBadRequest();

        verifyNoInteractions(queryService);
    }

    @Test
    void unknownEventIsNotFound() {
        when(queryService.getById("evt_missing"))
                .thenReturn(Mono.error(new ResourceNotFoundException("Event not found: evt_missing")));

        client.get().uri("/api/v1/events/evt_missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.path").isEqualTo("/api/v1/events/evt_missing");
    }

    @Test
    @DisplayName("DELETE without 'before' purges everything")
    void deleteAll() {
        when(queryService.deleteEvents(null)).thenReturn(Mono.just(3));

        client.delete().uri("/api/v1/events")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deleted").isEqualTo(3);
    }

    @Test
    void deleteBeforeCutoff() {
        Instant cutoff = Instant.parse("2024-05-01T00:00:00Z");
        when(queryService.deleteEvents(cutoff)).thenReturn(Mono.just(1));

        client.delete().uri("/api/v1/events?before=2024-05-01T00:00:00")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deleted").isEqualTo(1);
    }

    @Test
    void eventTypesAreListed() {
        client.get().uri("/api/v1/event-types")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.quiz_started").isEqualTo("Student started a quiz session")
                .jsonPath("$.error_occurred").exists();
    }

    @Test
    void timestampParsingAcceptsOffsets() {
        assertThat(EventController.parseTimestamp("since", "2024-05-01T12:00:00+02:00"))
                .isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(EventController.parseTimestamp("since", null)).isNull();
    }
}
