package com.example.pipeline.server.websocket;

import com.example.pipeline.server.router.DeliveryResult;
import com.example.pipeline.shared.model.Event;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebSocketSubscriberConnectionTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static Event event(String id) {
        return Event.builder()
                .id(id)
                .eventType("timer_tick")
                .source("timer")
                .payload(Map.of("remaining", 30))
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    @Test
    void eventsAndRepliesShareOneOrderedStream() {
        WebSocketSubscriberConnection connection = new WebSocketSubscriberConnection("sub_1", "127.0.0.1", objectMapper, 16);

        assertThat(connection.send(event("evt_1"))).isEqualTo(DeliveryResult.DELIVERED);
        assertThat(connection.sendControl(Map.of("type", "pong"))).isEqualTo(DeliveryResult.DELIVERED);
        connection.close();

        StepVerifier.create(connection.frames())
                .assertNext(frame -> assertThat(frame)
                        .contains("\"id\":\"evt_1\"")
                        .contains("\"event_type\":\"timer_tick\"")
                        .contains("\"timestamp\":\"2024-05-01T10:00:00Z\""))
                .expectNext("{\"type\":\"pong\"}")
                .verifyComplete();
    }

    @Test
    void overflowingBufferFailsDelivery() {
        WebSocketSubscriberConnection connection = new WebSocketSubscriberConnection("sub_1", "127.0.0.1", objectMapper, 2);

        assertThat(connection.send(event("evt_1"))).isEqualTo(DeliveryResult.DELIVERED);
        assertThat(connection.send(event("evt_2"))).isEqualTo(DeliveryResult.DELIVERED);
        assertThat(connection.send(event("evt_3"))).isEqualTo(DeliveryResult.FAILED);

        StepVerifier.create(connection.frames())
                .expectNextCount(2)
                .verifyComplete();
    }

    @Test
    void closedConnectionFailsDelivery() {
        WebSocketSubscriberConnection connection = new WebSocketSubscriberConnection("sub_1", "127.0.0.1", objectMapper, 16);
        connection.close();

        assertThat(connection.send(event("evt_1"))).isEqualTo(DeliveryResult.FAILED);
    }
}
