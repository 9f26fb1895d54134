package com.example.pipeline.server.service;

import com.example.pipeline.server.router.EventRouter;
import com.example.pipeline.shared.dto.RouterStats;
import com.example.pipeline.shared.exception.ResourceNotFoundException;
import com.example.pipeline.shared.model.EventTypeCount;
import com.example.pipeline.shared.repository.EventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private EventRepository eventRepository;
    @Mock
    private EventRouter eventRouter;

    private EventQueryService service;

    @BeforeEach
    void setUp() {
        service = new EventQueryService(eventRepository, eventRouter, Schedulers.immediate(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void statisticsCombineStoreAndRouter() {
        when(eventRepository.countAll()).thenReturn(42L);
        when(eventRepository.countSince(NOW.minusSeconds(3600))).thenReturn(7L);
        when(eventRepository.countByType()).thenReturn(List.of(
                EventTypeCount.builder().eventType("timer_tick").count(40).lastSeen(NOW).build()));
        when(eventRouter.getStats()).thenReturn(new RouterStats(3, 1));

        StepVerifier.create(service.getStatistics())
                .assertNext(stats -> {
                    assertThat(stats.getTotalEvents()).isEqualTo(42);
                    assertThat(stats.getEventsLastHour()).isEqualTo(7);
                    assertThat(stats.getByType()).extracting(EventTypeCount::getEventType).containsExactly("timer_tick");
                    assertThat(stats.getRouter().getActiveSubscribers()).isEqualTo(3);
                })
                .verifyComplete();
    }

    @Test
    void missingEventIsNotFound() {
        when(eventRepository.findById("evt_nope")).thenReturn(Optional.empty());

        StepVerifier.create(service.getById("evt_nope"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void storeOutageReportsUnavailable() {
        when(eventRepository.ping()).thenThrow(new IllegalStateException("connection refused"));

        StepVerifier.create(service.isStoreAvailable())
                .expectNext(false)
                .verifyComplete();
    }
}
