package com.example.pipeline.server.service;

import com.example.pipeline.server.router.EventRouter;
import com.example.pipeline.shared.dto.EventQuery;
import com.example.pipeline.shared.dto.EventStatistics;
import com.example.pipeline.shared.exception.ResourceNotFoundException;
import com.example.pipeline.shared.model.Event;
import com.example.pipeline.shared.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class EventQueryService {

    private static final Duration RECENT_WINDOW = Duration.ofHours(1);

    private final EventRepository eventRepository;
    private final EventRouter eventRouter;
    private final Scheduler jdbcScheduler;
    private final Clock clock;

    public Mono<List<Event>> query(EventQuery query) {
        return Mono.fromCallable(() -> eventRepository.query(query))
                .subscribeOn(jdbcScheduler);
    }

    public Mono<Event> getById(String id) {
        return Mono.fromCallable(() -> eventRepository.findById(id)
                        .orElseThrow(() -> new ResourceNotFoundException("Event not found: " + id)))
                .subscribeOn(jdbcScheduler);
    }

    public Mono<EventStatistics> getStatistics() {
        return Mono.fromCallable(() -> EventStatistics.builder()
                        .totalEvents(eventRepository.countAll())
                        .eventsLastHour(eventRepository.countSince(Instant.now(clock).minus(RECENT_WINDOW)))
                        .byType(eventRepository.countByType())
                        .router(eventRouter.getStats())
                        .build())
                .subscribeOn(jdbcScheduler);
    }

    /**
     * Purges events strictly older than {@code before}; with no bound, purges every event and
     * all per-type counters.
     *
     * @return number of events deleted
     */
    public Mono<Integer> deleteEvents(Instant before) {
        return Mono.fromCallable(() -> {
                    int deleted = eventRepository.deleteEvents(before);
                    log.info("Deleted {} event(s){}", deleted, before == null ? "" : " older than " + before);
                    return deleted;
                })
                .subscribeOn(jdbcScheduler);
    }

    public Mono<Boolean> isStoreAvailable() {
        return Mono.fromCallable(eventRepository::ping)
                .subscribeOn(jdbcScheduler)
                .onErrorResume(e -> {
                    log.warn("Event store health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }
}
