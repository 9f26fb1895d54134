package com.example.pipeline.server.service;

import com.example.pipeline.server.router.EventRouter;
import com.example.pipeline.shared.dto.PublishEventRequest;
import com.example.pipeline.shared.model.Event;
import com.example.pipeline.shared.repository.EventRepository;
import com.example.pipeline.shared.service.EventValidator;
import com.example.pipeline.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Entry point for new events from both REST and the publish WebSocket.
 * <p>
 * An event is validated, stamped, written to the store and only then handed to the router.
 * The store is the source of truth: an event the router cannot queue is still stored and
 * the call still succeeds.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EventIngestionService {

    private final EventValidator eventValidator;
    private final EventRepository eventRepository;
    private final EventRouter eventRouter;
    private final Scheduler jdbcScheduler;
    private final Clock clock;

    public Mono<PublishResult> publish(PublishEventRequest request) {
        return Mono.fromCallable(() -> ingest(request))
                .subscribeOn(jdbcScheduler);
    }

    /**
     * Blocking variant, runs on the caller's thread.
     */
    public PublishResult ingest(PublishEventRequest request) {
        eventValidator.validate(request);

        Event event = Event.builder()
                .id(newEventId())
                .eventType(request.getEventType())
                .source(request.getSource())
                .sessionId(request.getSessionId())
                .userId(request.getUserId())
                .payload(request.getPayload())
                .timestamp(Instant.now(clock).truncatedTo(ChronoUnit.MICROS))
                .build();

        eventRepository.insert(event);
        log.info("Stored event {} type={} source={}", event.getId(), event.getEventType(), event.getSource());

        boolean routed = eventRouter.publish(event);
        if (!routed) {
            log.warn("Event {} persisted but not routed live", event.getId());
        }
        return new PublishResult(event, routed);
    }

    private String newEventId() {
        return Constants.EVENT_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
