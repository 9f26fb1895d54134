package com.example.pipeline.server.controller;

import com.example.pipeline.server.service.EventIngestionService;
import com.example.pipeline.server.service.EventQueryService;
import com.example.pipeline.shared.aspect.Monitored;
import com.example.pipeline.shared.dto.EventQuery;
import com.example.pipeline.shared.dto.EventStatistics;
import com.example.pipeline.shared.dto.PublishEventRequest;
import com.example.pipeline.shared.model.Event;
import com.example.pipeline.shared.model.EventType;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Publish and history endpoints. Served under {@code /api/v1} and, for older clients,
 * without the version prefix.
 */
@RestController
@RequestMapping({"/api/v1", ""})
@RequiredArgsConstructor
@Slf4j
@Monitored("controller")
public class EventController {

    private final EventIngestionService ingestionService;
    private final EventQueryService queryService;

    @PostMapping("/events")
    @RateLimiter(name = "publishLimiter")
    public Mono<ResponseEntity<Event>> publishEvent(@Valid @RequestBody PublishEventRequest request) {
        log.debug("Received event type={} from source={}", request.getEventType(), request.getSource());
        return ingestionService.publish(request)
                .map(result -> ResponseEntity.status(HttpStatus.CREATED).body(result.getEvent()));
    }

    @GetMapping("/events")
    @RateLimiter(name = "queryLimiter")
    public Mono<ResponseEntity<List<Event>>> queryEvents(
            @RequestParam(name = "event_type", required = false) String eventType,
            @RequestParam(name = "session_id", required = false) String sessionId,
            @RequestParam(name = "user_id", required = false) String userId,
            @RequestParam(required = false) String since,
            @RequestParam(defaultValue = "" + EventQuery.DEFAULT_LIMIT) int limit) {
        if (limit < 1 || limit > EventQuery.MAX_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "limit must be between 1 and " + EventQuery.MAX_LIMIT);
        }
        EventQuery query = EventQuery.builder()
                .eventType(eventType)
                .sessionId(sessionId)
                .userId(userId)
                .since(parseTimestamp("since", since))
                .limit(limit)
                .build();
        return queryService.query(query).map(ResponseEntity::ok);
    }

    @GetMapping("/events/{id}")
    @RateLimiter(name = "queryLimiter")
    public Mono<ResponseEntity<Event>> getEvent(@PathVariable String id) {
        return queryService.getById(id).map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    @RateLimiter(name = "queryLimiter")
    public Mono<ResponseEntity<EventStatistics>> getStatistics() {
        return queryService.getStatistics().map(ResponseEntity::ok);
    }

    @DeleteMapping("/events")
    @RateLimiter(name = "adminLimiter")
    public Mono<ResponseEntity<Map<String, Integer>>> deleteEvents(@RequestParam(required = false) String before) {
        Instant cutoff = parseTimestamp("before", before);
        log.info("Admin delete of events{}", cutoff == null ? " (all)" : " older than " + cutoff);
        return queryService.deleteEvents(cutoff)
                .map(deleted -> ResponseEntity.ok(Map.of("deleted", deleted)));
    }

    @GetMapping("/event-types")
    public ResponseEntity<Map<String, String>> getEventTypes() {
        return ResponseEntity.ok(EventType.descriptions());
    }

    /**
     * Accepts ISO-8601 with an offset or {@code Z}; a timestamp without an offset is read as UTC.
     */
    static Instant parseTimestamp(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException localFormatError) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Invalid '" + name + "' timestamp: " + value + " (expected ISO-8601)", e);
            }
        }
    }
}
