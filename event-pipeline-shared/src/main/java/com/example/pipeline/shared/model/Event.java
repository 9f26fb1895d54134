package com.example.pipeline.shared.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single occurrence published into the pipeline.
 * Instances are immutable: the router and the store only read them.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Event {

    String id;
    String eventType;
    String source;
    String sessionId;
    String userId;
    Map<String, Object> payload;
    Instant timestamp;

    @Builder(toBuilder = true)
    private Event(String id,
                  String eventType,
                  String source,
                  String sessionId,
                  String userId,
                  Map<String, Object> payload,
                  Instant timestamp) {
        this.id = id;
        this.eventType = eventType;
        this.source = source;
        this.sessionId = sessionId;
        this.userId = userId;
        // payload values may be null, so Map.copyOf is not an option
        this.payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.timestamp = timestamp;
    }
}
