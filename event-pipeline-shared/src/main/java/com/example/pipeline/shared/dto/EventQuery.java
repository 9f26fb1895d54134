package com.example.pipeline.shared.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * History query against the event store. Null fields are not filtered on.
 */
@Value
@Builder
public class EventQuery {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    String eventType;
    String sessionId;
    String userId;
    Instant since;
    @Builder.Default
    int limit = DEFAULT_LIMIT;
}
