package com.example.pipeline.shared.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Match criteria of one subscriber. Each of the three dimensions is optional;
 * an absent or empty dimension places no constraint on the event.
 * Comparison is exact and case-sensitive.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class EventFilter {

    private static final EventFilter MATCH_ALL = new EventFilter(null, null, null);

    Set<String> eventTypes;
    String sessionId;
    String userId;

    @Builder
    private EventFilter(Collection<String> eventTypes, String sessionId, String userId) {
        this.eventTypes = eventTypes == null || eventTypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(eventTypes));
        this.sessionId = blankToNull(sessionId);
        this.userId = blankToNull(userId);
    }

    public static EventFilter matchAll() {
        return MATCH_ALL;
    }

    public boolean matches(Event event) {
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.getEventType())) {
            return false;
        }
        if (sessionId != null && !sessionId.equals(event.getSessionId())) {
            return false;
        }
        return userId == null || Objects.equals(userId, event.getUserId());
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
