package com.example.pipeline.shared.dto;

import com.example.pipeline.shared.model.EventFilter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Filter configuration sent by a subscriber, either as the first frame of the
 * subscribe socket or inside an {@code update_filters} message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubscriptionRequest {

    private List<String> eventTypes;
    private String sessionId;
    private String userId;

    public EventFilter toFilter() {
        return EventFilter.builder()
                .eventTypes(eventTypes)
                .sessionId(sessionId)
                .userId(userId)
                .build();
    }
}
