package com.example.pipeline.shared.dto;

import com.example.pipeline.shared.model.EventTypeCount;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aggregate view of the event store, optionally enriched with live router figures.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EventStatistics {
    private long totalEvents;
    private long eventsLastHour;
    private List<EventTypeCount> byType;
    private RouterStats router;
}
