package com.example.pipeline.shared.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound event as sent by a publisher over REST or the publish WebSocket.
 * Bean validation covers the shape; type and payload limits are checked by
 * {@link com.example.pipeline.shared.service.EventValidator}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PublishEventRequest implements CorrelatedRequest {

    private String correlationId;

    @NotBlank(message = "event_type is required")
    private String eventType;

    @NotBlank(message = "source is required")
    @Size(max = 100, message = "source must be at most 100 characters")
    @Pattern(regexp = "^[a-zA-Z0-9_\\-.]+$", message = "source may only contain letters, digits, '_', '-' and '.'")
    private String source;

    @Size(max = 200, message = "session_id must be at most 200 characters")
    private String sessionId;

    @Size(max = 200, message = "user_id must be at most 200 characters")
    private String userId;

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();
}
