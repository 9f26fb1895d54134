package com.example.pipeline.shared.service;

import com.example.pipeline.shared.config.AppProperties;
import com.example.pipeline.shared.dto.PublishEventRequest;
import com.example.pipeline.shared.exception.InvalidEventException;
import com.example.pipeline.shared.model.EventType;
import com.example.pipeline.shared.util.JsonUtils;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a publish request before it is stored: bean constraints, the event type
 * registry and the configured payload limits. WebSocket frames bypass the
 * {@code @Valid} binding of the REST layer, so the bean constraints are applied here too.
 */
@Component
@RequiredArgsConstructor
public class EventValidator {

    private final Validator validator;
    private final AppProperties appProperties;

    public void validate(PublishEventRequest request) {
        if (request == null) {
            throw new InvalidEventException("Event body is required");
        }

        Set<ConstraintViolation<PublishEventRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new InvalidEventException(violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(ConstraintViolation::getMessage)
                    .collect(Collectors.joining(", ")));
        }

        if (!EventType.isKnown(request.getEventType())) {
            throw new InvalidEventException(String.format(
                    "Unknown event_type '%s'. Must be one of: %s",
                    request.getEventType(), EventType.knownWireNames()));
        }

        validatePayload(request.getPayload());
    }

    private void validatePayload(Map<String, Object> payload) {
        if (payload == null) {
            return;
        }
        AppProperties.Payload limits = appProperties.getPayload();
        if (payload.size() > limits.getMaxKeys()) {
            throw new InvalidEventException(String.format(
                    "Payload has %d keys (max %d)", payload.size(), limits.getMaxKeys()));
        }
        int size;
        try {
            size = JsonUtils.serializedSize(payload);
        } catch (IllegalArgumentException e) {
            throw new InvalidEventException("Payload is not valid JSON");
        }
        if (size > limits.getMaxBytes()) {
            throw new InvalidEventException(String.format(
                    "Payload is %d bytes (max %d)", size, limits.getMaxBytes()));
        }
    }
}
