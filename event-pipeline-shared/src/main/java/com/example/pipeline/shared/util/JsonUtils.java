package com.example.pipeline.shared.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON helpers for the payload column of the event store.
 */
@Slf4j
public final class JsonUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private JsonUtils() {}

    /**
     * Parses a stored payload document. Returns an empty map for null, blank or unreadable input.
     */
    public static Map<String, Object> parsePayload(String json) {
        if (json == null || json.trim().isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (Exception e) {
            log.warn("Failed to parse stored payload: {}", json, e);
            return new LinkedHashMap<>();
        }
    }

    /**
     * Serializes a payload for storage. An absent payload is stored as an empty object.
     */
    public static String toPayloadJson(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable to JSON", e);
        }
    }

    public static int serializedSize(Map<String, Object> payload) {
        return toPayloadJson(payload).getBytes(StandardCharsets.UTF_8).length;
    }
}
