package com.example.pipeline.shared.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Registry of the event kinds accepted at the ingestion boundary.
 * The router never looks at this enum; it matches on the wire name only.
 */
public enum EventType {

    // Quiz events
    QUIZ_STARTED("Student started a quiz session"),
    QUIZ_COMPLETED("Student completed/submitted quiz"),
    QUIZ_TIMEOUT("Quiz timer expired"),
    // Answer events
    ANSWER_SUBMITTED("Student submitted an answer"),
    ANSWER_CHANGED("Student changed their answer"),
    // Navigation events
    QUESTION_VIEWED("Student viewed a question"),
    QUESTION_SKIPPED("Student skipped a question"),
    // Timer events
    TIMER_STARTED("Session timer started"),
    TIMER_TICK("Timer tick (usually every second)"),
    TIMER_WARNING("Timer warning threshold reached"),
    // Progress events
    MASTERY_UPDATED("Student mastery level changed"),
    LEARNING_GAP_DETECTED("Learning gap identified"),
    // System events
    SESSION_CREATED("New session created"),
    SESSION_ENDED("Session ended"),
    ERROR_OCCURRED("Error in system");

    private static final Map<String, EventType> BY_WIRE_NAME;

    static {
        Map<String, EventType> byName = new LinkedHashMap<>();
        for (EventType type : values()) {
            byName.put(type.wireName(), type);
        }
        BY_WIRE_NAME = Collections.unmodifiableMap(byName);
    }

    private final String description;

    EventType(String description) {
        this.description = description;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String description() {
        return description;
    }

    public static Optional<EventType> fromWireName(String wireName) {
        return Optional.ofNullable(wireName).map(BY_WIRE_NAME::get);
    }

    public static boolean isKnown(String wireName) {
        return fromWireName(wireName).isPresent();
    }

    /**
     * Wire name to description, in declaration order.
     */
    public static Map<String, String> descriptions() {
        Map<String, String> result = new LinkedHashMap<>();
        Arrays.stream(values()).forEach(type -> result.put(type.wireName(), type.description()));
        return result;
    }

    public static String knownWireNames() {
        return String.join(", ", new TreeSet<>(BY_WIRE_NAME.keySet()));
    }
}
