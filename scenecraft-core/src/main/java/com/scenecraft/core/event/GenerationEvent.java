package com.scenecraft.core.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One structured record of something that happened during a generation run.
 *
 * @param timestamp when the event occurred
 * @param type event kind
 * @param round round the event belongs to (0 for seeding and exhaustive mode)
 * @param message human-readable description
 * @param data structured key/value payload
 */
public record GenerationEvent(
    Instant timestamp,
    GenerationEventType type,
    int round,
    String message,
    Map<String, Object> data
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationEvent {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (message == null) {
            message = "";
        }
        // LinkedHashMap keeps key order and tolerates null values, unlike Map.copyOf
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Creates an event stamped with the current time.
     *
     * @param type event kind
     * @param round round number
     * @param message description
     * @param data payload
     * @return new event
     */
    public static GenerationEvent of(GenerationEventType type, int round, String message, Map<String, Object> data) {
        return new GenerationEvent(Instant.now(), type, round, message, data);
    }
}
