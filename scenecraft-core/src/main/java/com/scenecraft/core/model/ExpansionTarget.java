package com.scenecraft.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A container the analysis recommends expanding next.
 *
 * @param name container name
 * @param reason why it should be expanded
 * @param priority 1 (lowest) to 5 (highest)
 */
public record ExpansionTarget(
    @JsonProperty("name") String name,
    @JsonProperty("reason") String reason,
    @JsonProperty("priority") int priority
) {
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    /**
     * Compact constructor, clamps priority into range.
     */
    public ExpansionTarget {
        Objects.requireNonNull(name, "name must not be null");
        if (reason == null) {
            reason = "";
        }
        priority = Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priority));
    }
}
