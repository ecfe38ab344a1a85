package com.scenecraft.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Discriminant of the two scene node variants.
 *
 * <p>All branching on node kind goes through this value rather than runtime type checks.
 */
public enum NodeType {
    /** Terminal node, cannot own children (apple, cup, key) */
    ITEM("item"),

    /** Node that owns an ordered list of children and can be expanded */
    CONTAINER("container");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    /**
     * Returns the wire value used in service payloads and saved scenes.
     *
     * @return lowercase wire value
     */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a wire value.
     *
     * @param value raw value, may be null
     * @return matching type, or empty if unrecognized
     */
    public static Optional<NodeType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
