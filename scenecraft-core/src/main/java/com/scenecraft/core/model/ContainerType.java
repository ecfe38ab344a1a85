package com.scenecraft.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of container nodes.
 */
public enum ContainerType {
    /** Furniture, rooms, drawers, boxes */
    PHYSICAL("physical"),

    /** A person who carries, wears or holds things */
    CHARACTER("character"),

    /** Ideas, plans, systems, concepts */
    ABSTRACT("abstract");

    private final String value;

    ContainerType(String value) {
        this.value = value;
    }

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
    public static Optional<ContainerType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ContainerType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
