package com.scenecraft.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of edit proposed by a round analysis.
 */
public enum SuggestionAction {
    ADD,
    REMOVE,
    MODIFY;

    /**
     * Parses a wire value, case-insensitive.
     *
     * @param value raw value
     * @return matching action, or empty if unrecognized
     */
    public static Optional<SuggestionAction> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
