package com.scenecraft.core.tree;

import java.util.Locale;

/**
 * Decides whether a field refresh coming from the generative service is worth applying.
 *
 * <p>Cosmetic deltas (whitespace, letter case, trivially shorter or longer wording)
 * are ignored so repeated optimization rounds do not churn the tree.
 *
 * @param minDescriptionLength shortest description accepted as a replacement
 * @param minDescriptionDelta smallest length difference that counts as a real rewrite
 */
public record UpdatePolicy(
    int minDescriptionLength,
    int minDescriptionDelta
) {
    /**
     * Compact constructor, negative values become 0.
     */
    public UpdatePolicy {
        minDescriptionLength = Math.max(0, minDescriptionLength);
        minDescriptionDelta = Math.max(0, minDescriptionDelta);
    }

    public static UpdatePolicy defaults() {
        return new UpdatePolicy(10, 5);
    }

    /**
     * Checks a description replacement.
     *
     * @param current current description
     * @param candidate proposed description
     * @return true if the candidate should replace the current description
     */
    public boolean isDescriptionUpdateWorthy(String current, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        if (normalize(current).equals(normalize(candidate))) {
            return false;
        }
        int candidateLength = candidate.strip().length();
        if (candidateLength < minDescriptionLength) {
            return false;
        }
        int currentLength = current == null ? 0 : current.strip().length();
        if (currentLength < minDescriptionLength) {
            return true;
        }
        return Math.abs(candidateLength - currentLength) >= minDescriptionDelta;
    }

    /**
     * Checks a short scalar replacement such as a position or a color.
     *
     * @param current current value, may be null
     * @param candidate proposed value, may be null
     * @return true if the candidate is non-blank and differs after normalization
     */
    public boolean isValueUpdateWorthy(String current, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        return !normalize(current).equals(normalize(candidate));
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
