package com.scenecraft.core.engine;

import java.util.List;
import java.util.Locale;

/**
 * Immutable tuning for one generation run.
 *
 * <p>Invalid values are normalized rather than rejected: negative counts become 0,
 * concurrency below 1 becomes 1 and the completeness threshold is clamped to 0-100.
 *
 * @param maxDepth containers at this level or deeper are never expanded
 * @param maxNodesPerContainer cap on children admitted from one expansion
 * @param parallelExpansion whether a wave runs its service calls concurrently
 * @param parallelBatchSize containers per wave in exhaustive mode
 * @param maxConcurrent maximum in-flight service calls
 * @param maxTotalNodes total node budget for the run
 * @param minDescriptionLength shortest acceptable candidate description
 * @param costControl whether candidates go through the admission filter
 * @param aggressivePruning whether the prune phase runs on even rounds
 * @param importanceThreshold reserved, not interpreted by the engine
 * @param maxRounds maximum number of refinement rounds
 * @param completenessThreshold score at which the refinement loop stops
 * @param minNewNodesPerRound net growth below which the loop stops (from round 2)
 * @param maxIterations iteration cap for exhaustive mode
 * @param genericItemNames names of structural items that are not worth a node
 * @param genericDescriptionLength generic items with shorter descriptions are rejected
 * @param placeholderNames item names treated as placeholders by the pruner
 * @param nearEmptyDescriptionLength item descriptions shorter than this are pruned
 * @param minDescriptionDelta minimum length change for a description update
 */
public record GeneratorConfig(
    int maxDepth,
    int maxNodesPerContainer,
    boolean parallelExpansion,
    int parallelBatchSize,
    int maxConcurrent,
    int maxTotalNodes,
    int minDescriptionLength,
    boolean costControl,
    boolean aggressivePruning,
    double importanceThreshold,
    int maxRounds,
    int completenessThreshold,
    int minNewNodesPerRound,
    int maxIterations,
    List<String> genericItemNames,
    int genericDescriptionLength,
    List<String> placeholderNames,
    int nearEmptyDescriptionLength,
    int minDescriptionDelta
) {
    public static final List<String> DEFAULT_GENERIC_ITEM_NAMES = List.of(
        "door", "wall", "floor", "ceiling", "window",
        "门", "墙", "地板", "天花板", "窗户"
    );

    public static final List<String> DEFAULT_PLACEHOLDER_NAMES = List.of(
        "item", "object", "thing", "unknown", "unnamed item", "placeholder",
        "物品", "东西", "未知"
    );

    /**
     * Compact constructor with normalization.
     */
    public GeneratorConfig {
        maxDepth = Math.max(0, maxDepth);
        maxNodesPerContainer = Math.max(0, maxNodesPerContainer);
        parallelBatchSize = Math.max(1, parallelBatchSize);
        maxConcurrent = Math.max(1, maxConcurrent);
        maxTotalNodes = Math.max(0, maxTotalNodes);
        minDescriptionLength = Math.max(0, minDescriptionLength);
        maxRounds = Math.max(0, maxRounds);
        completenessThreshold = Math.max(0, Math.min(100, completenessThreshold));
        minNewNodesPerRound = Math.max(0, minNewNodesPerRound);
        maxIterations = Math.max(0, maxIterations);
        genericItemNames = genericItemNames == null ? DEFAULT_GENERIC_ITEM_NAMES : List.copyOf(genericItemNames);
        genericDescriptionLength = Math.max(0, genericDescriptionLength);
        placeholderNames = placeholderNames == null ? DEFAULT_PLACEHOLDER_NAMES : List.copyOf(placeholderNames);
        nearEmptyDescriptionLength = Math.max(0, nearEmptyDescriptionLength);
        minDescriptionDelta = Math.max(0, minDescriptionDelta);
    }

    /**
     * Returns the default configuration.
     *
     * @return default config
     */
    public static GeneratorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this configuration.
     *
     * @return builder copy
     */
    public Builder toBuilder() {
        return new Builder()
            .maxDepth(maxDepth)
            .maxNodesPerContainer(maxNodesPerContainer)
            .parallelExpansion(parallelExpansion)
            .parallelBatchSize(parallelBatchSize)
            .maxConcurrent(maxConcurrent)
            .maxTotalNodes(maxTotalNodes)
            .minDescriptionLength(minDescriptionLength)
            .costControl(costControl)
            .aggressivePruning(aggressivePruning)
            .importanceThreshold(importanceThreshold)
            .maxRounds(maxRounds)
            .completenessThreshold(completenessThreshold)
            .minNewNodesPerRound(minNewNodesPerRound)
            .maxIterations(maxIterations)
            .genericItemNames(genericItemNames)
            .genericDescriptionLength(genericDescriptionLength)
            .placeholderNames(placeholderNames)
            .nearEmptyDescriptionLength(nearEmptyDescriptionLength)
            .minDescriptionDelta(minDescriptionDelta);
    }

    /**
     * Checks whether a name is on the generic structural-item deny-list.
     *
     * @param name candidate name
     * @return true if deny-listed (case-insensitive)
     */
    public boolean isGenericItemName(String name) {
        return matches(genericItemNames, name);
    }

    /**
     * Checks whether a name is a placeholder name.
     *
     * @param name node name
     * @return true if placeholder (case-insensitive)
     */
    public boolean isPlaceholderName(String name) {
        return matches(placeholderNames, name);
    }

    private static boolean matches(List<String> names, String name) {
        if (name == null) {
            return false;
        }
        String normalized = name.strip().toLowerCase(Locale.ROOT);
        return names.stream().anyMatch(candidate -> candidate.toLowerCase(Locale.ROOT).equals(normalized));
    }

    /**
     * Builder for {@link GeneratorConfig}, starting from the defaults.
     */
    public static class Builder {
        private int maxDepth = 5;
        private int maxNodesPerContainer = 20;
        private boolean parallelExpansion = true;
        private int parallelBatchSize = 5;
        private int maxConcurrent = 30;
        private int maxTotalNodes = 200;
        private int minDescriptionLength = 10;
        private boolean costControl = true;
        private boolean aggressivePruning = true;
        private double importanceThreshold = 0.5;
        private int maxRounds = 5;
        private int completenessThreshold = 90;
        private int minNewNodesPerRound = 3;
        private int maxIterations = 20;
        private List<String> genericItemNames = DEFAULT_GENERIC_ITEM_NAMES;
        private int genericDescriptionLength = 20;
        private List<String> placeholderNames = DEFAULT_PLACEHOLDER_NAMES;
        private int nearEmptyDescriptionLength = 5;
        private int minDescriptionDelta = 5;

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxNodesPerContainer(int maxNodesPerContainer) {
            this.maxNodesPerContainer = maxNodesPerContainer;
            return this;
        }

        public Builder parallelExpansion(boolean parallelExpansion) {
            this.parallelExpansion = parallelExpansion;
            return this;
        }

        public Builder parallelBatchSize(int parallelBatchSize) {
            this.parallelBatchSize = parallelBatchSize;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder maxTotalNodes(int maxTotalNodes) {
            this.maxTotalNodes = maxTotalNodes;
            return this;
        }

        public Builder minDescriptionLength(int minDescriptionLength) {
            this.minDescriptionLength = minDescriptionLength;
            return this;
        }

        public Builder costControl(boolean costControl) {
            this.costControl = costControl;
            return this;
        }

        public Builder aggressivePruning(boolean aggressivePruning) {
            this.aggressivePruning = aggressivePruning;
            return this;
        }

        public Builder importanceThreshold(double importanceThreshold) {
            this.importanceThreshold = importanceThreshold;
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder completenessThreshold(int completenessThreshold) {
            this.completenessThreshold = completenessThreshold;
            return this;
        }

        public Builder minNewNodesPerRound(int minNewNodesPerRound) {
            this.minNewNodesPerRound = minNewNodesPerRound;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder genericItemNames(List<String> genericItemNames) {
            this.genericItemNames = genericItemNames;
            return this;
        }

        public Builder genericDescriptionLength(int genericDescriptionLength) {
            this.genericDescriptionLength = genericDescriptionLength;
            return this;
        }

        public Builder placeholderNames(List<String> placeholderNames) {
            this.placeholderNames = placeholderNames;
            return this;
        }

        public Builder nearEmptyDescriptionLength(int nearEmptyDescriptionLength) {
            this.nearEmptyDescriptionLength = nearEmptyDescriptionLength;
            return this;
        }

        public Builder minDescriptionDelta(int minDescriptionDelta) {
            this.minDescriptionDelta = minDescriptionDelta;
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(
                maxDepth, maxNodesPerContainer, parallelExpansion, parallelBatchSize, maxConcurrent,
                maxTotalNodes, minDescriptionLength, costControl, aggressivePruning, importanceThreshold,
                maxRounds, completenessThreshold, minNewNodesPerRound, maxIterations,
                genericItemNames, genericDescriptionLength, placeholderNames, nearEmptyDescriptionLength,
                minDescriptionDelta
            );
        }
    }
}
