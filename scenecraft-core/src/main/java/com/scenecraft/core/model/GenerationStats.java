package com.scenecraft.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Counters of one generation run, captured when the run ends.
 *
 * @param totalAiCalls number of generative service calls issued
 * @param totalNodesGenerated number of nodes admitted into the tree
 * @param totalContainersExpanded number of successful container expansions
 * @param generationTime wall-clock duration of the run
 * @param tree tree statistics at the end of the run
 */
public record GenerationStats(
    int totalAiCalls,
    int totalNodesGenerated,
    int totalContainersExpanded,
    Duration generationTime,
    TreeStatistics tree
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationStats {
        Objects.requireNonNull(generationTime, "generationTime must not be null");
        if (tree == null) {
            tree = TreeStatistics.empty();
        }
    }

    /**
     * Returns a human-readable summary.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "AI calls: %d, Nodes generated: %d, Containers expanded: %d, Items: %d, Containers: %d, Max depth: %d, Time: %.2fs",
            totalAiCalls,
            totalNodesGenerated,
            totalContainersExpanded,
            tree.totalItems(),
            tree.totalContainers(),
            tree.maxDepthReached(),
            generationTime.toMillis() / 1000.0
        );
    }
}
