package com.scenecraft.core.model;

/**
 * Aggregate counts derived from a full tree walk.
 *
 * @param totalItems number of item nodes
 * @param totalContainers number of container nodes
 * @param maxDepthReached deepest node level present
 */
public record TreeStatistics(
    int totalItems,
    int totalContainers,
    int maxDepthReached
) {
    /**
     * Statistics of an empty tree.
     *
     * @return all-zero statistics
     */
    public static TreeStatistics empty() {
        return new TreeStatistics(0, 0, 0);
    }

    /**
     * Returns the total number of nodes.
     *
     * @return items plus containers
     */
    public int totalNodes() {
        return totalItems + totalContainers;
    }
}
