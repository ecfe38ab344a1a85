package com.scenecraft.core.model;

import java.util.List;

/**
 * Audit record for one completed round. Round 0 is the seed.
 *
 * @param roundNumber round number
 * @param expandedContainers names of containers expanded in this round
 * @param nodesAdded nodes inserted in this round (expansion, seeding and reconciliation)
 * @param netNodeChange tree size after the round minus tree size before it
 * @param summary textual summary from the analysis
 * @param completenessScore 0-100 completeness estimate
 * @param issues issues reported by the analysis
 * @param suggestions optimization suggestions reported by the analysis
 */
public record RoundInfo(
    int roundNumber,
    List<String> expandedContainers,
    int nodesAdded,
    int netNodeChange,
    String summary,
    int completenessScore,
    List<String> issues,
    List<OptimizationSuggestion> suggestions
) {
    /**
     * Compact constructor with defensive copies.
     */
    public RoundInfo {
        expandedContainers = expandedContainers == null ? List.of() : List.copyOf(expandedContainers);
        if (summary == null) {
            summary = "";
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
