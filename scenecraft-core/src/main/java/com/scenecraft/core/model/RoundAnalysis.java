package com.scenecraft.core.model;

import java.util.List;

/**
 * Result of analyzing the tree at the start of a round.
 *
 * @param summary textual summary of the current tree
 * @param completenessScore 0-100 estimate of how well the tree meets the requirement
 * @param issuesFound problems spotted in the tree
 * @param optimizationSuggestions ranked edits
 * @param containersToExpandNext ranked containers to expand next
 * @param containersToStop containers that should not be expanded
 * @param nextRoundFocus what the next round should concentrate on
 */
public record RoundAnalysis(
    String summary,
    int completenessScore,
    List<String> issuesFound,
    List<OptimizationSuggestion> optimizationSuggestions,
    List<ExpansionTarget> containersToExpandNext,
    List<String> containersToStop,
    String nextRoundFocus
) {
    /**
     * Compact constructor with defaults; clamps the score into 0-100.
     */
    public RoundAnalysis {
        if (summary == null) {
            summary = "";
        }
        completenessScore = Math.max(0, Math.min(100, completenessScore));
        issuesFound = issuesFound == null ? List.of() : List.copyOf(issuesFound);
        optimizationSuggestions = optimizationSuggestions == null ? List.of() : List.copyOf(optimizationSuggestions);
        containersToExpandNext = containersToExpandNext == null ? List.of() : List.copyOf(containersToExpandNext);
        containersToStop = containersToStop == null ? List.of() : List.copyOf(containersToStop);
        if (nextRoundFocus == null) {
            nextRoundFocus = "";
        }
    }

    /**
     * Analysis used when the service call failed.
     *
     * @return analysis with score 0 and no recommendations
     */
    public static RoundAnalysis empty() {
        return new RoundAnalysis("", 0, List.of(), List.of(), List.of(), List.of(), "");
    }
}
