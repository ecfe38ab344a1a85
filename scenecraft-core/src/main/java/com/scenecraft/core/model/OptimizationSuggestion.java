package com.scenecraft.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One edit proposed by a round analysis.
 *
 * @param action add, remove or modify
 * @param targetNode name of the node the edit applies to
 * @param reason why the edit is proposed
 * @param replacement replacement or new node data, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OptimizationSuggestion(
    @JsonProperty("action") SuggestionAction action,
    @JsonProperty("target_node") String targetNode,
    @JsonProperty("reason") String reason,
    @JsonProperty("new_data") NodeSpec replacement
) {
    /**
     * Compact constructor with validation.
     */
    public OptimizationSuggestion {
        Objects.requireNonNull(action, "action must not be null");
        if (targetNode == null) {
            targetNode = "";
        }
        if (reason == null) {
            reason = "";
        }
    }
}
