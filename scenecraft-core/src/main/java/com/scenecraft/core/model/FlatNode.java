package com.scenecraft.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Flattened, prompt-friendly view of one tree node.
 *
 * @param name node name
 * @param nodeType node type
 * @param containerType container type, null for items
 * @param level node level
 * @param path full slash-joined path
 * @param description description, truncated for prompts
 * @param expanded whether a container has been expanded (false for items)
 * @param childCount number of direct children (0 for items)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlatNode(
    @JsonProperty("name") String name,
    @JsonProperty("node_type") NodeType nodeType,
    @JsonProperty("container_type") ContainerType containerType,
    @JsonProperty("level") int level,
    @JsonProperty("path") String path,
    @JsonProperty("description") String description,
    @JsonProperty("is_expanded") boolean expanded,
    @JsonProperty("child_count") int childCount
) {
    /**
     * Compact constructor with validation.
     */
    public FlatNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(nodeType, "nodeType must not be null");
        if (description == null) {
            description = "";
        }
    }
}
