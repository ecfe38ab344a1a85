package com.scenecraft.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Candidate node as delivered by the generative service.
 *
 * <p>Enum-valued fields are kept raw; the node factory parses them and falls back to
 * safe defaults when a value is not recognized.
 *
 * @param name node name
 * @param nodeType raw node type ("item" or "container")
 * @param containerType raw container type ("physical", "character", "abstract"), containers only
 * @param description free-text description
 * @param position optional position description
 * @param attributes free-form attributes (material, color, size, condition, ...)
 * @param shouldExpand whether a container is worth expanding, null when not given
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeSpec(
    @JsonProperty("name") String name,
    @JsonProperty("node_type") String nodeType,
    @JsonProperty("container_type") String containerType,
    @JsonProperty("description") String description,
    @JsonProperty("position") String position,
    @JsonProperty("attributes") Map<String, Object> attributes,
    @JsonProperty("should_expand") Boolean shouldExpand
) {
    /**
     * Compact constructor with defaults.
     */
    public NodeSpec {
        if (name == null) {
            name = "";
        }
        if (description == null) {
            description = "";
        }
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates an item spec.
     *
     * @param name item name
     * @param description item description
     * @return item spec
     */
    public static NodeSpec item(String name, String description) {
        return new NodeSpec(name, NodeType.ITEM.value(), null, description, null, Map.of(), null);
    }

    /**
     * Creates a container spec that asks to be expanded.
     *
     * @param name container name
     * @param containerType container type
     * @param description container description
     * @return container spec
     */
    public static NodeSpec container(String name, ContainerType containerType, String description) {
        return new NodeSpec(name, NodeType.CONTAINER.value(), containerType.value(), description, null, Map.of(), true);
    }

    /**
     * Returns an attribute as a string.
     *
     * @param key attribute key
     * @return attribute value, or empty string when absent
     */
    public String attribute(String key) {
        Object value = attributes.get(key);
        return value == null ? "" : String.valueOf(value);
    }

    /**
     * Returns the description length after trimming.
     *
     * @return trimmed description length
     */
    public int descriptionLength() {
        return description.strip().length();
    }
}
