package com.scenecraft.core.model;

import java.util.Objects;

/**
 * Everything the generative service needs to expand one container.
 *
 * @param containerName container name
 * @param containerType container type
 * @param description container description
 * @param theme theme inherited by the container
 * @param level container level (root = 0)
 */
public record ExpansionRequest(
    String containerName,
    ContainerType containerType,
    String description,
    String theme,
    int level
) {
    /**
     * Compact constructor with validation.
     */
    public ExpansionRequest {
        Objects.requireNonNull(containerName, "containerName must not be null");
        Objects.requireNonNull(containerType, "containerType must not be null");
        if (description == null) {
            description = "";
        }
        if (theme == null) {
            theme = "";
        }
    }
}
