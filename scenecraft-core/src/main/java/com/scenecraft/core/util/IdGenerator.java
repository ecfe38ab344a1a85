package com.scenecraft.core.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Generates identifiers for scenes and scene nodes.
 *
 * <p>Node ids are opaque random tokens; they are unique within a run with
 * overwhelming probability and are never parsed.
 */
public final class IdGenerator {

    private static final int NODE_ID_LENGTH = 8;
    private static final DateTimeFormatter SCENE_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a short random node id.
     *
     * @return 8 lowercase hex characters
     */
    public static String newNodeId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, NODE_ID_LENGTH);
    }

    /**
     * Generates a random scene id.
     *
     * @return full random UUID string
     */
    public static String newSceneId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Builds a timestamped scene name such as {@code scene_20240101_120000}.
     *
     * @param time time the scene was started
     * @return scene name
     */
    public static String sceneName(LocalDateTime time) {
        if (time == null) {
            throw new IllegalArgumentException("time must not be null");
        }
        return "scene_" + SCENE_NAME_FORMAT.format(time);
    }
}
