package com.scenecraft.core.output;

import com.scenecraft.core.engine.GenerationResult;
import com.scenecraft.core.model.GenerationStats;
import com.scenecraft.core.model.RoundInfo;
import com.scenecraft.core.model.StopReason;
import com.scenecraft.core.tree.Scene;

import java.util.List;
import java.util.Objects;

/**
 * A scene together with what is known about how it was generated.
 *
 * <p>Documents read back from JSON may lack the run details; {@code stats} and
 * {@code stopReason} are then null.
 *
 * @param scene scene tree
 * @param stats run counters, may be null
 * @param rounds round log, may be empty
 * @param stopReason why generation stopped, may be null
 */
public record SceneDocument(
    Scene scene,
    GenerationStats stats,
    List<RoundInfo> rounds,
    StopReason stopReason
) {
    /**
     * Compact constructor with validation.
     */
    public SceneDocument {
        Objects.requireNonNull(scene, "scene must not be null");
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
    }

    public static SceneDocument of(GenerationResult result) {
        return new SceneDocument(result.scene(), result.stats(), result.rounds(), result.stopReason());
    }

    public static SceneDocument of(Scene scene) {
        return new SceneDocument(scene, null, List.of(), null);
    }
}
