package com.scenecraft.core.engine;

import com.scenecraft.core.model.GenerationStats;
import com.scenecraft.core.model.RoundInfo;
import com.scenecraft.core.model.StopReason;
import com.scenecraft.core.tree.Scene;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a generation run.
 *
 * @param scene generated scene
 * @param stats counters captured at the end of the run
 * @param rounds round log, round 0 being the seed (empty in exhaustive mode)
 * @param stopReason why the run stopped
 */
public record GenerationResult(
    Scene scene,
    GenerationStats stats,
    List<RoundInfo> rounds,
    StopReason stopReason
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationResult {
        Objects.requireNonNull(scene, "scene must not be null");
        Objects.requireNonNull(stats, "stats must not be null");
        Objects.requireNonNull(stopReason, "stopReason must not be null");
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
    }
}
