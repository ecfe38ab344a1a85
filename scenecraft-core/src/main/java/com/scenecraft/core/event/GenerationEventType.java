package com.scenecraft.core.event;

/**
 * Kinds of structured events emitted during a generation run.
 */
public enum GenerationEventType {
    RUN_STARTED,
    PHASE_STARTED,
    SEEDED,
    CONTAINER_EXPANDED,
    EXPANSION_FAILED,
    NODE_REJECTED,
    WAVE_COMPLETED,
    ANALYSIS_COMPLETED,
    RECONCILED,
    NODE_CONVERTED,
    PRUNED,
    ROUND_COMPLETED,
    VALIDATION,
    STRUCTURAL_ERROR,
    RUN_COMPLETED
}
