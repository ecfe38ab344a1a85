package com.scenecraft.core.model;

/**
 * Why a generation run ended.
 */
public enum StopReason {
    /** Completeness score reached the configured threshold */
    COMPLETENESS_REACHED,

    /** A round added fewer nodes than the configured minimum */
    INSUFFICIENT_PROGRESS,

    /** Total generated nodes reached the node budget */
    NODE_BUDGET_EXHAUSTED,

    /** Configured maximum number of rounds was performed */
    MAX_ROUNDS_REACHED,

    /** No unexpanded containers remain */
    ALL_CONTAINERS_EXPANDED,

    /** Every unexpanded container sits at or beyond the depth budget */
    DEPTH_LIMIT_REACHED,

    /** Exhaustive mode hit its iteration cap */
    MAX_ITERATIONS_REACHED
}
