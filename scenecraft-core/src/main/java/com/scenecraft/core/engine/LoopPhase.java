package com.scenecraft.core.engine;

/**
 * Phases of the refinement loop.
 *
 * <p>{@code SEED -> {ANALYZE -> OPTIMIZE -> PRUNE -> EXPAND -> EVALUATE}* -> DONE}
 */
public enum LoopPhase {
    SEED,
    ANALYZE,
    OPTIMIZE,
    PRUNE,
    EXPAND,
    EVALUATE,
    DONE
}
