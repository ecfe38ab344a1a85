package com.scenecraft.core.engine;

/**
 * Verdict of the admission filter for one candidate node.
 */
public enum Admission {
    ACCEPTED,
    DESCRIPTION_TOO_SHORT,
    GENERIC_ITEM,
    BUDGET_EXHAUSTED;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
