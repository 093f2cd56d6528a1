package com.hcltech.causal.dag.adjust;

/** Why a subset search stopped. Anything but {@link #EXHAUSTED} means results may be incomplete. */
public enum StopReason {
    EXHAUSTED,
    RESULT_CAP,
    SIZE_CEILING,
    DEADLINE,
    CANCELLED;

    public boolean truncates() {
        return this != EXHAUSTED;
    }
}
