package com.hcltech.causal.dag.adjust;

import com.hcltech.causal.common.ITimeService;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/** Deadline plus cancellation flag, polled by the subset walker and by path enumeration. */
public final class Budget {
    private final ITimeService time;
    private final long deadlineNanos;
    private final BooleanSupplier cancelled;
    private StopReason exceeded;

    private Budget(ITimeService time, long deadlineNanos, BooleanSupplier cancelled) {
        this.time = time;
        this.deadlineNanos = deadlineNanos;
        this.cancelled = cancelled;
    }

    public static Budget start(ITimeService time, Duration timeout, BooleanSupplier cancelled) {
        return new Budget(time, time.currentTimeNanos() + timeout.toNanos(), cancelled);
    }

    /** The reason the budget ran out, or null while work may continue. Once exceeded it stays exceeded. */
    public StopReason check() {
        if (exceeded != null) return exceeded;
        if (cancelled.getAsBoolean()) exceeded = StopReason.CANCELLED;
        else if (time.currentTimeNanos() - deadlineNanos >= 0) exceeded = StopReason.DEADLINE;
        return exceeded;
    }

    public boolean exceeded() {
        return check() != null;
    }
}
