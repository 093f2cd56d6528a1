package com.hcltech.causal.common;

/** Monotonic clock for deadlines; tests substitute their own. */
public interface ITimeService {
    long currentTimeNanos();

    ITimeService real = System::nanoTime;
}
