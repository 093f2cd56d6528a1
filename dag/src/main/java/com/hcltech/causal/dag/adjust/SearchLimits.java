package com.hcltech.causal.dag.adjust;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds for the combinatorial parts of an analysis.
 *
 * @param maxResults number of minimal adjustment sets to collect before stopping
 * @param pathLimit  paths enumerated per exposure/outcome pair while testing candidate sets
 * @param maxSetSize largest subset size tried
 * @param timeout    wall-clock budget for one search
 */
public record SearchLimits(int maxResults, int pathLimit, int maxSetSize, Duration timeout) {

    public static final SearchLimits DEFAULT = new SearchLimits(10, 10_000, 8, Duration.ofSeconds(30));

    public SearchLimits {
        if (maxResults < 1) throw new IllegalArgumentException("maxResults must be at least 1 but was " + maxResults);
        if (pathLimit < 1) throw new IllegalArgumentException("pathLimit must be at least 1 but was " + pathLimit);
        if (maxSetSize < 0) throw new IllegalArgumentException("maxSetSize must not be negative but was " + maxSetSize);
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("timeout must be positive");
    }

    public SearchLimits withMaxResults(int n) {
        return new SearchLimits(n, pathLimit, maxSetSize, timeout);
    }

    public SearchLimits withPathLimit(int n) {
        return new SearchLimits(maxResults, n, maxSetSize, timeout);
    }

    public SearchLimits withMaxSetSize(int n) {
        return new SearchLimits(maxResults, pathLimit, n, timeout);
    }

    public SearchLimits withTimeout(Duration d) {
        return new SearchLimits(maxResults, pathLimit, maxSetSize, d);
    }
}
