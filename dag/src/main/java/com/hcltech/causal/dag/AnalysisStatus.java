package com.hcltech.causal.dag;

/**
 * Tag carried by every analysis result. The failure kinds mean the call could not run at all;
 * {@link #UNIDENTIFIABLE} and {@link #RESULT_CAP_REACHED} are findings of a search that did run.
 */
public enum AnalysisStatus {
    OK,
    INVALID_GRAPH,
    MISSING_ROLES,
    UNIDENTIFIABLE,
    RESULT_CAP_REACHED,
    CYCLE_DETECTED;

    public boolean isFailure() {
        return this == INVALID_GRAPH || this == MISSING_ROLES || this == CYCLE_DETECTED;
    }
}
