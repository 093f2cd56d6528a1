package com.hcltech.causal.dag.paths;

public enum PathKind {
    /** Every edge points from the start toward the end. */
    CAUSAL,
    /** Not causal, and the first edge points into the start. */
    BACKDOOR,
    /** Neither: non-causal and leaving the start through an outgoing edge. */
    OTHER
}
