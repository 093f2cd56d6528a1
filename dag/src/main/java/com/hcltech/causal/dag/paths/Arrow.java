package com.hcltech.causal.dag.paths;

/** Direction of one edge of a path relative to the direction the path is read in. */
public enum Arrow {
    /** Points away from the path's start: {@code a -> b}. */
    FORWARD,
    /** Points back toward the path's start: {@code a <- b}. */
    BACKWARD;

    public String symbol() {
        return this == FORWARD ? "->" : "<-";
    }
}
