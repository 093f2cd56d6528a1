package com.hcltech.causal.dag;

import java.util.Objects;

/** Directed edge from -> to. Self-loops are rejected. */
public record Edge(String from, String to) {
    public Edge {
        Objects.requireNonNull(from, "edge from");
        Objects.requireNonNull(to, "edge to");
        if (from.equals(to)) throw new IllegalArgumentException("Self-loop on node " + from);
    }

    public static Edge of(String from, String to) {
        return new Edge(from, to);
    }

    public boolean touches(String node) {
        return from.equals(node) || to.equals(node);
    }

    public String describe() {
        return from + " -> " + to;
    }
}
