package com.hcltech.causal.dag.edit;

import com.hcltech.causal.dag.CausalGraph;

import java.util.List;

/** {@code iterations} counts the rounds that removed at least one node. */
public record PruneResult(CausalGraph graph, List<String> removed, int iterations, int nodesBefore, int edgesBefore,
                          int nodesAfter, int edgesAfter) {
    public PruneResult {
        removed = List.copyOf(removed);
    }

    public String message() {
        return "Leaf removal complete. Removed " + (nodesBefore - nodesAfter) + " nodes and " + (edgesBefore - edgesAfter)
                + " edges in " + iterations + " iteration(s)";
    }
}
