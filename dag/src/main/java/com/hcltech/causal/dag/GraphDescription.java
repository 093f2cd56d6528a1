package com.hcltech.causal.dag;

import java.util.List;

/**
 * Raw node and edge lists as supplied by an importer or editor. Unlike {@link CausalGraph} it may contain
 * orphaned or duplicated edges; the structural validator turns it into a clean snapshot.
 */
public record GraphDescription(List<CausalNode> nodes, List<Edge> edges) {
    public GraphDescription {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}
