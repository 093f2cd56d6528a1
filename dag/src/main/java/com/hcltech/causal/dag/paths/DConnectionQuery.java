package com.hcltech.causal.dag.paths;

import com.hcltech.causal.dag.Edge;

import java.util.Objects;
import java.util.Set;

/**
 * Set-level d-connection question: is some path between {@code a} and {@code b} open given {@code z}?
 * Edges can be dropped (all edges leaving a node, or single edges) and nodes can be forbidden as
 * path interiors; conditioning and collider activation always use the full graph.
 */
public record DConnectionQuery(String a, String b, Set<String> z,
                               Set<String> noOutgoingFrom, Set<Edge> removedEdges, Set<String> noPassThrough) {

    public DConnectionQuery {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        z = z == null ? Set.of() : Set.copyOf(z);
        noOutgoingFrom = noOutgoingFrom == null ? Set.of() : Set.copyOf(noOutgoingFrom);
        removedEdges = removedEdges == null ? Set.of() : Set.copyOf(removedEdges);
        noPassThrough = noPassThrough == null ? Set.of() : Set.copyOf(noPassThrough);
    }

    public static DConnectionQuery of(String a, String b, Set<String> z) {
        return new DConnectionQuery(a, b, z, Set.of(), Set.of(), Set.of());
    }

    public DConnectionQuery withoutOutgoingFrom(Set<String> nodes) {
        return new DConnectionQuery(a, b, z, nodes, removedEdges, noPassThrough);
    }

    public DConnectionQuery withoutEdges(Set<Edge> edges) {
        return new DConnectionQuery(a, b, z, noOutgoingFrom, edges, noPassThrough);
    }

    public DConnectionQuery avoiding(Set<String> nodes) {
        return new DConnectionQuery(a, b, z, noOutgoingFrom, removedEdges, nodes);
    }
}
