package com.hcltech.causal.dag.paths;

import java.util.ArrayList;
import java.util.List;

/** A simple path: {@code arrows.get(i)} is the edge between {@code nodes.get(i)} and {@code nodes.get(i + 1)}. */
public record CausalPath(List<String> nodes, List<Arrow> arrows) {

    public CausalPath {
        nodes = List.copyOf(nodes);
        arrows = List.copyOf(arrows);
        if (nodes.size() < 2) throw new IllegalArgumentException("A path needs at least two nodes: " + nodes);
        if (arrows.size() != nodes.size() - 1) {
            throw new IllegalArgumentException("Expected " + (nodes.size() - 1) + " arrows but got " + arrows.size());
        }
    }

    public String from() { return nodes.get(0); }

    public String to() { return nodes.get(nodes.size() - 1); }

    /** Number of edges. */
    public int length() { return arrows.size(); }

    public PathKind kind() {
        if (arrows.stream().allMatch(a -> a == Arrow.FORWARD)) return PathKind.CAUSAL;
        return arrows.get(0) == Arrow.BACKWARD ? PathKind.BACKDOOR : PathKind.OTHER;
    }

    public List<String> interior() {
        return nodes.subList(1, nodes.size() - 1);
    }

    /** Whether the node at position i (an interior position) has both adjacent edges pointing into it. */
    public boolean isColliderAt(int i) {
        if (i <= 0 || i >= nodes.size() - 1) return false;
        return arrows.get(i - 1) == Arrow.FORWARD && arrows.get(i) == Arrow.BACKWARD;
    }

    /** Whether the node appears on this path as an interior collider. */
    public boolean hasColliderAt(String node) {
        int i = nodes.indexOf(node);
        return isColliderAt(i);
    }

    public List<PathStep> steps() {
        List<PathStep> out = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            Arrow in = i == 0 ? null : arrows.get(i - 1);
            Arrow outgoing = i == arrows.size() ? null : arrows.get(i);
            out.add(new PathStep(nodes.get(i), in, outgoing));
        }
        return out;
    }

    /** dagitty-style rendering, e.g. {@code X <- U -> Y}. */
    public String describe() {
        StringBuilder sb = new StringBuilder(nodes.get(0));
        for (int i = 0; i < arrows.size(); i++) {
            sb.append(' ').append(arrows.get(i).symbol()).append(' ').append(nodes.get(i + 1));
        }
        return sb.toString();
    }
}
