package com.hcltech.causal.dag;

/** Outcome of a removal: both snapshots, so the caller can install {@code after} or restore {@code before}. */
public record GraphEdit(CausalGraph before, CausalGraph after, String action, String target, int edgesRemoved) {

    public String message() {
        return switch (action) {
            case "remove_node" -> "Removed node: " + target + " and " + edgesRemoved + " connected edges";
            case "remove_edge" -> "Removed edge: " + target;
            default -> action + " " + target;
        };
    }
}
