package com.hcltech.causal.dag.paths;

/** A node on a path with the edges on either side; {@code incoming} is null at the start, {@code outgoing} at the end. */
public record PathStep(String node, Arrow incoming, Arrow outgoing) {

    /** Both adjacent edges point into this node. */
    public boolean isCollider() {
        return incoming == Arrow.FORWARD && outgoing == Arrow.BACKWARD;
    }
}
