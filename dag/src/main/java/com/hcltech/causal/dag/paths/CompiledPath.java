package com.hcltech.causal.dag.paths;

import java.util.BitSet;

/**
 * Index form of a path prepared for repeated open/blocked tests against many conditioning sets.
 * {@code colliderOpeners[i]} holds collider i and all of its descendants.
 */
public final class CompiledPath {
    private final CausalPath path;
    private final int[] nonColliders;
    private final int[] colliders;
    private final BitSet[] colliderOpeners;
    private final BitSet interior;

    CompiledPath(CausalPath path, int[] nonColliders, int[] colliders, BitSet[] colliderOpeners, BitSet interior) {
        this.path = path;
        this.nonColliders = nonColliders;
        this.colliders = colliders;
        this.colliderOpeners = colliderOpeners;
        this.interior = interior;
    }

    public CausalPath path() { return path; }

    /** Interior nodes as a bit set of graph indices. */
    public BitSet interior() { return (BitSet) interior.clone(); }

    public boolean isOpenUnder(BitSet z) {
        for (int v : nonColliders) {
            if (z.get(v)) return false;
        }
        for (BitSet openers : colliderOpeners) {
            if (!openers.intersects(z)) return false;
        }
        return true;
    }

    public boolean hasColliders() {
        return colliders.length > 0;
    }
}
