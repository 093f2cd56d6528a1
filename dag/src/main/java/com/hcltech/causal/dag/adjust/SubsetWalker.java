package com.hcltech.causal.dag.adjust;

import java.util.BitSet;
import java.util.List;

/**
 * Backtracking over the k-subsets of an indexed candidate array, in lexicographic order of positions.
 * A branch is cut as soon as the partial subset already contains one of the accepted sets, so supersets
 * of accepted sets are never visited.
 */
final class SubsetWalker {

    interface Visitor {
        /** Return false to stop the walk. */
        boolean visit(BitSet subset);
    }

    private final int[] candidates;
    private final Budget budget;
    private long visited;

    SubsetWalker(int[] candidates, Budget budget) {
        this.candidates = candidates;
        this.budget = budget;
    }

    long visited() {
        return visited;
    }

    /**
     * Visits every subset made of {@code base} plus k candidates that does not contain an accepted set.
     *
     * @return null if all such subsets were visited, {@link StopReason#RESULT_CAP} if the visitor stopped the
     * walk, or the budget's reason if it ran out
     */
    StopReason walk(int k, BitSet base, List<BitSet> accepted, Visitor visitor) {
        BitSet current = (BitSet) base.clone();
        if (containsAny(current, accepted)) return null;
        return step(0, k, current, accepted, visitor);
    }

    private StopReason step(int start, int remaining, BitSet current, List<BitSet> accepted, Visitor visitor) {
        StopReason out = budget.check();
        if (out != null) return out;
        if (remaining == 0) {
            visited++;
            return visitor.visit(current) ? null : StopReason.RESULT_CAP;
        }
        for (int i = start; i <= candidates.length - remaining; i++) {
            int c = candidates[i];
            if (current.get(c)) continue;
            current.set(c);
            if (!containsAny(current, accepted)) {
                StopReason r = step(i + 1, remaining - 1, current, accepted, visitor);
                if (r != null) {
                    current.clear(c);
                    return r;
                }
            }
            current.clear(c);
        }
        return null;
    }

    static boolean containsAny(BitSet current, List<BitSet> accepted) {
        for (BitSet a : accepted) {
            if (isSubset(a, current)) return true;
        }
        return false;
    }

    static boolean isSubset(BitSet a, BitSet b) {
        for (int i = a.nextSetBit(0); i >= 0; i = a.nextSetBit(i + 1)) {
            if (!b.get(i)) return false;
        }
        return true;
    }
}
