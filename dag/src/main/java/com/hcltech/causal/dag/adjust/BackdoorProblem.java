package com.hcltech.causal.dag.adjust;

import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.Edge;
import com.hcltech.causal.dag.paths.Arrow;
import com.hcltech.causal.dag.paths.CausalPath;
import com.hcltech.causal.dag.paths.CompiledPath;
import com.hcltech.causal.dag.paths.PathEnumeration;
import com.hcltech.causal.dag.paths.PathKind;
import com.hcltech.causal.dag.paths.PathOracle;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The prepared form of one adjustment question: which paths must be blocked, which nodes may be used to
 * block them, and how to test a candidate set.
 * <p>
 * Paths are enumerated per exposure/outcome pair without passing through the other exposures and outcomes.
 * When every enumeration completed, a candidate is tested against the compiled paths. When one of them hit
 * the path limit, ran out of steps or was stopped by the budget, the problem switches to the reachability test,
 * which needs no enumeration.
 */
final class BackdoorProblem {

    private final PathOracle oracle;
    private final EffectType effect;
    private final int[] exposures;
    private final int[] outcomes;
    private final BitSet terminals;
    private final BitSet excluded;
    private final List<CompiledPath> relevant;
    private final boolean exactFallback;
    private final int[] candidates;

    private BackdoorProblem(PathOracle oracle, EffectType effect, int[] exposures, int[] outcomes, BitSet terminals,
                            BitSet excluded, List<CompiledPath> relevant, boolean exactFallback, int[] candidates) {
        this.oracle = oracle;
        this.effect = effect;
        this.exposures = exposures;
        this.outcomes = outcomes;
        this.terminals = terminals;
        this.excluded = excluded;
        this.relevant = relevant;
        this.exactFallback = exactFallback;
        this.candidates = candidates;
    }

    static BackdoorProblem prepare(PathOracle oracle, int[] exposures, int[] outcomes, EffectType effect, int pathLimit,
                                   Budget budget) {
        CausalGraph graph = oracle.graph();
        BitSet terminals = new BitSet(graph.size());
        for (int x : exposures) terminals.set(x);
        for (int y : outcomes) terminals.set(y);

        BitSet excluded = effect == EffectType.TOTAL
                ? graph.descendantsOfAll(boxed(exposures))
                : graph.descendantsOfAll(boxed(outcomes));
        excluded.or(terminals);

        List<CompiledPath> relevant = new ArrayList<>();
        BitSet onPaths = new BitSet(graph.size());
        boolean truncated = false;
        Set<String> avoid = new HashSet<>(graph.names(terminals));
        for (int x : exposures) {
            for (int y : outcomes) {
                if (truncated) break;
                PathEnumeration e = oracle.enumeratePaths(graph.idOf(x), graph.idOf(y), pathLimit, avoid,
                        budget::exceeded);
                truncated |= e.truncated();
                for (CausalPath p : e.paths()) {
                    if (!isRelevant(p, effect)) continue;
                    CompiledPath cp = oracle.compile(p);
                    relevant.add(cp);
                    onPaths.or(cp.interior());
                }
            }
        }

        BitSet universe;
        if (truncated) {
            universe = graph.ancestorsOfAll(boxed(exposures));
            universe.or(graph.ancestorsOfAll(boxed(outcomes)));
        } else {
            universe = onPaths;
        }
        universe.andNot(excluded);
        int[] candidates = universe.stream().toArray();
        return new BackdoorProblem(oracle, effect, exposures, outcomes, terminals, excluded,
                truncated ? List.of() : relevant, truncated, candidates);
    }

    static boolean isRelevant(CausalPath p, EffectType effect) {
        if (effect == EffectType.TOTAL) return p.kind() == PathKind.BACKDOOR;
        return !(p.length() == 1 && p.arrows().get(0) == Arrow.FORWARD);
    }

    private static List<Integer> boxed(int[] values) {
        List<Integer> out = new ArrayList<>(values.length);
        for (int v : values) out.add(v);
        return out;
    }

    int[] candidates() { return candidates; }

    /** Nodes that may never be adjusted for: the exposures, the outcomes and the excluded descendants. */
    BitSet excluded() { return excluded; }

    boolean exactFallback() { return exactFallback; }

    int relevantPathCount() { return relevant.size(); }

    List<CompiledPath> relevantPaths() { return relevant; }

    /** Whether conditioning on z blocks every relevant path. */
    boolean isSufficient(BitSet z) {
        if (!exactFallback) {
            for (CompiledPath p : relevant) {
                if (p.isOpenUnder(z)) return false;
            }
            return true;
        }
        CausalGraph graph = oracle.graph();
        BitSet none = new BitSet(graph.size());
        for (int x : exposures) {
            for (int y : outcomes) {
                BitSet avoid = (BitSet) terminals.clone();
                avoid.clear(x);
                avoid.clear(y);
                boolean connected;
                if (effect == EffectType.TOTAL) {
                    BitSet noOutgoing = new BitSet(graph.size());
                    noOutgoing.set(x);
                    connected = oracle.isDConnected(x, y, z, noOutgoing, Set.of(), avoid);
                } else {
                    connected = oracle.isDConnected(x, y, z, none, directEdge(graph, x, y), avoid);
                }
                if (connected) return false;
            }
        }
        return true;
    }

    private Set<Long> directEdge(CausalGraph graph, int x, int y) {
        for (int c : graph.childIndices(x)) {
            if (c == y) return oracle.edgeKeys(List.of(new Edge(graph.idOf(x), graph.idOf(y))));
        }
        return Set.of();
    }
}
