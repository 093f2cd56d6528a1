package com.hcltech.causal.dag.iv;

import com.hcltech.causal.dag.AnalysisStatus;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.paths.PathOracle;
import com.hcltech.causal.dag.validation.StructuralValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Set;

/**
 * A node is an instrument when it is d-connected to some exposure with nothing conditioned on, and
 * d-separated from every outcome once the exposures are conditioned on.
 * <p>
 * Exposures, outcomes and descendants of either are never candidates. The tests use reachability rather
 * than path enumeration, so they are exact on graphs of any size.
 */
public final class InstrumentalVariableFinder {
    private static final Logger log = LoggerFactory.getLogger(InstrumentalVariableFinder.class);

    private final PathOracle oracle;

    public InstrumentalVariableFinder(PathOracle oracle) {
        this.oracle = oracle;
    }

    public InstrumentResult find(List<String> exposures, List<String> outcomes) {
        CausalGraph graph = oracle.graph();
        if (exposures == null || exposures.isEmpty() || outcomes == null || outcomes.isEmpty()) {
            return new InstrumentResult(AnalysisStatus.MISSING_ROLES, "Both exposure and outcome variables must be defined", List.of());
        }
        for (String id : exposures) {
            if (!graph.hasNode(id)) return new InstrumentResult(AnalysisStatus.INVALID_GRAPH, "Unknown variable: " + id, List.of());
        }
        for (String id : outcomes) {
            if (!graph.hasNode(id)) return new InstrumentResult(AnalysisStatus.INVALID_GRAPH, "Unknown variable: " + id, List.of());
        }
        if (StructuralValidator.inspect(graph).hasCycles()) {
            return new InstrumentResult(AnalysisStatus.CYCLE_DETECTED, "Graph contains cycles; instruments are only defined for acyclic graphs", List.of());
        }

        BitSet xs = oracle.bits(exposures);
        BitSet ys = oracle.bits(outcomes);
        BitSet skip = graph.descendantsOfAll(ys.stream().boxed().toList());
        skip.or(graph.descendantsOfAll(xs.stream().boxed().toList()));
        skip.or(xs);
        skip.or(ys);

        BitSet nothing = new BitSet(graph.size());
        Set<Long> noEdges = Set.of();
        List<String> found = new ArrayList<>();
        for (int v = 0; v < graph.size(); v++) {
            if (skip.get(v)) continue;
            if (isRelevant(v, xs, nothing, noEdges) && isExcluded(v, ys, xs, nothing, noEdges)) {
                found.add(graph.idOf(v));
            }
        }
        String message = found.isEmpty()
                ? "No instrumental variables found"
                : "Found " + found.size() + " instrumental variable(s)";
        log.debug("{} for {} -> {}", message, exposures, outcomes);
        return new InstrumentResult(AnalysisStatus.OK, message, found);
    }

    private boolean isRelevant(int v, BitSet xs, BitSet nothing, Set<Long> noEdges) {
        for (int x = xs.nextSetBit(0); x >= 0; x = xs.nextSetBit(x + 1)) {
            if (oracle.isDConnected(v, x, nothing, nothing, noEdges, nothing)) return true;
        }
        return false;
    }

    private boolean isExcluded(int v, BitSet ys, BitSet xs, BitSet nothing, Set<Long> noEdges) {
        for (int y = ys.nextSetBit(0); y >= 0; y = ys.nextSetBit(y + 1)) {
            if (oracle.isDConnected(v, y, xs, nothing, noEdges, nothing)) return false;
        }
        return true;
    }
}
