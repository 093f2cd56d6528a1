package com.hcltech.causal.dag.bias;

import com.hcltech.causal.dag.AnalysisStatus;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.adjust.AdjustmentResult;
import com.hcltech.causal.dag.paths.CausalPath;
import com.hcltech.causal.dag.paths.PathEnumeration;
import com.hcltech.causal.dag.paths.PathKind;
import com.hcltech.causal.dag.paths.PathOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Flags colliders that sit on a backdoor path which is blocked as long as nothing is conditioned on. Adjusting for
 * such a node opens the path, so it must stay out of every adjustment set even though it is associated with both
 * the exposure and the outcome.
 */
public final class MBiasDetector {
    private static final Logger log = LoggerFactory.getLogger(MBiasDetector.class);

    private final PathOracle oracle;

    public MBiasDetector(PathOracle oracle) {
        this.oracle = oracle;
    }

    public MBiasReport detect(AdjustmentResult minimal, int pathLimit) {
        return detect(minimal, pathLimit, () -> false);
    }

    /**
     * Needs the minimal sets already found: members of those sets are never flagged. Enumeration ends early once
     * {@code stop} turns true and the report is then marked truncated.
     */
    public MBiasReport detect(AdjustmentResult minimal, int pathLimit, BooleanSupplier stop) {
        if (!minimal.success()) return MBiasReport.failure(minimal.status(), minimal.message());

        CausalGraph graph = oracle.graph();
        Set<String> terminals = new HashSet<>(minimal.exposures());
        terminals.addAll(minimal.outcomes());
        Set<String> adjusted = new HashSet<>(minimal.variablesInAnySet());

        List<CausalPath> blockedBackdoor = new ArrayList<>();
        boolean truncated = false;
        BitSet nothing = new BitSet(graph.size());
        for (String x : minimal.exposures()) {
            for (String y : minimal.outcomes()) {
                PathEnumeration e = oracle.enumeratePaths(x, y, pathLimit, terminals, stop);
                truncated |= e.truncated();
                for (CausalPath p : e.ofKind(PathKind.BACKDOOR)) {
                    if (!oracle.compile(p).isOpenUnder(nothing)) blockedBackdoor.add(p);
                }
            }
        }

        List<MBiasVariable> flagged = new ArrayList<>();
        for (String v : graph.ids()) {
            if (terminals.contains(v) || adjusted.contains(v)) continue;
            List<String> parents = graph.parents(v);
            if (parents.size() < 2) continue;
            Set<String> paths = new LinkedHashSet<>();
            for (CausalPath p : blockedBackdoor) {
                if (p.hasColliderAt(v)) paths.add(p.describe());
            }
            if (!paths.isEmpty()) flagged.add(new MBiasVariable(v, parents, new ArrayList<>(paths)));
        }
        if (truncated) {
            log.warn("M-bias check for {} -> {} used a truncated path list", minimal.exposures(), minimal.outcomes());
        }
        String message = flagged.isEmpty()
                ? "No M-bias detected"
                : "Found " + flagged.size() + " M-bias variable(s); do not adjust for them";
        return new MBiasReport(AnalysisStatus.OK, message, flagged, truncated);
    }
}
