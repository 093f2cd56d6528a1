package com.hcltech.causal.dag.validation;

import com.hcltech.causal.common.errorsor.ErrorsOr;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.CausalNode;
import com.hcltech.causal.dag.Edge;
import com.hcltech.causal.dag.GraphDescription;
import com.hcltech.causal.dag.NodeRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Repairs a raw description into a clean snapshot and reports cycles.
 * <ol>
 *   <li>drop repeated node ids (first occurrence wins)</li>
 *   <li>drop edges whose endpoints are not both present</li>
 *   <li>drop duplicate edges, keeping the first</li>
 *   <li>find strongly connected components and one representative cycle per cyclic component</li>
 *   <li>mark cycles that contain both an exposure and an outcome as critical</li>
 * </ol>
 */
public final class StructuralValidator {
    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    private StructuralValidator() {}

    /** Never throws; a missing description is reported as an error. */
    public static ErrorsOr<ValidatedGraph> validate(GraphDescription raw) {
        if (raw == null) return ErrorsOr.error("Invalid or missing graph description");

        List<String> messages = new ArrayList<>();

        Set<String> ids = new HashSet<>();
        List<CausalNode> nodes = new ArrayList<>(raw.nodes().size());
        int duplicateNodes = 0;
        for (CausalNode n : raw.nodes()) {
            if (n == null) continue;
            if (ids.add(n.id())) nodes.add(n);
            else duplicateNodes++;
        }
        if (duplicateNodes > 0) messages.add("Removed " + duplicateNodes + " duplicate nodes");

        List<Edge> present = new ArrayList<>(raw.edges().size());
        int orphaned = 0;
        for (Edge e : raw.edges()) {
            if (e != null && ids.contains(e.from()) && ids.contains(e.to())) present.add(e);
            else orphaned++;
        }
        if (orphaned > 0) messages.add("Removed " + orphaned + " orphaned edges");

        Set<Edge> unique = new LinkedHashSet<>(present);
        int duplicates = present.size() - unique.size();
        if (duplicates > 0) messages.add("Removed " + duplicates + " duplicate edges");

        CausalGraph graph = CausalGraph.of(nodes, new ArrayList<>(unique));
        int fixes = duplicateNodes + orphaned + duplicates;
        if (fixes > 0) log.warn("Structural repair applied {} fixes: {}", fixes, messages);

        ValidationReport report = withCycles(graph, fixes, orphaned, duplicates, messages);
        return ErrorsOr.lift(new ValidatedGraph(graph, report));
    }

    /** Validates a snapshot that is already clean; only the cycle part of the report can be non-trivial. */
    public static ValidationReport inspect(CausalGraph graph) {
        return withCycles(graph, 0, 0, 0, new ArrayList<>());
    }

    private static ValidationReport withCycles(CausalGraph graph, int fixes, int orphaned, int duplicates,
                                               List<String> messages) {
        List<List<String>> cycles = new ArrayList<>();
        List<List<String>> critical = new ArrayList<>();
        for (int[] component : StronglyConnectedComponents.cyclicComponents(graph)) {
            List<String> cycle = CycleFinder.representativeCycle(graph, component);
            if (cycle.isEmpty()) continue;
            cycles.add(cycle);
            if (isCritical(graph, cycle)) critical.add(cycle);
        }
        if (!cycles.isEmpty()) {
            String msg = "Graph contains " + cycles.size() + " cycle(s)";
            if (!critical.isEmpty()) {
                msg += " including " + critical.size() + " involving exposure-outcome relationships";
            }
            messages.add(msg);
            log.warn("{}: {}", msg, cycles);
        }
        return new ValidationReport(cycles.isEmpty(), fixes, orphaned, duplicates, messages, cycles, critical);
    }

    static boolean isCritical(CausalGraph graph, List<String> cycle) {
        boolean exposure = false;
        boolean outcome = false;
        for (String id : cycle) {
            NodeRole role = graph.role(id).orElse(NodeRole.COVARIATE);
            exposure |= role == NodeRole.EXPOSURE;
            outcome |= role == NodeRole.OUTCOME;
        }
        return exposure && outcome;
    }
}
