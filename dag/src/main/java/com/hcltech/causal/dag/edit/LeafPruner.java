package com.hcltech.causal.dag.edit;

import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.CausalNode;
import com.hcltech.causal.dag.Edge;
import com.hcltech.causal.dag.NodeRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Repeatedly strips nodes with exactly one incident edge. All leaves of a round go together; removing them can
 * create new leaves for the next round. Isolated nodes are left alone.
 */
public final class LeafPruner {
    private static final Logger log = LoggerFactory.getLogger(LeafPruner.class);

    private LeafPruner() {}

    public static PruneResult prune(CausalGraph graph, boolean preserveExposureOutcome) {
        CausalGraph current = graph;
        List<String> removed = new ArrayList<>();
        int iterations = 0;
        while (true) {
            Set<String> leaves = new HashSet<>();
            for (int i = 0; i < current.size(); i++) {
                if (current.inDegree(i) + current.outDegree(i) != 1) continue;
                if (preserveExposureOutcome && current.roleOf(i) != NodeRole.COVARIATE) continue;
                leaves.add(current.idOf(i));
            }
            if (leaves.isEmpty()) break;
            iterations++;
            log.debug("Leaf pruning round {}: removing {} nodes", iterations, leaves.size());
            List<CausalNode> nodes = new ArrayList<>();
            for (CausalNode n : current.nodes()) {
                if (leaves.contains(n.id())) removed.add(n.id());
                else nodes.add(n);
            }
            List<Edge> edges = current.edges().stream()
                    .filter(e -> !leaves.contains(e.from()) && !leaves.contains(e.to()))
                    .toList();
            current = CausalGraph.of(nodes, edges);
        }
        return new PruneResult(current, removed, iterations, graph.size(), graph.edgeCount(), current.size(),
                current.edgeCount());
    }
}
