package com.hcltech.causal.dag.analysis;

import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.NodeRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Descriptive numbers for a snapshot. Density is edges over the n(n-1) possible directed edges; the average degree
 * counts both ends of every edge.
 */
public record GraphStatistics(int totalNodes,
                              int totalEdges,
                              double density,
                              double averageDegree,
                              Map<NodeRole, Integer> roleCounts,
                              List<String> rootNodes,
                              List<String> leafNodes,
                              List<String> isolatedNodes,
                              int maxInDegree,
                              int maxOutDegree,
                              int weakComponents) {

    public GraphStatistics {
        roleCounts = Collections.unmodifiableMap(new EnumMap<>(roleCounts));
        rootNodes = List.copyOf(rootNodes);
        leafNodes = List.copyOf(leafNodes);
        isolatedNodes = List.copyOf(isolatedNodes);
    }

    public static GraphStatistics of(CausalGraph graph) {
        int n = graph.size();
        int e = graph.edgeCount();
        Map<NodeRole, Integer> roles = new EnumMap<>(NodeRole.class);
        for (NodeRole r : NodeRole.values()) roles.put(r, 0);
        List<String> roots = new ArrayList<>();
        List<String> leaves = new ArrayList<>();
        List<String> isolated = new ArrayList<>();
        int maxIn = 0;
        int maxOut = 0;
        for (int i = 0; i < n; i++) {
            roles.merge(graph.roleOf(i), 1, Integer::sum);
            int in = graph.inDegree(i);
            int out = graph.outDegree(i);
            maxIn = Math.max(maxIn, in);
            maxOut = Math.max(maxOut, out);
            if (in == 0 && out == 0) isolated.add(graph.idOf(i));
            else if (in == 0) roots.add(graph.idOf(i));
            else if (out == 0) leaves.add(graph.idOf(i));
        }
        double density = n > 1 ? (double) e / ((double) n * (n - 1)) : 0.0;
        double averageDegree = n > 0 ? 2.0 * e / n : 0.0;
        return new GraphStatistics(n, e, density, averageDegree, roles, roots, leaves, isolated, maxIn, maxOut,
                weakComponents(graph));
    }

    public double percentage(NodeRole role) {
        return totalNodes == 0 ? 0.0 : 100.0 * roleCounts.getOrDefault(role, 0) / totalNodes;
    }

    /** Union-find over the undirected edges. */
    private static int weakComponents(CausalGraph graph) {
        int n = graph.size();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) parent[i] = i;
        int components = n;
        for (int v = 0; v < n; v++) {
            for (int c : graph.childIndices(v)) {
                int a = find(parent, v);
                int b = find(parent, c);
                if (a != b) {
                    parent[Math.max(a, b)] = Math.min(a, b);
                    components--;
                }
            }
        }
        return components;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }
}
