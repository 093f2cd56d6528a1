package com.hcltech.causal.dag.validation;

import com.hcltech.causal.dag.CausalGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/** Extracts one representative simple cycle from a strongly connected component. */
public final class CycleFinder {
    private CycleFinder() {}

    /**
     * Depth-first search from the component's first vertex, restricted to the component, until an edge
     * returns to the start. The cycle is returned without repeating the start vertex.
     */
    public static List<String> representativeCycle(CausalGraph graph, int[] component) {
        if (component.length < 2) return List.of();
        BitSet inComponent = new BitSet(graph.size());
        for (int v : component) inComponent.set(v);

        int[][] children = new int[graph.size()][];
        for (int v : component) children[v] = graph.childIndices(v);

        int start = component[0];
        BitSet visited = new BitSet(graph.size());
        List<Integer> path = new ArrayList<>();
        Deque<int[]> frames = new ArrayDeque<>();
        visited.set(start);
        path.add(start);
        frames.push(new int[]{start, 0});

        while (!frames.isEmpty()) {
            int[] frame = frames.peek();
            int[] kids = children[frame[0]];
            if (frame[1] >= kids.length) {
                frames.pop();
                path.remove(path.size() - 1);
                continue;
            }
            int w = kids[frame[1]++];
            if (!inComponent.get(w)) continue;
            if (w == start) {
                return path.stream().map(graph::idOf).toList();
            }
            if (!visited.get(w)) {
                visited.set(w);
                path.add(w);
                frames.push(new int[]{w, 0});
            }
        }
        return List.of();
    }
}
