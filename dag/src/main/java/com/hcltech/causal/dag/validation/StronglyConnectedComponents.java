package com.hcltech.causal.dag.validation;

import com.hcltech.causal.dag.CausalGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Tarjan's algorithm with an explicit call stack, so deep graphs cannot overflow the JVM stack.
 * Components are returned with members in graph order, ordered by their first member.
 */
public final class StronglyConnectedComponents {
    private StronglyConnectedComponents() {}

    public static List<int[]> components(CausalGraph graph) {
        int n = graph.size();
        int[] idx = new int[n];
        int[] low = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(idx, -1);
        int[][] children = new int[n][];
        for (int v = 0; v < n; v++) children[v] = graph.childIndices(v);
        Deque<Integer> stack = new ArrayDeque<>();
        List<int[]> out = new ArrayList<>();
        int counter = 0;

        for (int s = 0; s < n; s++) {
            if (idx[s] != -1) continue;
            Deque<int[]> calls = new ArrayDeque<>();
            idx[s] = low[s] = counter++;
            stack.push(s);
            onStack[s] = true;
            calls.push(new int[]{s, 0});

            while (!calls.isEmpty()) {
                int[] frame = calls.peek();
                int v = frame[0];
                int[] kids = children[v];
                if (frame[1] < kids.length) {
                    int w = kids[frame[1]++];
                    if (idx[w] == -1) {
                        idx[w] = low[w] = counter++;
                        stack.push(w);
                        onStack[w] = true;
                        calls.push(new int[]{w, 0});
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], idx[w]);
                    }
                    continue;
                }
                calls.pop();
                if (!calls.isEmpty()) {
                    int u = calls.peek()[0];
                    low[u] = Math.min(low[u], low[v]);
                }
                if (low[v] == idx[v]) {
                    List<Integer> members = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        members.add(w);
                    } while (w != v);
                    out.add(members.stream().mapToInt(Integer::intValue).sorted().toArray());
                }
            }
        }
        out.sort(Comparator.comparingInt(c -> c[0]));
        return out;
    }

    /** Only the components that contain a cycle (size greater than one; self-loops cannot exist). */
    public static List<int[]> cyclicComponents(CausalGraph graph) {
        return components(graph).stream().filter(c -> c.length > 1).toList();
    }
}
