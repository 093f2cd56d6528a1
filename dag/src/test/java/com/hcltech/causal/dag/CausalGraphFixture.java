package com.hcltech.causal.dag;

import com.hcltech.causal.dag.codec.GraphLoader;

import java.util.ArrayList;
import java.util.List;

/**
 * Graphs shared by the tests, written in dagitty text so they read like the diagrams they stand for.
 * Node order (and therefore every deterministic ordering in the results) is order of first mention.
 */
public final class CausalGraphFixture {
    private CausalGraphFixture() {}

    /** X <- U -> Y plus X -> Y. */
    public static final String CONFOUNDED = "X [exposure] Y [outcome] U; U -> X; U -> Y; X -> Y";

    /** X -> M -> Y plus X -> Y: no backdoor path. */
    public static final String MEDIATED = "X [exposure] Y [outcome] M; X -> M -> Y; X -> Y";

    /** X <- A -> V <- B -> Y: V is a collider on the only backdoor path. */
    public static final String M_BIAS = "X [exposure] Y [outcome] A V B; A -> X; A -> V; B -> V; B -> Y; X -> Y";

    /** C1 is a confounder whose parents C2 and C3 are confounders too. */
    public static final String BUTTERFLY = "X [exposure] Y [outcome] C1 C2 C3; "
            + "C2 -> X; C2 -> C1; C3 -> C1; C3 -> Y; C1 -> X; C1 -> Y; X -> Y";

    /** X <- A -> B -> C -> Y: {A}, {B} and {C} are each sufficient. */
    public static final String LONG_BACKDOOR = "X [exposure] Y [outcome] A B C; X <- A -> B -> C -> Y; X -> Y";

    /** Outcome causes exposure: no adjustment can separate them. */
    public static final String REVERSED = "X [exposure] Y [outcome]; Y -> X";

    public static final String TRIANGLE_CYCLE = "A [exposure] B C [outcome]; A -> B -> C -> A";

    public static CausalGraph dag(String body) {
        return GraphLoader.fromDagitty("dag { " + body + " }").valueOrThrow().graph();
    }

    /** {@code count} independent confounders of X and Y, so the only minimal set has all of them. */
    public static String independentConfounders(int count) {
        StringBuilder sb = new StringBuilder("X [exposure] Y [outcome]; X -> Y");
        for (int i = 1; i <= count; i++) sb.append("; X <- U").append(i).append(" -> Y");
        return sb.toString();
    }

    /**
     * A complete DAG over C1..Cn (Ci -> Cj for i < j) attached to X through C1, plus X -> Y. No backdoor path
     * exists, but a walk from X can wander through the clique along about n! dead-end prefixes.
     */
    public static String cliqueBehindExposure(int size) {
        StringBuilder sb = new StringBuilder("X [exposure] Y [outcome]; X -> Y; C1 -> X");
        for (int i = 1; i <= size; i++) {
            for (int j = i + 1; j <= size; j++) sb.append("; C").append(i).append(" -> C").append(j);
        }
        return sb.toString();
    }

    public static CausalGraph graph(List<CausalNode> nodes, String... edges) {
        List<Edge> es = new ArrayList<>();
        for (String e : edges) {
            String[] parts = e.split("->");
            es.add(Edge.of(parts[0].trim(), parts[1].trim()));
        }
        return CausalGraph.of(nodes, es);
    }
}
