package com.hcltech.causal.dag.paths;

import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.Edge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Path enumeration and d-separation over one snapshot.
 * <p>
 * Enumeration walks edges in both directions but records their true direction. Neighbours are visited
 * in graph order, so results are deterministic. The set-level test {@link #isDConnected} is a
 * reachability search over (node, direction) states and is exact without enumerating paths; callers use
 * it whenever an enumeration came back truncated.
 */
public final class PathOracle {
    private static final Logger log = LoggerFactory.getLogger(PathOracle.class);

    /** DFS steps allowed per enumeration, per path asked for, with a floor of {@link #MIN_STEPS}. */
    static final long STEPS_PER_PATH = 100;
    static final long MIN_STEPS = 100_000;
    private static final int STOP_POLL_MASK = 0xff;

    private final CausalGraph graph;
    private final int[][] parents;
    private final int[][] children;
    private final int[][] neighbours;
    private final boolean[][] forward;

    public PathOracle(CausalGraph graph) {
        this.graph = graph;
        int n = graph.size();
        this.parents = new int[n][];
        this.children = new int[n][];
        this.neighbours = new int[n][];
        this.forward = new boolean[n][];
        for (int v = 0; v < n; v++) {
            int[] ps = graph.parentIndices(v);
            int[] cs = graph.childIndices(v);
            parents[v] = ps;
            children[v] = cs;
            int[] nb = new int[ps.length + cs.length];
            boolean[] fw = new boolean[nb.length];
            // merge the two sorted lists so traversal follows graph order
            int i = 0, j = 0, k = 0;
            while (i < ps.length || j < cs.length) {
                if (j >= cs.length || (i < ps.length && ps[i] < cs[j])) {
                    nb[k] = ps[i++];
                    fw[k++] = false;
                } else {
                    nb[k] = cs[j++];
                    fw[k++] = true;
                }
            }
            neighbours[v] = nb;
            forward[v] = fw;
        }
    }

    public CausalGraph graph() {
        return graph;
    }

    // ------------------------------------------------------------------ enumeration

    public PathEnumeration enumeratePaths(String from, String to, int limit) {
        return enumeratePaths(from, to, limit, Set.of());
    }

    public PathEnumeration enumeratePaths(String from, String to, int limit, Set<String> noPassThrough) {
        return enumeratePaths(from, to, limit, noPassThrough, () -> false);
    }

    /**
     * All simple paths between {@code from} and {@code to}, at most {@code limit} of them, none of which
     * passes through a node of {@code noPassThrough}.
     * <p>
     * The walk also ends when {@code stop} turns true (polled every 256 steps) or after
     * {@code max(MIN_STEPS, limit * STEPS_PER_PATH)} steps. Either is reported as {@code truncated}.
     */
    public PathEnumeration enumeratePaths(String from, String to, int limit, Set<String> noPassThrough,
                                          BooleanSupplier stop) {
        if (limit < 1) throw new IllegalArgumentException("limit must be positive but was " + limit);
        int warnings = 0;
        int f = graph.indexOf(from);
        int t = graph.indexOf(to);
        if (f < 0) {
            log.warn("Path enumeration skipped: unknown node '{}'", from);
            warnings++;
        }
        if (t < 0) {
            log.warn("Path enumeration skipped: unknown node '{}'", to);
            warnings++;
        }
        if (warnings > 0) return PathEnumeration.empty(warnings);
        if (f == t) return PathEnumeration.empty(0);

        BitSet avoid = new BitSet(graph.size());
        for (String id : noPassThrough) {
            int i = graph.indexOf(id);
            if (i >= 0) avoid.set(i);
            else warnings++;
        }
        avoid.clear(f);
        avoid.clear(t);
        return walk(f, t, limit, avoid, warnings, stop);
    }

    private PathEnumeration walk(int f, int t, int limit, BitSet avoid, int warnings, BooleanSupplier stop) {
        List<CausalPath> found = new ArrayList<>();
        boolean truncated = false;
        long maxSteps = Math.max(MIN_STEPS, limit * STEPS_PER_PATH);
        long steps = 0;

        BitSet onPath = new BitSet(graph.size());
        List<Integer> nodeStack = new ArrayList<>();
        List<Arrow> arrowStack = new ArrayList<>();
        Deque<int[]> frames = new ArrayDeque<>();
        onPath.set(f);
        nodeStack.add(f);
        frames.push(new int[]{f, 0});

        search:
        while (!frames.isEmpty()) {
            steps++;
            if (steps > maxSteps || ((steps & STOP_POLL_MASK) == 0 && stop.getAsBoolean())) {
                log.debug("Path enumeration {} .. {} stopped after {} steps with {} paths", graph.idOf(f),
                        graph.idOf(t), steps, found.size());
                truncated = true;
                break;
            }
            int[] frame = frames.peek();
            int v = frame[0];
            if (frame[1] >= neighbours[v].length) {
                frames.pop();
                onPath.clear(v);
                nodeStack.remove(nodeStack.size() - 1);
                if (!arrowStack.isEmpty()) arrowStack.remove(arrowStack.size() - 1);
                continue;
            }
            int k = frame[1]++;
            int w = neighbours[v][k];
            if (onPath.get(w) || avoid.get(w)) continue;
            Arrow arrow = forward[v][k] ? Arrow.FORWARD : Arrow.BACKWARD;
            if (w == t) {
                if (found.size() == limit) {
                    log.debug("Path enumeration {} .. {} stopped at limit {}", graph.idOf(f), graph.idOf(t), limit);
                    truncated = true;
                    break search;
                }
                List<String> names = new ArrayList<>(nodeStack.size() + 1);
                for (int i : nodeStack) names.add(graph.idOf(i));
                names.add(graph.idOf(t));
                List<Arrow> arrows = new ArrayList<>(arrowStack);
                arrows.add(arrow);
                found.add(new CausalPath(names, arrows));
                continue;
            }
            onPath.set(w);
            nodeStack.add(w);
            arrowStack.add(arrow);
            frames.push(new int[]{w, 0});
        }
        return new PathEnumeration(found, truncated, warnings);
    }

    // ------------------------------------------------------------------ single-path blocking

    /** Whether no interior node of the path blocks it when conditioning on {@code z}. */
    public boolean isOpen(CausalPath path, Collection<String> z) {
        return compile(path).isOpenUnder(bits(z));
    }

    public CompiledPath compile(CausalPath path) {
        List<Integer> nonColliders = new ArrayList<>();
        List<Integer> colliders = new ArrayList<>();
        List<BitSet> openers = new ArrayList<>();
        BitSet interior = new BitSet(graph.size());
        List<String> nodes = path.nodes();
        for (int i = 1; i < nodes.size() - 1; i++) {
            int v = graph.indexOf(nodes.get(i));
            if (v < 0) throw new IllegalArgumentException("Path " + path.describe() + " references unknown node " + nodes.get(i));
            interior.set(v);
            if (path.isColliderAt(i)) {
                colliders.add(v);
                BitSet o = graph.descendantBits(v);
                o.set(v);
                openers.add(o);
            } else {
                nonColliders.add(v);
            }
        }
        return new CompiledPath(path,
                nonColliders.stream().mapToInt(Integer::intValue).toArray(),
                colliders.stream().mapToInt(Integer::intValue).toArray(),
                openers.toArray(new BitSet[0]),
                interior);
    }

    /** Graph indices of the given ids; unknown ids are ignored. */
    public BitSet bits(Collection<String> ids) {
        BitSet out = new BitSet(graph.size());
        if (ids == null) return out;
        for (String id : ids) {
            int i = graph.indexOf(id);
            if (i >= 0) out.set(i);
        }
        return out;
    }

    // ------------------------------------------------------------------ set-level d-connection

    public boolean isDConnected(String a, String b, Collection<String> z) {
        return isDConnected(DConnectionQuery.of(a, b, z == null ? Set.of() : new HashSet<>(z)));
    }

    public boolean isDConnected(DConnectionQuery q) {
        int a = graph.indexOf(q.a());
        int b = graph.indexOf(q.b());
        if (a < 0 || b < 0) {
            log.warn("d-connection query skipped: unknown node in {} / {}", q.a(), q.b());
            return false;
        }
        if (a == b) return true;
        BitSet z = bits(q.z());
        if (z.get(a) || z.get(b)) return false;
        return isDConnected(a, b, z, bits(q.noOutgoingFrom()), edgeKeys(q.removedEdges()), bits(q.noPassThrough()));
    }

    /**
     * Index-level form for callers that test many conditioning sets against one prepared query.
     * A state is a node plus whether it was entered from a child (travelling up) or from a parent.
     */
    public boolean isDConnected(int a, int b, BitSet z, BitSet noOutgoingFrom, Set<Long> removedEdges, BitSet avoid) {
        int n = graph.size();
        BitSet activators = graph.ancestorsOfAll(z.stream().boxed().toList());
        activators.or(z);

        BitSet seenUp = new BitSet(n);
        BitSet seenDown = new BitSet(n);
        Deque<long[]> queue = new ArrayDeque<>();
        for (int p : parents[a]) {
            if (allowed(p, a, noOutgoingFrom, removedEdges)) queue.add(new long[]{p, 1});
        }
        for (int c : children[a]) {
            if (allowed(a, c, noOutgoingFrom, removedEdges)) queue.add(new long[]{c, 0});
        }
        while (!queue.isEmpty()) {
            long[] s = queue.poll();
            int v = (int) s[0];
            boolean up = s[1] == 1;
            if (v == b) return true;
            if (v == a || avoid.get(v)) continue;
            BitSet seen = up ? seenUp : seenDown;
            if (seen.get(v)) continue;
            seen.set(v);

            boolean conditioned = z.get(v);
            if (up) {
                if (conditioned) continue;
                for (int p : parents[v]) {
                    if (allowed(p, v, noOutgoingFrom, removedEdges)) queue.add(new long[]{p, 1});
                }
                for (int c : children[v]) {
                    if (allowed(v, c, noOutgoingFrom, removedEdges)) queue.add(new long[]{c, 0});
                }
            } else {
                if (!conditioned) {
                    for (int c : children[v]) {
                        if (allowed(v, c, noOutgoingFrom, removedEdges)) queue.add(new long[]{c, 0});
                    }
                }
                if (activators.get(v)) {
                    for (int p : parents[v]) {
                        if (allowed(p, v, noOutgoingFrom, removedEdges)) queue.add(new long[]{p, 1});
                    }
                }
            }
        }
        return false;
    }

    public Set<Long> edgeKeys(Collection<Edge> edges) {
        Set<Long> out = new HashSet<>();
        for (Edge e : edges) {
            int f = graph.indexOf(e.from());
            int t = graph.indexOf(e.to());
            if (f >= 0 && t >= 0) out.add(edgeKey(f, t));
        }
        return out;
    }

    private boolean allowed(int from, int to, BitSet noOutgoingFrom, Set<Long> removedEdges) {
        return !noOutgoingFrom.get(from) && (removedEdges.isEmpty() || !removedEdges.contains(edgeKey(from, to)));
    }

    private long edgeKey(int from, int to) {
        return (long) from * graph.size() + to;
    }
}
