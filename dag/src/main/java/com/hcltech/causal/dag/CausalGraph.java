package com.hcltech.causal.dag;

import com.hcltech.causal.common.errorsor.ErrorsOr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Immutable snapshot of a causal graph: nodes in input order, edges without duplicates or orphans,
 * and index-based parent/child adjacency.
 * <p>
 * Cycles are allowed here so that they can be reported; analysis entry points refuse cyclic snapshots.
 * Ancestor and descendant sets are memoised per snapshot, so an edit (which always yields a new snapshot)
 * never sees stale results.
 */
public final class CausalGraph {

    private final List<CausalNode> nodes;
    private final List<Edge> edges;
    private final Map<String, Integer> index;
    private final int[][] parents;
    private final int[][] children;

    private final Map<Integer, BitSet> ancestorCache = new ConcurrentHashMap<>();
    private final Map<Integer, BitSet> descendantCache = new ConcurrentHashMap<>();

    private CausalGraph(List<CausalNode> nodes, List<Edge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);

        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            String id = this.nodes.get(i).id();
            if (idx.putIfAbsent(id, i) != null) {
                throw new IllegalArgumentException("Duplicate node id " + id);
            }
        }
        this.index = Collections.unmodifiableMap(idx);

        List<List<Integer>> ps = new ArrayList<>();
        List<List<Integer>> cs = new ArrayList<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            ps.add(new ArrayList<>());
            cs.add(new ArrayList<>());
        }
        Set<Edge> seen = new HashSet<>();
        for (Edge e : this.edges) {
            Integer f = idx.get(e.from());
            Integer t = idx.get(e.to());
            if (f == null || t == null) {
                throw new IllegalArgumentException("Edge " + e.describe() + " references a missing node");
            }
            if (!seen.add(e)) throw new IllegalArgumentException("Duplicate edge " + e.describe());
            cs.get(f).add(t);
            ps.get(t).add(f);
        }
        this.parents = toSortedArrays(ps);
        this.children = toSortedArrays(cs);
    }

    /** Builds a snapshot from clean lists; throws IllegalArgumentException on orphans, duplicates or repeated ids. */
    public static CausalGraph of(List<CausalNode> nodes, List<Edge> edges) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
        return new CausalGraph(nodes, edges);
    }

    public static CausalGraph empty() {
        return new CausalGraph(List.of(), List.of());
    }

    private static int[][] toSortedArrays(List<List<Integer>> lists) {
        int[][] out = new int[lists.size()][];
        for (int i = 0; i < lists.size(); i++) {
            out[i] = lists.get(i).stream().mapToInt(Integer::intValue).sorted().toArray();
        }
        return out;
    }

    // ---------------------------------------------------------------- plain queries

    public List<CausalNode> nodes() { return nodes; }

    public List<Edge> edges() { return edges; }

    public int size() { return nodes.size(); }

    public int edgeCount() { return edges.size(); }

    public boolean hasNode(String id) { return id != null && index.containsKey(id); }

    public boolean hasEdge(Edge e) {
        int f = indexOf(e.from());
        int t = indexOf(e.to());
        if (f < 0 || t < 0) return false;
        for (int c : children[f]) if (c == t) return true;
        return false;
    }

    public Optional<NodeRole> role(String id) {
        int i = indexOf(id);
        return i < 0 ? Optional.empty() : Optional.of(nodes.get(i).role());
    }

    public List<String> ids() {
        return nodes.stream().map(CausalNode::id).toList();
    }

    public List<String> nodesWithRole(NodeRole role) {
        return nodes.stream().filter(n -> n.role() == role).map(CausalNode::id).toList();
    }

    public List<String> exposures() { return nodesWithRole(NodeRole.EXPOSURE); }

    public List<String> outcomes() { return nodesWithRole(NodeRole.OUTCOME); }

    public List<String> parents(String id) { return names(parents[require(id)]); }

    public List<String> children(String id) { return names(children[require(id)]); }

    /** Strict ancestors in graph order. */
    public List<String> ancestors(String id) { return names(ancestorClosure(require(id))); }

    /** Strict descendants in graph order. */
    public List<String> descendants(String id) { return names(descendantClosure(require(id))); }

    public int inDegree(String id) { return parents[require(id)].length; }

    public int outDegree(String id) { return children[require(id)].length; }

    public GraphDescription toDescription() {
        return new GraphDescription(nodes, edges);
    }

    // ---------------------------------------------------------------- index-level access for the algorithms

    /** Index of the node or -1. */
    public int indexOf(String id) {
        Integer i = id == null ? null : index.get(id);
        return i == null ? -1 : i;
    }

    public String idOf(int i) { return nodes.get(i).id(); }

    public NodeRole roleOf(int i) { return nodes.get(i).role(); }

    /** Parent indices in graph order. A copy: callers in loops should fetch it once per node. */
    public int[] parentIndices(int i) { return parents[i].clone(); }

    /** Child indices in graph order. A copy: callers in loops should fetch it once per node. */
    public int[] childIndices(int i) { return children[i].clone(); }

    public int inDegree(int i) { return parents[i].length; }

    public int outDegree(int i) { return children[i].length; }

    /** Strict descendants of node i, as a fresh copy of the cached closure. */
    public BitSet descendantBits(int i) {
        return (BitSet) descendantClosure(i).clone();
    }

    /** Strict ancestors of node i, as a fresh copy of the cached closure. */
    public BitSet ancestorBits(int i) {
        return (BitSet) ancestorClosure(i).clone();
    }

    /** Union of the strict descendants of every node in the collection. */
    public BitSet descendantsOfAll(Collection<Integer> sources) {
        BitSet out = new BitSet(size());
        for (int s : sources) out.or(descendantClosure(s));
        return out;
    }

    /** Union of the strict ancestors of every node in the collection. */
    public BitSet ancestorsOfAll(Collection<Integer> sources) {
        BitSet out = new BitSet(size());
        for (int s : sources) out.or(ancestorClosure(s));
        return out;
    }

    private BitSet descendantClosure(int i) {
        return descendantCache.computeIfAbsent(i, k -> reach(k, children));
    }

    private BitSet ancestorClosure(int i) {
        return ancestorCache.computeIfAbsent(i, k -> reach(k, parents));
    }

    public List<String> names(BitSet bits) {
        List<String> out = new ArrayList<>(bits.cardinality());
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) out.add(idOf(i));
        return out;
    }

    public List<String> names(int[] idx) {
        List<String> out = new ArrayList<>(idx.length);
        for (int i : idx) out.add(idOf(i));
        return out;
    }

    /** Breadth-first closure along the given adjacency, excluding the start node unless it is on a cycle. */
    private BitSet reach(int start, int[][] adjacency) {
        BitSet seen = new BitSet(size());
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (int w : adjacency[v]) {
                if (!seen.get(w)) {
                    seen.set(w);
                    queue.add(w);
                }
            }
        }
        return seen;
    }

    private int require(String id) {
        int i = indexOf(id);
        if (i < 0) throw new IllegalArgumentException("Unknown node " + id);
        return i;
    }

    // ---------------------------------------------------------------- removals (new snapshot, never mutation)

    /** Removes the node and every incident edge. */
    public ErrorsOr<GraphEdit> removeNode(String id) {
        if (id == null || id.isBlank()) return ErrorsOr.error("No node selected for removal");
        if (!hasNode(id)) return ErrorsOr.error("Node " + id + " not found");

        List<CausalNode> keptNodes = nodes.stream().filter(n -> !n.id().equals(id)).toList();
        List<Edge> keptEdges = edges.stream().filter(e -> !e.touches(id)).toList();
        int removed = edges.size() - keptEdges.size();
        return ErrorsOr.lift(new GraphEdit(this, new CausalGraph(keptNodes, keptEdges), "remove_node", id, removed));
    }

    public ErrorsOr<GraphEdit> removeEdge(Edge edge) {
        if (edge == null) return ErrorsOr.error("No edge selected for removal");
        if (!hasEdge(edge)) return ErrorsOr.error("Edge " + edge.describe() + " not found");

        List<Edge> keptEdges = edges.stream().filter(e -> !e.equals(edge)).toList();
        return ErrorsOr.lift(new GraphEdit(this, new CausalGraph(nodes, keptEdges), "remove_edge", edge.describe(), 1));
    }

    /** Node id to role, in graph order. */
    public Map<String, NodeRole> roles() {
        Map<String, NodeRole> out = new LinkedHashMap<>();
        for (CausalNode n : nodes) out.put(n.id(), n.role());
        return Collections.unmodifiableMap(out);
    }

    @Override
    public String toString() {
        return "CausalGraph(nodes=" + nodes.size() + ", edges=" + edges.size() + ")";
    }
}
