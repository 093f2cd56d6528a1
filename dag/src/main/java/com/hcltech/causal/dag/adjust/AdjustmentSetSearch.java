package com.hcltech.causal.dag.adjust;

import com.hcltech.causal.common.ITimeService;
import com.hcltech.causal.dag.AnalysisStatus;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.paths.PathOracle;
import com.hcltech.causal.dag.validation.StructuralValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Minimal sufficient adjustment sets by iterative deepening over subset size.
 * <p>
 * Level k visits the k-subsets of the candidate array in order and accepts every subset that blocks all
 * relevant paths. Supersets of accepted sets are cut while backtracking, so each accepted set is minimal.
 * When the result cap is reached the search keeps looking for one more set, so {@code truncated} is only
 * reported when something was actually left out.
 */
public final class AdjustmentSetSearch {
    private static final Logger log = LoggerFactory.getLogger(AdjustmentSetSearch.class);

    private final PathOracle oracle;
    private final ITimeService time;

    public AdjustmentSetSearch(CausalGraph graph) {
        this(new PathOracle(graph), ITimeService.real);
    }

    public AdjustmentSetSearch(PathOracle oracle, ITimeService time) {
        this.oracle = oracle;
        this.time = time;
    }

    public AdjustmentResult search(AdjustmentQuery query) {
        Optional<AdjustmentResult> rejected = precheck(query);
        if (rejected.isPresent()) return rejected.get();

        CausalGraph graph = oracle.graph();
        SearchLimits limits = query.limits();
        Budget budget = Budget.start(time, limits.timeout(), query.cancelled());
        BackdoorProblem problem = prepare(query, budget);
        if (problem.exactFallback()) {
            log.warn("Path enumeration for {} -> {} stopped before completing (limit {} paths); testing candidate sets"
                    + " by reachability", query.exposures(), query.outcomes(), limits.pathLimit());
        }

        int[] candidates = problem.candidates();
        SubsetWalker walker = new SubsetWalker(candidates, budget);
        BitSet empty = new BitSet(graph.size());
        List<BitSet> accepted = new ArrayList<>();

        StopReason stop = null;
        int ceiling = Math.min(limits.maxSetSize(), candidates.length);
        for (int k = 0; k <= ceiling && stop == null; k++) {
            stop = walker.walk(k, empty, accepted, z -> {
                if (!problem.isSufficient(z)) return true;
                if (accepted.size() == limits.maxResults()) return false;
                accepted.add((BitSet) z.clone());
                return true;
            });
            log.debug("Adjustment search level {} done: {} sets, {} subsets tested", k, accepted.size(), walker.visited());
            if (accepted.contains(empty)) break;
        }
        if (stop == null) stop = checkBeyondCeiling(walker, limits, candidates.length, empty, accepted);

        List<AdjustmentSet> sets = new ArrayList<>(accepted.size());
        for (BitSet z : accepted) sets.add(AdjustmentSet.of(sets.size() + 1, graph.names(z)));

        boolean truncated = stop.truncates();
        AnalysisStatus status;
        String message;
        if (truncated) {
            status = AnalysisStatus.RESULT_CAP_REACHED;
            message = "Found " + sets.size() + " minimal sufficient adjustment set(s); search stopped early ("
                    + describe(stop, limits) + ")";
            log.warn("Adjustment search for {} -> {} truncated: {}", query.exposures(), query.outcomes(), describe(stop, limits));
        } else if (sets.isEmpty()) {
            status = AnalysisStatus.UNIDENTIFIABLE;
            message = "No valid adjustment sets found: the causal effect cannot be identified from observational data"
                    + " given the current DAG structure";
        } else {
            status = AnalysisStatus.OK;
            message = "Found " + sets.size() + " minimal sufficient adjustment set(s)";
        }
        log.debug("{} ({} {} effect, {} candidates)", message, query.exposures(), query.effect().wireName(), candidates.length);
        return new AdjustmentResult(status, message, query.exposures(), query.outcomes(), query.effect(), sets, truncated,
                stop, problem.relevantPathCount(), problem.exactFallback(), walker.visited());
    }

    /**
     * Whether some valid set includes {@code forced}, and if so the smallest one, found by the same level-wise
     * walk with {@code forced} fixed in every subset.
     */
    public Optional<List<String>> validSetContaining(AdjustmentQuery query, String forced) {
        if (precheck(query).isPresent()) return Optional.empty();
        Budget budget = Budget.start(time, query.limits().timeout(), query.cancelled());
        return validSetContaining(prepare(query, budget), forced, budget, query.limits().maxSetSize());
    }

    /**
     * The union of all valid adjustment sets, restricted to ancestors of the exposures and outcomes. The walk
     * for each node shares one time budget; if it runs out the result is flagged as truncated.
     */
    public ConfounderSet confounders(AdjustmentQuery query, AdjustmentResult minimal) {
        if (precheck(query).isPresent()) return ConfounderSet.none();
        CausalGraph graph = oracle.graph();
        Budget budget = Budget.start(time, query.limits().timeout(), query.cancelled());
        BackdoorProblem problem = prepare(query, budget);

        List<Integer> roots = new ArrayList<>();
        for (int i : indices(query.exposures())) roots.add(i);
        for (int i : indices(query.outcomes())) roots.add(i);
        BitSet scope = graph.ancestorsOfAll(roots);
        scope.andNot(problem.excluded());

        Set<String> known = new HashSet<>(minimal.variablesInAnySet());
        List<String> out = new ArrayList<>();
        boolean truncated = minimal.truncated();
        for (int v = scope.nextSetBit(0); v >= 0; v = scope.nextSetBit(v + 1)) {
            String id = graph.idOf(v);
            if (known.contains(id) || extendsMinimalSet(problem, v, minimal)) {
                out.add(id);
                continue;
            }
            if (budget.check() != null) {
                truncated = true;
                break;
            }
            if (validSetContaining(problem, id, budget, query.limits().maxSetSize()).isPresent()) out.add(id);
        }
        if (budget.check() != null) truncated = true;
        return new ConfounderSet(out, truncated);
    }

    private boolean extendsMinimalSet(BackdoorProblem problem, int v, AdjustmentResult minimal) {
        for (AdjustmentSet s : minimal.sets()) {
            BitSet z = oracle.bits(s.variables());
            z.set(v);
            if (problem.isSufficient(z)) return true;
        }
        return false;
    }

    private Optional<List<String>> validSetContaining(BackdoorProblem problem, String forced, Budget budget, int maxSetSize) {
        CausalGraph graph = oracle.graph();
        int f = graph.indexOf(forced);
        if (f < 0 || problem.excluded().get(f)) return Optional.empty();

        int[] candidates = Arrays.stream(problem.candidates()).filter(c -> c != f).toArray();
        SubsetWalker walker = new SubsetWalker(candidates, budget);
        BitSet base = new BitSet(graph.size());
        base.set(f);
        BitSet[] found = new BitSet[1];
        int ceiling = Math.min(maxSetSize - 1, candidates.length);
        for (int k = 0; k <= ceiling && found[0] == null; k++) {
            StopReason stop = walker.walk(k, base, List.of(), z -> {
                if (!problem.isSufficient(z)) return true;
                found[0] = (BitSet) z.clone();
                return false;
            });
            if (stop != null && stop != StopReason.RESULT_CAP) break;
        }
        return found[0] == null ? Optional.empty() : Optional.of(graph.names(found[0]));
    }

    /**
     * After the last level, checks whether any subset above the size ceiling is still not a superset of an
     * accepted set. If one is, the ceiling cut the search short.
     */
    private StopReason checkBeyondCeiling(SubsetWalker walker, SearchLimits limits, int candidateCount, BitSet empty,
                                          List<BitSet> accepted) {
        if (limits.maxSetSize() >= candidateCount || accepted.contains(empty)) return StopReason.EXHAUSTED;
        StopReason beyond = walker.walk(limits.maxSetSize() + 1, empty, accepted, z -> false);
        if (beyond == null) return StopReason.EXHAUSTED;
        return beyond == StopReason.RESULT_CAP ? StopReason.SIZE_CEILING : beyond;
    }

    private Optional<AdjustmentResult> precheck(AdjustmentQuery query) {
        CausalGraph graph = oracle.graph();
        if (query.exposures().isEmpty() || query.outcomes().isEmpty()) {
            return Optional.of(AdjustmentResult.failure(AnalysisStatus.MISSING_ROLES,
                    "Both exposure and outcome variables must be defined", query.exposures(), query.outcomes(),
                    query.effect()));
        }
        List<String> unknown = new ArrayList<>();
        for (String id : query.exposures()) if (!graph.hasNode(id)) unknown.add(id);
        for (String id : query.outcomes()) if (!graph.hasNode(id)) unknown.add(id);
        if (!unknown.isEmpty()) {
            return Optional.of(AdjustmentResult.failure(AnalysisStatus.INVALID_GRAPH,
                    "Unknown variable(s): " + String.join(", ", unknown), query.exposures(), query.outcomes(),
                    query.effect()));
        }
        List<String> both = query.exposures().stream().filter(query.outcomes()::contains).toList();
        if (!both.isEmpty()) {
            return Optional.of(AdjustmentResult.failure(AnalysisStatus.INVALID_GRAPH,
                    "Variable(s) cannot be both exposure and outcome: " + String.join(", ", both), query.exposures(),
                    query.outcomes(), query.effect()));
        }
        if (StructuralValidator.inspect(graph).hasCycles()) {
            return Optional.of(AdjustmentResult.failure(AnalysisStatus.CYCLE_DETECTED,
                    "Graph contains cycles; adjustment sets are only defined for acyclic graphs", query.exposures(),
                    query.outcomes(), query.effect()));
        }
        return Optional.empty();
    }

    private BackdoorProblem prepare(AdjustmentQuery query, Budget budget) {
        return BackdoorProblem.prepare(oracle, indices(query.exposures()), indices(query.outcomes()), query.effect(),
                query.limits().pathLimit(), budget);
    }

    private int[] indices(List<String> ids) {
        return ids.stream().mapToInt(oracle.graph()::indexOf).toArray();
    }

    private static String describe(StopReason stop, SearchLimits limits) {
        return switch (stop) {
            case RESULT_CAP -> "more than " + limits.maxResults() + " sets exist";
            case SIZE_CEILING -> "sets larger than " + limits.maxSetSize() + " variables were not tried";
            case DEADLINE -> "time limit of " + limits.timeout().toMillis() + " ms reached";
            case CANCELLED -> "cancelled";
            case EXHAUSTED -> "complete";
        };
    }
}
