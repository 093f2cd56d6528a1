package com.hcltech.causal.dag.analysis;

import com.hcltech.causal.common.ITimeService;
import com.hcltech.causal.dag.AnalysisStatus;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.adjust.AdjustmentQuery;
import com.hcltech.causal.dag.adjust.AdjustmentResult;
import com.hcltech.causal.dag.adjust.AdjustmentSetSearch;
import com.hcltech.causal.dag.adjust.Budget;
import com.hcltech.causal.dag.bias.ButterflyBiasDetector;
import com.hcltech.causal.dag.bias.ButterflyReport;
import com.hcltech.causal.dag.bias.MBiasDetector;
import com.hcltech.causal.dag.bias.MBiasReport;
import com.hcltech.causal.dag.iv.InstrumentResult;
import com.hcltech.causal.dag.iv.InstrumentalVariableFinder;
import com.hcltech.causal.dag.paths.CausalPath;
import com.hcltech.causal.dag.paths.CompiledPath;
import com.hcltech.causal.dag.paths.PathEnumeration;
import com.hcltech.causal.dag.paths.PathOracle;
import com.hcltech.causal.dag.validation.StructuralValidator;
import com.hcltech.causal.dag.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Runs every analysis for one query against one snapshot and assembles the report. Holds no state besides the
 * time source, so one instance can serve concurrent queries.
 */
public final class CausalAnalysis {
    private static final Logger log = LoggerFactory.getLogger(CausalAnalysis.class);

    private final ITimeService time;

    public CausalAnalysis() {
        this(ITimeService.real);
    }

    public CausalAnalysis(ITimeService time) {
        this.time = time;
    }

    public AnalysisReport analyse(CausalGraph graph, AnalysisRequest request) {
        return analyse(graph, request, () -> false);
    }

    public AnalysisReport analyse(CausalGraph graph, AnalysisRequest request, BooleanSupplier cancelled) {
        if (request == null) request = AnalysisRequest.declared();
        if (graph == null) {
            return failed(AnalysisStatus.INVALID_GRAPH, "Invalid or missing graph", request, VariableListing.empty(),
                    StructuralValidator.inspect(CausalGraph.empty()), AnalysisSummary.of(0, false, false, false));
        }
        List<String> exposures = request.exposures().isEmpty() ? graph.exposures() : request.exposures();
        List<String> outcomes = request.outcomes().isEmpty() ? graph.outcomes() : request.outcomes();
        ValidationReport validation = StructuralValidator.inspect(graph);
        AnalysisSummary summary = AnalysisSummary.of(graph.size(), !exposures.isEmpty(), !outcomes.isEmpty(),
                validation.hasCycles());

        List<String> unknown = new ArrayList<>();
        for (String id : exposures) if (!graph.hasNode(id)) unknown.add(id);
        for (String id : outcomes) if (!graph.hasNode(id)) unknown.add(id);
        if (!unknown.isEmpty()) {
            return failed(AnalysisStatus.INVALID_GRAPH, "Variable(s) not in graph: " + String.join(", ", unknown),
                    request, VariableListing.of(graph, List.of(), List.of()), validation, summary);
        }
        VariableListing variables = VariableListing.of(graph, exposures, outcomes);
        if (exposures.isEmpty() || outcomes.isEmpty()) {
            return failed(AnalysisStatus.MISSING_ROLES, "Both exposure and outcome variables must be defined",
                    request, variables, validation, summary);
        }
        if (validation.hasCycles()) {
            for (List<String> cycle : validation.cycles()) log.warn("Cycle: {}", ReportFormatter.cycle(graph, cycle));
            return failed(AnalysisStatus.CYCLE_DETECTED, validation.message(), request, variables, validation, summary);
        }
        List<String> both = exposures.stream().filter(outcomes::contains).toList();
        if (!both.isEmpty()) {
            return failed(AnalysisStatus.INVALID_GRAPH,
                    "Variable(s) cannot be both exposure and outcome: " + String.join(", ", both),
                    request, variables, validation, summary);
        }

        PathOracle oracle = new PathOracle(graph);
        AdjustmentSetSearch search = new AdjustmentSetSearch(oracle, time);
        AdjustmentQuery query = new AdjustmentQuery(exposures, outcomes, request.effect(), request.limits(), cancelled);

        AdjustmentResult adjustment = search.search(query);
        InstrumentResult instruments = new InstrumentalVariableFinder(oracle).find(exposures, outcomes);
        Budget budget = Budget.start(time, request.limits().timeout(), cancelled);
        PathReport paths = pathReport(oracle, exposures, outcomes, adjustment, request.reportedPathLimit(),
                budget::exceeded);
        MBiasReport mBias = new MBiasDetector(oracle).detect(adjustment, request.limits().pathLimit(), budget::exceeded);
        ButterflyReport butterfly = new ButterflyBiasDetector(search, graph).detect(query, adjustment);

        log.info("Analysis {} -> {} ({} effect): {}; {} instruments, {} M-bias, {} butterfly",
                exposures, outcomes, request.effect().wireName(), adjustment.message(), instruments.count(),
                mBias.count(), butterfly.count());
        return new AnalysisReport(adjustment.status(), adjustment.message(), request.effect(), variables, validation,
                adjustment, instruments, paths, mBias, butterfly, summary);
    }

    /** Paths per exposure/outcome pair, each marked open or blocked with nothing adjusted and under the first set. */
    static PathReport pathReport(PathOracle oracle, List<String> exposures, List<String> outcomes,
                                 AdjustmentResult adjustment, int limit, BooleanSupplier stop) {
        List<String> adjustedFor = adjustment.sets().isEmpty() ? List.of() : adjustment.sets().get(0).variables();
        BitSet nothing = new BitSet();
        BitSet adjusted = oracle.bits(adjustedFor);
        List<PathEntry> entries = new ArrayList<>();
        int open = 0;
        boolean truncated = false;
        int warnings = 0;
        for (String x : exposures) {
            for (String y : outcomes) {
                PathEnumeration e = oracle.enumeratePaths(x, y, limit, Set.of(), stop);
                truncated |= e.truncated();
                warnings += e.warnings();
                for (CausalPath p : e.paths()) {
                    CompiledPath cp = oracle.compile(p);
                    boolean isOpen = cp.isOpenUnder(nothing);
                    boolean afterAdjustment = adjustment.sets().isEmpty() ? isOpen : cp.isOpenUnder(adjusted);
                    if (isOpen) open++;
                    entries.add(new PathEntry(entries.size() + 1, p.from(), p.to(), p.nodes(), p.length(), p.describe(),
                            p.kind(), isOpen, afterAdjustment));
                }
            }
        }
        return new PathReport(entries, adjustedFor, open, entries.size() - open, truncated, warnings);
    }

    private AnalysisReport failed(AnalysisStatus status, String message, AnalysisRequest request,
                                  VariableListing variables, ValidationReport validation, AnalysisSummary summary) {
        log.warn("Analysis not run: {} ({})", message, status);
        return new AnalysisReport(status, message, request.effect(), variables, validation,
                AdjustmentResult.failure(status, message, variables.exposures(), variables.outcomes(), request.effect()),
                new InstrumentResult(status, message, List.of()),
                PathReport.empty(),
                MBiasReport.failure(status, message),
                ButterflyReport.failure(status, message),
                summary);
    }
}
