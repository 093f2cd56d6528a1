package com.hcltech.causal.dag.analysis;

import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.NodeRole;
import com.hcltech.causal.dag.adjust.AdjustmentResult;
import com.hcltech.causal.dag.adjust.AdjustmentSet;
import com.hcltech.causal.dag.bias.ButterflyReport;
import com.hcltech.causal.dag.bias.MBiasReport;
import com.hcltech.causal.dag.bias.MBiasVariable;
import com.hcltech.causal.dag.validation.ValidationReport;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Plain-text renderings of the analysis records, for logs and console output. */
public final class ReportFormatter {
    private static final String RULE = "=".repeat(50);

    private ReportFormatter() {}

    /** {@code A (Exposure) -> B (Covariate) -> A (Exposure)}: the cycle is closed back to its first node. */
    public static String cycle(CausalGraph graph, List<String> cycle) {
        if (cycle.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (String id : cycle) {
            if (sb.length() > 0) sb.append(" -> ");
            sb.append(labelled(graph, id));
        }
        if (cycle.size() > 1) sb.append(" -> ").append(labelled(graph, cycle.get(0)));
        return sb.toString();
    }

    public static String cycleReport(CausalGraph graph, ValidationReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Cycle Detection Report\n");
        sb.append("Graph is ").append(report.hasCycles() ? "NOT " : "").append("acyclic (DAG property)\n");
        sb.append("Total cycles found: ").append(report.cycles().size()).append('\n');
        if (!report.hasCycles()) {
            sb.append("\nThe graph satisfies the DAG property (no cycles detected).\n");
            return sb.toString();
        }
        sb.append("\nAll cycles (").append(report.cycles().size()).append("):\n");
        numbered(sb, graph, report.cycles());
        if (!report.criticalCycles().isEmpty()) {
            sb.append("\nExposure-Outcome cycles (").append(report.criticalCycles().size()).append("):\n");
            numbered(sb, graph, report.criticalCycles());
            sb.append("\nWarning: cycles involving both exposure and outcome nodes block causal identification.\n");
        }
        return sb.toString();
    }

    public static String adjustmentSets(AdjustmentResult result) {
        StringBuilder sb = new StringBuilder(result.message()).append('\n');
        if (!result.success()) return sb.toString();
        for (AdjustmentSet set : result.sets()) {
            sb.append("  ").append(set.id()).append(". ").append(braces(set)).append('\n');
        }
        if (result.truncated()) sb.append("  (more sets may exist)\n");
        return sb.toString();
    }

    public static String biasReport(AnalysisReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append("\nBIAS STRUCTURE ANALYSIS\n").append(RULE).append("\n\n");
        sb.append("Exposure: ").append(String.join(", ", report.variables().exposures())).append('\n');
        sb.append("Outcome:  ").append(String.join(", ", report.variables().outcomes())).append("\n\n");

        MBiasReport mBias = report.mBias();
        if (mBias.detected()) {
            sb.append("M-bias variables (colliders that should NOT be adjusted):\n");
            for (MBiasVariable v : mBias.variables()) {
                sb.append("  - ").append(v.variable()).append(" (parents: ").append(String.join(", ", v.parents())).append(")\n");
                sb.append("    Paths through ").append(v.variable()).append(": ").append(String.join("; ", v.paths())).append('\n');
            }
        } else {
            sb.append(mBias.message()).append('\n');
        }
        sb.append('\n');

        ButterflyReport butterfly = report.butterfly();
        if (butterfly.detected()) {
            sb.append("Butterfly bias candidates (confounders with more than one confounder parent):\n");
            for (Map.Entry<String, List<String>> e : butterfly.butterflyParents().entrySet()) {
                sb.append("  - ").append(e.getKey()).append(" (parents: ").append(String.join(", ", e.getValue())).append(")\n");
            }
        } else {
            sb.append(butterfly.message()).append('\n');
        }
        sb.append("Safe confounders: ").append(orNone(butterfly.safeConfounders())).append("\n\n");
        sb.append("Minimal sufficient adjustment sets:\n").append(adjustmentSets(report.adjustment()));
        return sb.toString();
    }

    public static String statistics(GraphStatistics stats) {
        StringBuilder sb = new StringBuilder("Basic Statistics:\n");
        sb.append("- Total Nodes: ").append(stats.totalNodes()).append('\n');
        sb.append("- Total Edges: ").append(stats.totalEdges()).append('\n');
        sb.append("- Graph Density: ").append(String.format(Locale.ROOT, "%.4f", stats.density())).append('\n');
        sb.append("- Average Degree: ").append(String.format(Locale.ROOT, "%.2f", stats.averageDegree())).append('\n');
        sb.append("\nNode Distribution:\n");
        for (NodeRole role : NodeRole.values()) {
            sb.append("- ").append(role.label()).append(": ").append(stats.roleCounts().get(role))
                    .append(String.format(Locale.ROOT, " (%.2f%%)", stats.percentage(role))).append('\n');
        }
        return sb.toString();
    }

    private static void numbered(StringBuilder sb, CausalGraph graph, List<List<String>> cycles) {
        for (int i = 0; i < cycles.size(); i++) {
            sb.append("  ").append(i + 1).append(". ").append(cycle(graph, cycles.get(i))).append('\n');
        }
    }

    private static String braces(AdjustmentSet set) {
        return set.isEmpty() ? "{ } (empty set - no adjustment needed)" : "{ " + String.join(", ", set.variables()) + " }";
    }

    private static String labelled(CausalGraph graph, String id) {
        return id + " (" + graph.role(id).map(NodeRole::label).orElse("Unknown") + ")";
    }

    private static String orNone(List<String> values) {
        return values.isEmpty() ? "None" : String.join(", ", values);
    }
}
