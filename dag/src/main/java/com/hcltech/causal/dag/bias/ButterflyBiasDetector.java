package com.hcltech.causal.dag.bias;

import com.hcltech.causal.dag.AnalysisStatus;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.adjust.AdjustmentQuery;
import com.hcltech.causal.dag.adjust.AdjustmentResult;
import com.hcltech.causal.dag.adjust.AdjustmentSetSearch;
import com.hcltech.causal.dag.adjust.ConfounderSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags confounders with two or more confounder parents. The flagged node and its confounder parents form the
 * "butterfly": adjusting for the node alone opens the path between its parents, so those parents have to be
 * adjusted with it.
 */
public final class ButterflyBiasDetector {
    private static final Logger log = LoggerFactory.getLogger(ButterflyBiasDetector.class);

    private final AdjustmentSetSearch search;
    private final CausalGraph graph;

    public ButterflyBiasDetector(AdjustmentSetSearch search, CausalGraph graph) {
        this.search = search;
        this.graph = graph;
    }

    public ButterflyReport detect(AdjustmentQuery query, AdjustmentResult minimal) {
        if (!minimal.success()) return ButterflyReport.failure(minimal.status(), minimal.message());

        ConfounderSet confounders = search.confounders(query, minimal);
        List<String> flagged = new ArrayList<>();
        Map<String, List<String>> parents = new LinkedHashMap<>();
        for (String c : confounders.variables()) {
            List<String> confounderParents = graph.parents(c).stream().filter(confounders::contains).toList();
            if (confounderParents.size() >= 2) {
                flagged.add(c);
                parents.put(c, confounderParents);
            }
        }
        List<String> safe = confounders.variables().stream().filter(c -> !flagged.contains(c)).toList();
        if (confounders.truncated()) {
            log.warn("Confounder set for {} -> {} may be incomplete", query.exposures(), query.outcomes());
        }
        String message = flagged.isEmpty()
                ? "No butterfly bias detected"
                : "Found " + flagged.size() + " butterfly bias variable(s)";
        return new ButterflyReport(AnalysisStatus.OK, message, flagged, parents, safe, confounders.variables(),
                confounders.truncated());
    }
}
