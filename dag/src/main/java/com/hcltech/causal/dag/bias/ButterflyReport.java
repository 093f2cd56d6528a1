package com.hcltech.causal.dag.bias;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hcltech.causal.dag.AnalysisStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param butterflyVariables confounders with at least two confounder parents
 * @param butterflyParents   for each flagged confounder, its confounder parents; they are safe to adjust for
 *                           only together with the flagged node
 * @param safeConfounders    confounders that are not flagged
 * @param allConfounders     every variable that belongs to some valid adjustment set
 */
public record ButterflyReport(AnalysisStatus status,
                              String message,
                              List<String> butterflyVariables,
                              Map<String, List<String>> butterflyParents,
                              List<String> safeConfounders,
                              List<String> allConfounders,
                              boolean truncated) {

    public ButterflyReport {
        butterflyVariables = List.copyOf(butterflyVariables);
        butterflyParents = Collections.unmodifiableMap(new LinkedHashMap<>(butterflyParents));
        safeConfounders = List.copyOf(safeConfounders);
        allConfounders = List.copyOf(allConfounders);
    }

    public static ButterflyReport failure(AnalysisStatus status, String message) {
        return new ButterflyReport(status, message, List.of(), Map.of(), List.of(), List.of(), false);
    }

    @JsonProperty("success")
    public boolean success() {
        return !status.isFailure();
    }

    public boolean detected() {
        return !butterflyVariables.isEmpty();
    }

    public int count() {
        return butterflyVariables.size();
    }
}
