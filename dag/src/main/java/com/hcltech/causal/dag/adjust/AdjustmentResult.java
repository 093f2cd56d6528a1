package com.hcltech.causal.dag.adjust;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hcltech.causal.dag.AnalysisStatus;

import java.util.List;

/**
 * Tagged result of an adjustment-set search.
 *
 * @param relevantPaths  number of paths every accepted set had to block
 * @param exactFallback  true when path enumeration hit its limit and sets were checked with the
 *                       reachability test instead
 * @param subsetsTested  candidate subsets evaluated
 */
public record AdjustmentResult(AnalysisStatus status,
                               String message,
                               List<String> exposures,
                               List<String> outcomes,
                               EffectType effect,
                               List<AdjustmentSet> sets,
                               boolean truncated,
                               StopReason stopReason,
                               int relevantPaths,
                               boolean exactFallback,
                               long subsetsTested) {

    public AdjustmentResult {
        exposures = List.copyOf(exposures);
        outcomes = List.copyOf(outcomes);
        sets = List.copyOf(sets);
    }

    public static AdjustmentResult failure(AnalysisStatus status, String message, List<String> exposures,
                                           List<String> outcomes, EffectType effect) {
        return new AdjustmentResult(status, message, exposures, outcomes, effect, List.of(), false,
                StopReason.EXHAUSTED, 0, false, 0);
    }

    @JsonProperty("success")
    public boolean success() {
        return !status.isFailure();
    }

    public int totalSets() {
        return sets.size();
    }

    /** Every variable that appears in at least one returned set. */
    public List<String> variablesInAnySet() {
        return sets.stream().flatMap(s -> s.variables().stream()).distinct().toList();
    }
}
