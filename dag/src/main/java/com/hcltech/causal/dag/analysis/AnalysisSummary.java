package com.hcltech.causal.dag.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AnalysisSummary(@JsonProperty("total_variables") int totalVariables,
                              @JsonProperty("has_exposures") boolean hasExposures,
                              @JsonProperty("has_outcomes") boolean hasOutcomes,
                              @JsonProperty("has_cycles") boolean hasCycles,
                              @JsonProperty("analysis_possible") boolean analysisPossible) {

    static AnalysisSummary of(int totalVariables, boolean hasExposures, boolean hasOutcomes, boolean hasCycles) {
        return new AnalysisSummary(totalVariables, hasExposures, hasOutcomes, hasCycles,
                hasExposures && hasOutcomes && !hasCycles);
    }
}
