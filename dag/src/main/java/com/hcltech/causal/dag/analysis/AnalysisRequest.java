package com.hcltech.causal.dag.analysis;

import com.hcltech.causal.dag.adjust.EffectType;
import com.hcltech.causal.dag.adjust.SearchLimits;

import java.util.List;

/**
 * One analysis query. Empty exposure or outcome lists mean "use the roles declared in the graph".
 *
 * @param reportedPathLimit paths listed per exposure/outcome pair in the report; independent of the limit
 *                          used while searching for adjustment sets
 */
public record AnalysisRequest(List<String> exposures, List<String> outcomes, EffectType effect,
                              SearchLimits limits, int reportedPathLimit) {

    public static final int DEFAULT_REPORTED_PATH_LIMIT = 10;

    public AnalysisRequest {
        exposures = exposures == null ? List.of() : List.copyOf(exposures);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        effect = effect == null ? EffectType.TOTAL : effect;
        limits = limits == null ? SearchLimits.DEFAULT : limits;
        if (reportedPathLimit < 1) {
            throw new IllegalArgumentException("reportedPathLimit must be positive but was " + reportedPathLimit);
        }
    }

    /** Uses the graph's own roles, the total effect and default limits. */
    public static AnalysisRequest declared() {
        return new AnalysisRequest(List.of(), List.of(), EffectType.TOTAL, SearchLimits.DEFAULT, DEFAULT_REPORTED_PATH_LIMIT);
    }

    public static AnalysisRequest of(String exposure, String outcome) {
        return new AnalysisRequest(List.of(exposure), List.of(outcome), EffectType.TOTAL, SearchLimits.DEFAULT,
                DEFAULT_REPORTED_PATH_LIMIT);
    }

    public AnalysisRequest withEffect(EffectType e) {
        return new AnalysisRequest(exposures, outcomes, e, limits, reportedPathLimit);
    }

    public AnalysisRequest withLimits(SearchLimits l) {
        return new AnalysisRequest(exposures, outcomes, effect, l, reportedPathLimit);
    }

    public AnalysisRequest withReportedPathLimit(int n) {
        return new AnalysisRequest(exposures, outcomes, effect, limits, n);
    }
}
