package com.hcltech.causal.config;

import com.hcltech.causal.dag.adjust.EffectType;
import com.hcltech.causal.dag.adjust.SearchLimits;
import com.hcltech.causal.dag.analysis.AnalysisRequest;

import java.time.Duration;

/**
 * Analysis limits as written in a config file. Absent values take the defaults; range checks are left to
 * {@link com.hcltech.causal.config.loader.AnalysisConfigLoader} so that every problem is reported at once.
 *
 * @param pathLimit         paths enumerated per exposure/outcome pair while searching for adjustment sets
 * @param reportedPathLimit paths listed per pair in the report
 */
public record AnalysisConfig(Integer maxResults,
                             Integer pathLimit,
                             Integer reportedPathLimit,
                             Integer maxSetSize,
                             Long timeoutMillis,
                             EffectType effect) {

    public static final AnalysisConfig DEFAULT = new AnalysisConfig(null, null, null, null, null, null);

    public AnalysisConfig {
        SearchLimits d = SearchLimits.DEFAULT;
        if (maxResults == null) maxResults = d.maxResults();
        if (pathLimit == null) pathLimit = d.pathLimit();
        if (reportedPathLimit == null) reportedPathLimit = AnalysisRequest.DEFAULT_REPORTED_PATH_LIMIT;
        if (maxSetSize == null) maxSetSize = d.maxSetSize();
        if (timeoutMillis == null) timeoutMillis = d.timeout().toMillis();
        if (effect == null) effect = EffectType.TOTAL;
    }

    /** Throws IllegalArgumentException for out-of-range values; loaders validate first. */
    public SearchLimits toSearchLimits() {
        return new SearchLimits(maxResults, pathLimit, maxSetSize, Duration.ofMillis(timeoutMillis));
    }

    /** A request that uses the roles declared in the graph. */
    public AnalysisRequest toRequest() {
        return AnalysisRequest.declared()
                .withEffect(effect)
                .withLimits(toSearchLimits())
                .withReportedPathLimit(reportedPathLimit);
    }
}
