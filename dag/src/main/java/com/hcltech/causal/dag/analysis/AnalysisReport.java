package com.hcltech.causal.dag.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hcltech.causal.dag.AnalysisStatus;
import com.hcltech.causal.dag.adjust.AdjustmentResult;
import com.hcltech.causal.dag.adjust.EffectType;
import com.hcltech.causal.dag.bias.ButterflyReport;
import com.hcltech.causal.dag.bias.MBiasReport;
import com.hcltech.causal.dag.iv.InstrumentResult;
import com.hcltech.causal.dag.validation.ValidationReport;

/**
 * Everything one query produces. Sections that could not run carry the same failure status as the report
 * rather than being null.
 */
public record AnalysisReport(AnalysisStatus status,
                             String message,
                             EffectType effect,
                             VariableListing variables,
                             ValidationReport validation,
                             AdjustmentResult adjustment,
                             InstrumentResult instruments,
                             PathReport paths,
                             MBiasReport mBias,
                             ButterflyReport butterfly,
                             AnalysisSummary summary) {

    @JsonProperty("success")
    public boolean success() {
        return !status.isFailure();
    }
}
