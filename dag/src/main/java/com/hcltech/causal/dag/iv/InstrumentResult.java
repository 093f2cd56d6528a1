package com.hcltech.causal.dag.iv;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hcltech.causal.dag.AnalysisStatus;

import java.util.List;

public record InstrumentResult(AnalysisStatus status, String message, List<String> instruments) {
    public InstrumentResult {
        instruments = List.copyOf(instruments);
    }

    @JsonProperty("success")
    public boolean success() {
        return !status.isFailure();
    }

    @JsonProperty("count")
    public int count() {
        return instruments.size();
    }
}
