package com.hcltech.causal.dag.bias;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hcltech.causal.dag.AnalysisStatus;

import java.util.List;

/** {@code truncated} is set when backdoor paths were cut at the enumeration limit, so more variables may qualify. */
public record MBiasReport(AnalysisStatus status, String message, List<MBiasVariable> variables, boolean truncated) {
    public MBiasReport {
        variables = List.copyOf(variables);
    }

    public static MBiasReport failure(AnalysisStatus status, String message) {
        return new MBiasReport(status, message, List.of(), false);
    }

    @JsonProperty("success")
    public boolean success() {
        return !status.isFailure();
    }

    public boolean detected() {
        return !variables.isEmpty();
    }

    public int count() {
        return variables.size();
    }

    public List<String> names() {
        return variables.stream().map(MBiasVariable::variable).toList();
    }
}
