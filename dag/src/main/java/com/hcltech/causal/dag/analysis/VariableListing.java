package com.hcltech.causal.dag.analysis;

import com.hcltech.causal.dag.CausalGraph;

import java.util.ArrayList;
import java.util.List;

/** Variables by the role they play in this query, each list in graph order. */
public record VariableListing(List<String> exposures, List<String> outcomes, List<String> covariates, int total) {
    public VariableListing {
        exposures = List.copyOf(exposures);
        outcomes = List.copyOf(outcomes);
        covariates = List.copyOf(covariates);
    }

    public static VariableListing empty() {
        return new VariableListing(List.of(), List.of(), List.of(), 0);
    }

    static VariableListing of(CausalGraph graph, List<String> exposures, List<String> outcomes) {
        List<String> covariates = new ArrayList<>();
        for (String id : graph.ids()) {
            if (!exposures.contains(id) && !outcomes.contains(id)) covariates.add(id);
        }
        return new VariableListing(exposures, outcomes, covariates, graph.size());
    }
}
