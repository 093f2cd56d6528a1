package com.hcltech.causal.dag.adjust;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record AdjustmentSet(int id, List<String> variables, int size, String description) {
    public AdjustmentSet {
        variables = List.copyOf(variables);
    }

    public static AdjustmentSet of(int id, List<String> variables) {
        String description = variables.isEmpty() ? "no adjustment needed" : String.join(", ", variables);
        return new AdjustmentSet(id, variables, variables.size(), description);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return variables.isEmpty();
    }
}
