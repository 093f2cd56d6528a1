package com.hcltech.causal.dag.adjust;

import java.util.List;

/** Variables that belong to at least one valid adjustment set, in graph order. */
public record ConfounderSet(List<String> variables, boolean truncated) {
    public ConfounderSet {
        variables = List.copyOf(variables);
    }

    public static ConfounderSet none() {
        return new ConfounderSet(List.of(), false);
    }

    public boolean contains(String id) {
        return variables.contains(id);
    }
}
