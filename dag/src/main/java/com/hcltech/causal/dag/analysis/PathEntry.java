package com.hcltech.causal.dag.analysis;

import com.hcltech.causal.dag.paths.PathKind;

import java.util.List;

/**
 * @param openAfterAdjustment whether the path stays open once the first minimal adjustment set is conditioned
 *                            on; equal to {@code open} when no set was found
 */
public record PathEntry(int id, String from, String to, List<String> variables, int length, String description,
                        PathKind kind, boolean open, boolean openAfterAdjustment) {
    public PathEntry {
        variables = List.copyOf(variables);
    }
}
