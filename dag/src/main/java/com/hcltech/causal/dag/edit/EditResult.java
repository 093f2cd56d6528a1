package com.hcltech.causal.dag.edit;

import com.hcltech.causal.dag.validation.ValidationReport;

/** What an edit did and the validation report of the snapshot it installed. */
public record EditResult(String action, String target, String message, int edgesRemoved, long version,
                         ValidationReport validation) {}
