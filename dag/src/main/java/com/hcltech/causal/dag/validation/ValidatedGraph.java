package com.hcltech.causal.dag.validation;

import com.hcltech.causal.dag.CausalGraph;

/** A repaired snapshot together with the report describing what was repaired and which cycles remain. */
public record ValidatedGraph(CausalGraph graph, ValidationReport report) {}
