package com.hcltech.causal.dag.bias;

import java.util.List;

/** A collider that must not be adjusted for, with its parents and the blocked backdoor paths it sits on. */
public record MBiasVariable(String variable, List<String> parents, List<String> paths) {
    public MBiasVariable {
        parents = List.copyOf(parents);
        paths = List.copyOf(paths);
    }
}
