package com.hcltech.causal.dag.analysis;

import java.util.List;

public record PathReport(List<PathEntry> paths, List<String> adjustedFor, int openCount, int blockedCount,
                         boolean truncated, int warnings) {
    public PathReport {
        paths = List.copyOf(paths);
        adjustedFor = List.copyOf(adjustedFor);
    }

    public static PathReport empty() {
        return new PathReport(List.of(), List.of(), 0, 0, false, 0);
    }

    public int total() {
        return paths.size();
    }
}
