package com.hcltech.causal.dag.paths;

import java.util.List;

/**
 * Paths found between two nodes. {@code truncated} means the list may be incomplete: either one more path
 * exists beyond the limit, or the walk was stopped or ran out of steps first;
 * {@code warnings} counts unresolvable node references that were skipped.
 */
public record PathEnumeration(List<CausalPath> paths, boolean truncated, int warnings) {
    public PathEnumeration {
        paths = List.copyOf(paths);
    }

    public static PathEnumeration empty(int warnings) {
        return new PathEnumeration(List.of(), false, warnings);
    }

    public List<CausalPath> ofKind(PathKind kind) {
        return paths.stream().filter(p -> p.kind() == kind).toList();
    }
}
