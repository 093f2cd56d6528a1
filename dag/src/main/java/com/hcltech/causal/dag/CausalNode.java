package com.hcltech.causal.dag;

import java.util.Objects;

/** A variable of the graph. A missing role means covariate. */
public record CausalNode(String id, NodeRole role) {
    public CausalNode {
        Objects.requireNonNull(id, "node id");
        if (id.isBlank()) throw new IllegalArgumentException("Node id must not be blank");
        role = role == null ? NodeRole.COVARIATE : role;
    }

    public static CausalNode exposure(String id) { return new CausalNode(id, NodeRole.EXPOSURE); }

    public static CausalNode outcome(String id) { return new CausalNode(id, NodeRole.OUTCOME); }

    public static CausalNode covariate(String id) { return new CausalNode(id, NodeRole.COVARIATE); }
}
