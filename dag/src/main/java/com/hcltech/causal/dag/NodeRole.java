package com.hcltech.causal.dag;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Role of a variable in the causal question being asked of the graph. */
public enum NodeRole {
    EXPOSURE("Exposure"),
    OUTCOME("Outcome"),
    COVARIATE("Covariate");

    private final String label;

    NodeRole(String label) {
        this.label = label;
    }

    /** Capitalised name used in human-readable reports. */
    public String label() {
        return label;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive; null or blank means covariate. */
    @JsonCreator
    public static NodeRole fromString(String value) {
        if (value == null || value.isBlank()) return COVARIATE;
        for (NodeRole r : values()) {
            if (r.name().equalsIgnoreCase(value.trim())) return r;
        }
        throw new IllegalArgumentException("Unknown node role '" + value + "' (expected exposure, outcome or covariate)");
    }
}
