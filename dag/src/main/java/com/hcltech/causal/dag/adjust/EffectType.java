package com.hcltech.causal.dag.adjust;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EffectType {
    /** Effect through every causal path: mediators must not be adjusted for. */
    TOTAL,
    /** Effect along the direct edge only: mediators are candidates for adjustment. */
    DIRECT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EffectType parse(String value) {
        if (value == null || value.isBlank()) return TOTAL;
        for (EffectType e : values()) {
            if (e.name().equalsIgnoreCase(value.trim())) return e;
        }
        throw new IllegalArgumentException("Unknown effect type '" + value + "' (expected total or direct)");
    }
}
