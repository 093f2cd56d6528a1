package com.hcltech.causal.dag.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Repair and cycle report produced after every construction or edit. {@code valid} is false exactly when
 * cycles remain; repairs of orphaned or duplicated edges do not make a graph invalid.
 */
public record ValidationReport(boolean valid,
                               @JsonProperty("fixes_applied") int fixesApplied,
                               @JsonProperty("orphaned_count") int orphanedCount,
                               @JsonProperty("duplicate_count") int duplicateCount,
                               List<String> messages,
                               List<List<String>> cycles,
                               @JsonProperty("critical_cycles") List<List<String>> criticalCycles) {

    public ValidationReport {
        messages = List.copyOf(messages);
        cycles = cycles.stream().map(List::copyOf).toList();
        criticalCycles = criticalCycles.stream().map(List::copyOf).toList();
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    /** "valid", "invalid" (cycles) or "critical" (a cycle joins an exposure and an outcome). */
    @JsonProperty("status")
    public String status() {
        if (!hasCycles()) return "valid";
        return criticalCycles.isEmpty() ? "invalid" : "critical";
    }

    @JsonProperty("message")
    public String message() {
        return messages.isEmpty() ? "Network integrity validated" : String.join("; ", messages);
    }
}
