package com.hcltech.causal.dag.adjust;

import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/** What to search for. {@code cancelled} is polled during the search; return true to stop early. */
public record AdjustmentQuery(List<String> exposures, List<String> outcomes, EffectType effect,
                              SearchLimits limits, BooleanSupplier cancelled) {

    public AdjustmentQuery {
        exposures = exposures == null ? List.of() : List.copyOf(exposures);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        effect = effect == null ? EffectType.TOTAL : effect;
        limits = limits == null ? SearchLimits.DEFAULT : limits;
        cancelled = cancelled == null ? () -> false : cancelled;
    }

    public static AdjustmentQuery of(String exposure, String outcome) {
        Objects.requireNonNull(exposure, "exposure");
        Objects.requireNonNull(outcome, "outcome");
        return new AdjustmentQuery(List.of(exposure), List.of(outcome), EffectType.TOTAL, SearchLimits.DEFAULT, null);
    }

    public AdjustmentQuery withEffect(EffectType e) {
        return new AdjustmentQuery(exposures, outcomes, e, limits, cancelled);
    }

    public AdjustmentQuery withLimits(SearchLimits l) {
        return new AdjustmentQuery(exposures, outcomes, effect, l, cancelled);
    }

    public AdjustmentQuery withCancellation(BooleanSupplier c) {
        return new AdjustmentQuery(exposures, outcomes, effect, limits, c);
    }
}
