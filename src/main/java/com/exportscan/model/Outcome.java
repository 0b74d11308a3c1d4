package com.exportscan.model;

import java.math.BigDecimal;

/**
 * Classification assigned to a demand record.
 *
 * @param kind      the label
 * @param strategy  strategy that found supply; null for unmatched and not-checked outcomes
 * @param available aggregated available quantity, only for quantity mismatches
 * @param requested requested quantity, only for quantity mismatches
 */
public record Outcome(
    OutcomeKind kind,
    MatchStrategy strategy,
    BigDecimal available,
    BigDecimal requested
) {

    private static final Outcome NOT_CHECKED = new Outcome(OutcomeKind.NOT_CHECKED, null, null, null);

    public static Outcome notChecked() {
        return NOT_CHECKED;
    }

    public static Outcome matched(OutcomeKind kind, MatchStrategy strategy) {
        return new Outcome(kind, strategy, null, null);
    }

    public static Outcome mismatch(OutcomeKind kind, MatchStrategy strategy, BigDecimal available, BigDecimal requested) {
        return new Outcome(kind, strategy, available, requested);
    }

    public static Outcome unmatched(OutcomeKind kind) {
        return new Outcome(kind, null, null, null);
    }

    /**
     * Human-readable status, e.g. {@code Over Shipment (PO Match: 120 vs 150)}.
     */
    public String status() {
        if (strategy == null) {
            return kind.label();
        }
        if (kind.isQuantityMismatch()) {
            return kind.label() + " (" + strategy.mismatchTag() + ": "
                    + render(available) + " vs " + render(requested) + ")";
        }
        return kind.label() + " (" + strategy.displayName() + " Match)";
    }

    private static String render(BigDecimal value) {
        if (value == null) {
            return "0";
        }
        return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
    }
}
