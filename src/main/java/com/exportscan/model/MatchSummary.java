package com.exportscan.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-label and per-strategy tallies of one reconciliation run.
 */
public record MatchSummary(
    Map<OutcomeKind, Long> labelCounts,
    Map<MatchStrategy, Long> strategyCounts,
    long totalRecords
) {

    public MatchSummary {
        Map<OutcomeKind, Long> labels = new EnumMap<>(OutcomeKind.class);
        labels.putAll(labelCounts);
        Map<MatchStrategy, Long> strategies = new EnumMap<>(MatchStrategy.class);
        strategies.putAll(strategyCounts);
        labelCounts = Collections.unmodifiableMap(labels);
        strategyCounts = Collections.unmodifiableMap(strategies);
    }

    public long count(OutcomeKind kind) {
        return labelCounts.getOrDefault(kind, 0L);
    }

    public long count(MatchStrategy strategy) {
        return strategyCounts.getOrDefault(strategy, 0L);
    }

    public long perfectMatches() {
        return count(OutcomeKind.OK);
    }

    public long quantityMismatches() {
        return count(OutcomeKind.OVER_SHIPMENT) + count(OutcomeKind.LESS_SHIPMENT);
    }

    public long noMatches() {
        return count(OutcomeKind.NO_MATCH_FOUND) + count(OutcomeKind.NO_MATCH_BUYER);
    }

    /**
     * Text block shown after a run.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("\n=== Matching Summary ===\n");
        sb.append("Perfect Matches: ").append(perfectMatches()).append('\n');
        sb.append("Less Shipment Cases: ").append(count(OutcomeKind.LESS_SHIPMENT)).append('\n');
        sb.append("Over Shipment Cases: ").append(count(OutcomeKind.OVER_SHIPMENT)).append('\n');
        sb.append("No Shipment Cases: ").append(count(OutcomeKind.NO_SHIPMENT)).append('\n');
        sb.append("No Matches Found: ").append(count(OutcomeKind.NO_MATCH_FOUND)).append('\n');
        if (count(OutcomeKind.NO_MATCH_BUYER) > 0) {
            sb.append("No Matches (Buyer): ").append(count(OutcomeKind.NO_MATCH_BUYER)).append('\n');
        }
        for (Map.Entry<MatchStrategy, Long> entry : strategyCounts.entrySet()) {
            if (entry.getValue() > 0) {
                sb.append("Resolved by ").append(entry.getKey().strategyName()).append(": ")
                        .append(entry.getValue()).append('\n');
            }
        }
        sb.append("Total Records Processed: ").append(totalRecords).append('\n');
        return sb.toString();
    }
}
