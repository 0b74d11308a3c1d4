package com.exportscan.service.summary;

import com.exportscan.model.DemandRecord;
import com.exportscan.model.MatchStrategy;
import com.exportscan.model.MatchSummary;
import com.exportscan.model.Outcome;
import com.exportscan.model.OutcomeKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tallies outcome labels and resolving strategies over a fully matched demand batch.
 */
@Component
public class SummaryAggregator {

    /**
     * @throws IllegalStateException if any record is still NOT_CHECKED
     */
    public MatchSummary summarize(List<DemandRecord> demand) {
        Map<OutcomeKind, Long> labelCounts = new EnumMap<>(OutcomeKind.class);
        for (OutcomeKind kind : OutcomeKind.values()) {
            if (kind.isTerminal()) {
                labelCounts.put(kind, 0L);
            }
        }
        Map<MatchStrategy, Long> strategyCounts = new EnumMap<>(MatchStrategy.class);

        for (DemandRecord record : demand) {
            Outcome outcome = record.getOutcome();
            if (!outcome.kind().isTerminal()) {
                throw new IllegalStateException("Row " + record.getRowIndex() + " was never resolved");
            }
            labelCounts.merge(outcome.kind(), 1L, Long::sum);
            if (outcome.strategy() != null) {
                strategyCounts.merge(outcome.strategy(), 1L, Long::sum);
            }
        }
        return new MatchSummary(labelCounts, strategyCounts, demand.size());
    }
}
