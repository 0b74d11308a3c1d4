package com.exportscan.model;

import java.util.List;

/**
 * Fully annotated demand batch plus summary and stage timings of one run.
 */
public record ReconciliationResult(
    String runId,
    List<DemandRecord> demandRecords,
    MatchSummary summary,
    List<String> warnings,
    boolean buyerSpecificApplied,
    TimingBreakdown timing
) {

    /**
     * Milliseconds spent per stage.
     */
    public record TimingBreakdown(
        long normalizeMs,
        long indexMs,
        long matchMs,
        long totalMs
    ) {}
}
