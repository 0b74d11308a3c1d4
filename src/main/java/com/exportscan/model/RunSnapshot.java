package com.exportscan.model;

import java.time.Instant;
import java.util.List;

/**
 * Retained view of a finished run, kept for the recent-runs listing.
 */
public record RunSnapshot(
    String runId,
    Instant completedAt,
    String sourceName,
    String targetName,
    MatchingConfiguration configuration,
    MatchSummary summary,
    List<String> warnings
) {

    public static RunSnapshot of(ReconciliationResult result, String sourceName, String targetName,
                                 MatchingConfiguration configuration) {
        return new RunSnapshot(result.runId(), Instant.now(), sourceName, targetName,
                configuration, result.summary(), result.warnings());
    }
}
