package com.exportscan.service;

import com.exportscan.config.AppMetrics;
import com.exportscan.model.DemandRecord;
import com.exportscan.model.MatchSummary;
import com.exportscan.model.MatchingConfiguration;
import com.exportscan.model.OutcomeKind;
import com.exportscan.model.RawBatch;
import com.exportscan.model.ReconciliationResult;
import com.exportscan.model.ReconciliationResult.TimingBreakdown;
import com.exportscan.model.SupplyRecord;
import com.exportscan.service.normalize.MissingColumnsException;
import com.exportscan.service.normalize.RecordNormalizer;
import com.exportscan.service.preload.SupplyIndex;
import com.exportscan.service.preload.SupplyIndexService;
import com.exportscan.service.processing.CascadeMatcher;
import com.exportscan.service.processing.CascadeMatcher.CascadeReport;
import com.exportscan.service.progress.LoggingProgressSink;
import com.exportscan.service.progress.ProgressSink;
import com.exportscan.service.progress.ProgressSinks;
import com.exportscan.service.summary.SummaryAggregator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Runs one reconciliation end to end:
 * 1. RecordNormalizer    - column validation and value normalization
 * 2. SupplyIndexService  - per-strategy supply totals
 * 3. CascadeMatcher      - strategy cascade per demand record
 * 4. SummaryAggregator   - label and strategy counts
 *
 * All-or-nothing: validation failures propagate as {@link MissingColumnsException},
 * anything else as {@link ReconciliationException}; no partial result is returned.
 */
@Service
@Slf4j
public class ReconciliationOrchestrator {

    private static final String RUN_ID = "runId";

    private final RecordNormalizer normalizer;
    private final SupplyIndexService indexService;
    private final CascadeMatcher matcher;
    private final SummaryAggregator summaryAggregator;
    private final AppMetrics metrics;

    public ReconciliationOrchestrator(
            RecordNormalizer normalizer,
            SupplyIndexService indexService,
            CascadeMatcher matcher,
            SummaryAggregator summaryAggregator,
            AppMetrics metrics) {
        this.normalizer = normalizer;
        this.indexService = indexService;
        this.matcher = matcher;
        this.summaryAggregator = summaryAggregator;
        this.metrics = metrics;
    }

    public ReconciliationResult reconcile(RawBatch source, RawBatch target, MatchingConfiguration configuration) {
        return reconcile(source, target, configuration, ProgressSinks.noOp());
    }

    /**
     * Reconcile the target (demand) batch against the source (supply) batch.
     *
     * @param source        supply rows
     * @param target        demand rows
     * @param configuration matching options
     * @param sink          progress observer, may be null
     * @return annotated demand records and summary
     */
    public ReconciliationResult reconcile(RawBatch source, RawBatch target, MatchingConfiguration configuration,
                                          ProgressSink sink) {
        String runId = UUID.randomUUID().toString();
        String previousRunId = MDC.get(RUN_ID);
        MDC.put(RUN_ID, runId);
        ProgressSink progress = ProgressSinks.composite(new LoggingProgressSink(), ProgressSinks.nullSafe(sink));

        try {
            return execute(runId, source, target, configuration, progress);
        } catch (MissingColumnsException e) {
            metrics.incrementFailedRuns();
            throw e;
        } catch (RuntimeException e) {
            metrics.incrementFailedRuns();
            log.error("Reconciliation run {} failed", runId, e);
            throw new ReconciliationException("Error during processing: " + e.getMessage(), e);
        } finally {
            if (previousRunId == null) {
                MDC.remove(RUN_ID);
            } else {
                MDC.put(RUN_ID, previousRunId);
            }
        }
    }

    private ReconciliationResult execute(String runId, RawBatch source, RawBatch target,
                                         MatchingConfiguration configuration, ProgressSink progress) {
        long startTime = System.currentTimeMillis();

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("RUN START: source '{}' ({} rows) | target '{}' ({} rows) | buyer-specific: {}",
                source.name(), source.size(), target.name(), target.size(),
                configuration.buyerSpecific() ? "ENABLED" : "DISABLED");
        log.info("═══════════════════════════════════════════════════════════════");

        // STAGE 1: Normalize
        long normalizeStart = System.currentTimeMillis();
        normalizer.validate(source, target);
        List<SupplyRecord> supply = normalizer.normalizeSupply(source);
        List<DemandRecord> demand = normalizer.normalizeDemand(target);
        boolean buyerFieldPresent = normalizer.hasBuyerField(target);
        long normalizeTime = System.currentTimeMillis() - normalizeStart;
        metrics.recordNormalizeTime(normalizeTime);

        // STAGE 2: Index supply
        long indexStart = System.currentTimeMillis();
        SupplyIndex index = indexService.buildIndex(supply,
                CascadeMatcher.requiredStrategies(configuration.buyerSpecific() && buyerFieldPresent),
                configuration.combinePoIn());
        long indexTime = System.currentTimeMillis() - indexStart;

        // STAGE 3: Cascade
        long matchStart = System.currentTimeMillis();
        CascadeReport report = matcher.match(demand, index, configuration, buyerFieldPresent, progress);
        long matchTime = System.currentTimeMillis() - matchStart;
        metrics.recordMatchTime(matchTime);

        // STAGE 4: Summary
        MatchSummary summary = summaryAggregator.summarize(demand);
        long totalTime = System.currentTimeMillis() - startTime;
        metrics.recordTotalTime(totalTime);
        metrics.recordRun(summary);

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("RUN COMPLETE | Total: {}ms", totalTime);
        log.info("  Normalize: {}ms | Index: {}ms | Match: {}ms", normalizeTime, indexTime, matchTime);
        log.info("  Ok: {} | Mismatch: {} | No shipment: {} | No match: {} | Total: {}",
                summary.perfectMatches(), summary.quantityMismatches(),
                summary.count(OutcomeKind.NO_SHIPMENT), summary.noMatches(),
                summary.totalRecords());
        log.info("═══════════════════════════════════════════════════════════════");

        return new ReconciliationResult(
                runId,
                List.copyOf(demand),
                summary,
                report.warnings(),
                report.buyerSpecificApplied(),
                new TimingBreakdown(normalizeTime, indexTime, matchTime, totalTime)
        );
    }
}
