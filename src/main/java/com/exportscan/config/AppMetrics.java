package com.exportscan.config;

import com.exportscan.model.MatchSummary;
import com.exportscan.model.OutcomeKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Reconciliation metrics.
 *
 * Key metrics (see /actuator/metrics):
 * - reconcile.runs           → completed runs
 * - reconcile.runs.failed    → runs aborted by validation or unexpected errors
 * - reconcile.records        → demand records classified
 * - reconcile.outcome        → records per label (tag "label")
 * - reconcile.*.time         → stage timings
 */
@Component
@Getter
public class AppMetrics {

    private final Timer normalizeTimer;
    private final Timer indexTimer;
    private final Timer matchTimer;
    private final Timer totalTimer;

    private final Counter runsCounter;
    private final Counter failedRunsCounter;
    private final Counter recordsCounter;
    private final Map<OutcomeKind, Counter> outcomeCounters = new EnumMap<>(OutcomeKind.class);

    public AppMetrics(MeterRegistry registry) {
        this.normalizeTimer = Timer.builder("reconcile.normalize.time")
                .description("Column validation and record normalization")
                .register(registry);

        this.indexTimer = Timer.builder("reconcile.index.time")
                .description("Supply key aggregation")
                .register(registry);

        this.matchTimer = Timer.builder("reconcile.match.time")
                .description("Cascade matching over all demand records")
                .register(registry);

        this.totalTimer = Timer.builder("reconcile.total.time")
                .description("End-to-end reconciliation run")
                .register(registry);

        this.runsCounter = Counter.builder("reconcile.runs")
                .description("Completed reconciliation runs")
                .register(registry);

        this.failedRunsCounter = Counter.builder("reconcile.runs.failed")
                .description("Failed reconciliation runs")
                .register(registry);

        this.recordsCounter = Counter.builder("reconcile.records")
                .description("Demand records classified")
                .register(registry);

        for (OutcomeKind kind : OutcomeKind.values()) {
            if (kind.isTerminal()) {
                outcomeCounters.put(kind, Counter.builder("reconcile.outcome")
                        .description("Demand records per outcome label")
                        .tag("label", kind.name())
                        .register(registry));
            }
        }
    }

    public void recordNormalizeTime(long millis) {
        normalizeTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordIndexTime(long millis) {
        indexTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordMatchTime(long millis) {
        matchTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordTotalTime(long millis) {
        totalTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordRun(MatchSummary summary) {
        runsCounter.increment();
        recordsCounter.increment(summary.totalRecords());
        outcomeCounters.forEach((kind, counter) -> counter.increment(summary.count(kind)));
    }

    public void incrementFailedRuns() {
        failedRunsCounter.increment();
    }
}
