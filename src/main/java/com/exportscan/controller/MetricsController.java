package com.exportscan.controller;

import com.exportscan.config.AppMetrics;
import com.exportscan.service.cache.RecentRunsService;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * GET /api/metrics/summary - run counters, outcome counts and stage timings in one response.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final AppMetrics appMetrics;
    private final RecentRunsService recentRuns;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("timestamp", Instant.now().toString());
        response.put("runs", getRunMetrics());
        response.put("outcomes", getOutcomeMetrics());
        response.put("timing", getTimingMetrics());

        return response;
    }

    @GetMapping("/runs")
    public Map<String, Object> getRunMetrics() {
        Map<String, Object> runs = new LinkedHashMap<>();

        double completed = appMetrics.getRunsCounter().count();
        double failed = appMetrics.getFailedRunsCounter().count();

        runs.put("completed", (long) completed);
        runs.put("failed", (long) failed);
        runs.put("records", (long) appMetrics.getRecordsCounter().count());
        runs.put("retained", recentRuns.size());

        double attempted = completed + failed;
        if (attempted > 0) {
            runs.put("successRate", String.format("%.2f%%", (completed / attempted) * 100));
        } else {
            runs.put("successRate", "N/A");
        }

        return runs;
    }

    @GetMapping("/outcomes")
    public Map<String, Object> getOutcomeMetrics() {
        Map<String, Object> outcomes = new LinkedHashMap<>();
        appMetrics.getOutcomeCounters().forEach((kind, counter) ->
                outcomes.put(kind.label(), (long) counter.count()));
        return outcomes;
    }

    @GetMapping("/timing")
    public Map<String, Object> getTimingMetrics() {
        Map<String, Object> timing = new LinkedHashMap<>();

        timing.put("normalize", getTimerStats(appMetrics.getNormalizeTimer()));
        timing.put("index", getTimerStats(appMetrics.getIndexTimer()));
        timing.put("match", getTimerStats(appMetrics.getMatchTimer()));
        timing.put("total", getTimerStats(appMetrics.getTotalTimer()));

        return timing;
    }

    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();

        long count = timer.count();
        stats.put("count", count);

        if (count > 0) {
            stats.put("totalTimeMs", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avgTimeMs", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("maxTimeMs", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("totalTimeMs", "0.00");
            stats.put("avgTimeMs", "N/A");
            stats.put("maxTimeMs", "N/A");
        }

        return stats;
    }
}
