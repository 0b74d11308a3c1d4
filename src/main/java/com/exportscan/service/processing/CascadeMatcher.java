package com.exportscan.service.processing;

import com.exportscan.model.DemandRecord;
import com.exportscan.model.MatchStrategy;
import com.exportscan.model.MatchingConfiguration;
import com.exportscan.model.Outcome;
import com.exportscan.model.OutcomeKind;
import com.exportscan.service.preload.MatchKeys;
import com.exportscan.service.preload.SupplyIndex;
import com.exportscan.service.progress.ProgressSink;
import com.exportscan.service.progress.ProgressSinks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Walks every demand record through its ordered strategy cascade.
 *
 * Standard cascade: PO-only → Job+PO → Style+Color, leftovers become NO_MATCH_FOUND.
 * Buyer cascade (flagged buyers only, buyer-specific mode): PO+Job → Combined,
 * leftovers become NO_MATCH_BUYER.
 *
 * Every pass iterates the full record list and skips resolved or out-of-cascade records.
 * A record is resolved at most once; {@link DemandRecord#resolve} rejects a second write.
 */
@Service
@Slf4j
public class CascadeMatcher {

    public static final List<MatchStrategy> STANDARD_STRATEGIES =
            List.of(MatchStrategy.PO_ONLY, MatchStrategy.JOB_PO, MatchStrategy.STYLE_COLOR);
    public static final List<MatchStrategy> BUYER_STRATEGIES =
            List.of(MatchStrategy.PO_JOB, MatchStrategy.COMBINED);

    private final QuantityClassifier classifier;
    private final ExecutorService executor;
    private final int parallelism;
    private final int progressInterval;

    public CascadeMatcher(
            QuantityClassifier classifier,
            @Qualifier("matchingExecutor") ExecutorService executor,
            @Value("${app.matching.parallelism:1}") int parallelism,
            @Value("${app.matching.progress-interval:500}") int progressInterval) {
        this.classifier = classifier;
        this.executor = executor;
        this.parallelism = executor == null ? 1 : Math.max(1, parallelism);
        this.progressInterval = Math.max(1, progressInterval);
        log.info("CascadeMatcher initialized with parallelism={}, progressInterval={}",
                this.parallelism, this.progressInterval);
    }

    /**
     * Strategies whose supply index the run needs.
     */
    public static Set<MatchStrategy> requiredStrategies(boolean buyerSpecific) {
        Set<MatchStrategy> strategies = EnumSet.copyOf(STANDARD_STRATEGIES);
        if (buyerSpecific) {
            strategies.addAll(BUYER_STRATEGIES);
        }
        return strategies;
    }

    /**
     * Resolve every demand record.
     *
     * @param demand             normalized demand records, all NOT_CHECKED
     * @param index              supply index covering {@link #requiredStrategies(boolean)}
     * @param configuration      run options
     * @param buyerFieldPresent  whether the demand batch has a buyer column
     * @param sink               progress observer, may be null
     * @return report of the applied mode and any warnings
     */
    public CascadeReport match(List<DemandRecord> demand, SupplyIndex index, MatchingConfiguration configuration,
                               boolean buyerFieldPresent, ProgressSink sink) {
        ProgressSink progress = ProgressSinks.nullSafe(sink);
        List<String> warnings = new ArrayList<>();

        boolean buyerMode = configuration.buyerSpecific();
        if (buyerMode && !buyerFieldPresent) {
            String warning = "Buyer-specific matching requested but the target batch has no buyer column; "
                    + "using standard matching for all records";
            log.warn(warning);
            progress.note(warning);
            warnings.add(warning);
            buyerMode = false;
        }

        Predicate<DemandRecord> flagged = buyerMode
                ? record -> configuration.isFlagged(record.getBuyer())
                : record -> false;

        List<Cascade> cascades = new ArrayList<>();
        cascades.add(new Cascade("standard", STANDARD_STRATEGIES, flagged.negate(), OutcomeKind.NO_MATCH_FOUND));
        if (buyerMode) {
            cascades.add(new Cascade("buyer", BUYER_STRATEGIES, flagged, OutcomeKind.NO_MATCH_BUYER));
        }

        int passNumber = 0;
        for (Cascade cascade : cascades) {
            for (MatchStrategy strategy : cascade.strategies()) {
                passNumber++;
                String description = describe(passNumber, cascade, strategy, configuration);
                progress.passStarted(description);
                int resolved = runPass(description, cascade, strategy, demand, index, configuration, progress);
                log.info("Pass {} ({} / {}): resolved {} records", passNumber, cascade.name(),
                        strategy.strategyName(), resolved);
            }
        }

        int unmatched = 0;
        for (DemandRecord record : demand) {
            if (record.isResolved()) {
                continue;
            }
            OutcomeKind fallback = buyerMode && flagged.test(record)
                    ? OutcomeKind.NO_MATCH_BUYER
                    : OutcomeKind.NO_MATCH_FOUND;
            record.resolve(Outcome.unmatched(fallback));
            unmatched++;
        }
        log.info("Final sweep: {} of {} records without supply", unmatched, demand.size());

        return new CascadeReport(buyerMode, List.copyOf(warnings));
    }

    private int runPass(String description, Cascade cascade, MatchStrategy strategy, List<DemandRecord> demand,
                        SupplyIndex index, MatchingConfiguration configuration, ProgressSink progress) {
        AtomicInteger processed = new AtomicInteger();
        AtomicInteger resolved = new AtomicInteger();
        int total = demand.size();

        if (parallelism <= 1 || total < parallelism * 2) {
            for (DemandRecord record : demand) {
                if (evaluate(record, cascade, strategy, index, configuration)) {
                    resolved.incrementAndGet();
                }
                reportProgress(description, processed.incrementAndGet(), total, progress);
            }
            return resolved.get();
        }

        // each record lives in exactly one chunk, so outcome writes never contend
        int chunkSize = (total + parallelism - 1) / parallelism;
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int start = 0; start < total; start += chunkSize) {
            List<DemandRecord> chunk = demand.subList(start, Math.min(start + chunkSize, total));
            futures.add(CompletableFuture.runAsync(() -> {
                for (DemandRecord record : chunk) {
                    if (evaluate(record, cascade, strategy, index, configuration)) {
                        resolved.incrementAndGet();
                    }
                    reportProgress(description, processed.incrementAndGet(), total, progress);
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return resolved.get();
    }

    private boolean evaluate(DemandRecord record, Cascade cascade, MatchStrategy strategy,
                             SupplyIndex index, MatchingConfiguration configuration) {
        if (record.isResolved() || !cascade.appliesTo().test(record)) {
            return false;
        }
        String key = MatchKeys.demandKey(strategy, record, configuration.combinePoIn());
        Optional<BigDecimal> available = index.lookup(strategy, key);
        if (available.isEmpty()) {
            return false;
        }
        Outcome outcome = classifier.classify(strategy, available.get(), record.getRequestedQty());
        record.resolve(outcome);
        if (log.isDebugEnabled()) {
            log.debug("Row {} resolved by {} over {} supply rows: {}", record.getRowIndex(),
                    strategy.strategyName(), index.rowCount(strategy, key), outcome.status());
        }
        return true;
    }

    private void reportProgress(String description, int processed, int total, ProgressSink progress) {
        if (processed % progressInterval == 0 || processed == total) {
            progress.progress(description, processed, total);
        }
    }

    private static String describe(int passNumber, Cascade cascade, MatchStrategy strategy,
                                   MatchingConfiguration configuration) {
        String what = switch (strategy) {
            case PO_ONLY -> "Matching by PO Number...";
            case JOB_PO -> "Matching by Job No (last4) + PO Number...";
            case STYLE_COLOR -> "Matching by Style Ref + Color...";
            case PO_JOB -> "Matching by PO Number + Job No (last4)...";
            case COMBINED -> "Matching by Style Ref + PO Number (combined in "
                    + configuration.combinePoIn().name().toLowerCase(Locale.ROOT) + ")...";
        };
        String prefix = cascade.fallback() == OutcomeKind.NO_MATCH_BUYER ? "Buyer-specific: " : "";
        return passNumber + ". " + prefix + what;
    }

    /**
     * Outcome of the matching phase apart from the per-record outcomes.
     */
    public record CascadeReport(boolean buyerSpecificApplied, List<String> warnings) {}

    private record Cascade(
            String name,
            List<MatchStrategy> strategies,
            Predicate<DemandRecord> appliesTo,
            OutcomeKind fallback
    ) {}
}
