package com.exportscan.service;

import com.exportscan.config.AppMetrics;
import com.exportscan.model.MatchStrategy;
import com.exportscan.model.MatchingConfiguration;
import com.exportscan.model.OutcomeKind;
import com.exportscan.model.RawBatch;
import com.exportscan.model.ReconciliationResult;
import com.exportscan.repository.CsvBatchReader;
import com.exportscan.service.normalize.MissingColumnsException;
import com.exportscan.service.normalize.RecordNormalizer;
import com.exportscan.service.preload.SupplyIndexService;
import com.exportscan.service.processing.CascadeMatcher;
import com.exportscan.service.processing.QuantityClassifier;
import com.exportscan.service.progress.CollectingProgressSink;
import com.exportscan.service.summary.SummaryAggregator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ReconciliationOrchestrator.
 *
 * Tests verify:
 * - A full run over the CSV fixtures yields the expected statuses
 * - Repeated runs are identical
 * - Missing columns abort the run before matching
 * - Unexpected failures are wrapped and counted
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReconciliationOrchestratorTest {

    @Mock private CascadeMatcher failingMatcher;

    private AppMetrics metrics;
    private ReconciliationOrchestrator orchestrator;
    private RawBatch supply;
    private RawBatch demand;

    @BeforeEach
    void setUp() throws IOException {
        metrics = new AppMetrics(new SimpleMeterRegistry());
        orchestrator = newOrchestrator(new CascadeMatcher(new QuantityClassifier(), null, 1, 500));

        CsvBatchReader reader = new CsvBatchReader("");
        supply = reader.read(fixture("supply.csv"), "supply.csv");
        demand = reader.read(fixture("demand.csv"), "demand.csv");
    }

    @Test
    @DisplayName("Should annotate every demand row of the fixtures")
    void shouldReconcileFixtures() {
        // When
        ReconciliationResult result = orchestrator.reconcile(supply, demand, MatchingConfiguration.standard());

        // Then
        assertThat(statuses(result)).containsExactly(
                "Ok (PO Match)",
                "Over Shipment (PO Match: 80 vs 100)",
                "No Shipment (PO Match)",
                "Less Shipment (PO Match: 1200 vs 150)",
                "Ok (Style+Color Match)",
                "No Match Found");
        assertThat(result.summary().totalRecords()).isEqualTo(6);
        assertThat(result.summary().count(OutcomeKind.OK)).isEqualTo(2);
        assertThat(result.summary().count(MatchStrategy.PO_ONLY)).isEqualTo(4);
        assertThat(result.summary().count(MatchStrategy.STYLE_COLOR)).isEqualTo(1);
        assertThat(result.warnings()).isEmpty();
        assertThat(result.buyerSpecificApplied()).isFalse();
        assertThat(result.runId()).isNotBlank();

        assertThat(metrics.getRunsCounter().count()).isEqualTo(1.0);
        assertThat(metrics.getRecordsCounter().count()).isEqualTo(6.0);
        assertThat(metrics.getOutcomeCounters().get(OutcomeKind.OK).count()).isEqualTo(2.0);
        assertThat(metrics.getTotalTimer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should produce identical outcomes and summary on repeated runs")
    void shouldBeIdempotent() {
        ReconciliationResult first = orchestrator.reconcile(supply, demand, MatchingConfiguration.standard());
        ReconciliationResult second = orchestrator.reconcile(supply, demand, MatchingConfiguration.standard());

        assertThat(statuses(second)).isEqualTo(statuses(first));
        assertThat(second.summary()).isEqualTo(first.summary());
        assertThat(second.runId()).isNotEqualTo(first.runId());
    }

    @Test
    @DisplayName("Should route flagged buyers through the buyer cascade")
    void shouldApplyBuyerMode() {
        // Given
        MatchingConfiguration config = MatchingConfiguration.buyerSpecific(null, List.of("globex"));
        CollectingProgressSink sink = new CollectingProgressSink();

        // When
        ReconciliationResult result = orchestrator.reconcile(supply, demand, config, sink);

        // Then: GLOBEX row has J0003/PO300, resolved by PO+Job
        assertThat(result.buyerSpecificApplied()).isTrue();
        assertThat(statuses(result).get(2)).isEqualTo("No Shipment (PO+Job Match)");
        assertThat(sink.getLines()).hasSize(5);
    }

    @Test
    @DisplayName("Should abort with MissingColumnsException and count the failure")
    void shouldFailOnMissingColumns() throws IOException {
        RawBatch incomplete = new CsvBatchReader("").read(fixture("demand-missing-columns.csv"), "bad.csv");

        assertThatThrownBy(() -> orchestrator.reconcile(supply, incomplete, MatchingConfiguration.standard()))
                .isInstanceOf(MissingColumnsException.class)
                .hasMessage("Missing columns in bad.csv: stylerefno");
        assertThat(metrics.getFailedRunsCounter().count()).isEqualTo(1.0);
        assertThat(metrics.getRunsCounter().count()).isZero();
    }

    @Test
    @DisplayName("Should wrap unexpected failures and clean up MDC")
    void shouldWrapUnexpectedFailure() {
        // Given
        when(failingMatcher.match(any(), any(), any(), anyBoolean(), any()))
                .thenThrow(new IllegalStateException("boom"));
        ReconciliationOrchestrator failing = newOrchestrator(failingMatcher);

        // When / Then
        assertThatThrownBy(() -> failing.reconcile(supply, demand, MatchingConfiguration.standard()))
                .isInstanceOf(ReconciliationException.class)
                .hasMessage("Error during processing: boom")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(metrics.getFailedRunsCounter().count()).isEqualTo(1.0);
        assertThat(MDC.get("runId")).isNull();
    }

    private ReconciliationOrchestrator newOrchestrator(CascadeMatcher matcher) {
        return new ReconciliationOrchestrator(
                new RecordNormalizer(),
                new SupplyIndexService(metrics),
                matcher,
                new SummaryAggregator(),
                metrics);
    }

    private static List<String> statuses(ReconciliationResult result) {
        return result.demandRecords().stream().map(record -> record.getOutcome().status()).toList();
    }

    static byte[] fixture(String name) throws IOException {
        try (InputStream in = ReconciliationOrchestratorTest.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IOException("Missing fixture " + name);
            }
            return in.readAllBytes();
        }
    }
}
