package com.exportscan.service.preload;

import com.exportscan.config.AppMetrics;
import com.exportscan.model.CombinePoIn;
import com.exportscan.model.MatchStrategy;
import com.exportscan.model.SupplyRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SupplyIndexService.
 *
 * Tests verify:
 * - Quantities are summed across rows sharing a key
 * - Blank quantities register the key with zero
 * - Records with blank key components stay out of the index
 */
class SupplyIndexServiceTest {

    private AppMetrics metrics;
    private SupplyIndexService service;

    @BeforeEach
    void setUp() {
        metrics = new AppMetrics(new SimpleMeterRegistry());
        service = new SupplyIndexService(metrics);
    }

    @Test
    @DisplayName("Should sum quantities of every row sharing a key, counting blanks as zero")
    void shouldAggregateWithBlanks() {
        // Given
        List<SupplyRecord> supply = List.of(
                supply("J0001", "PO1", "S1", "RED", "10"),
                supply("J0002", "PO1", "S1", "RED", null),
                supply("J0003", "PO1", "S2", "BLUE", "5.5"));

        // When
        SupplyIndex index = service.buildIndex(supply, EnumSet.of(MatchStrategy.PO_ONLY, MatchStrategy.STYLE_COLOR),
                CombinePoIn.SOURCE);

        // Then
        assertThat(index.lookup(MatchStrategy.PO_ONLY, "PO1")).hasValueSatisfying(
                qty -> assertThat(qty).isEqualByComparingTo("15.5"));
        assertThat(index.rowCount(MatchStrategy.PO_ONLY, "PO1")).isEqualTo(3);
        assertThat(index.lookup(MatchStrategy.STYLE_COLOR, "S1|RED")).hasValueSatisfying(
                qty -> assertThat(qty).isEqualByComparingTo("10"));
        assertThat(index.getSupplyRows()).isEqualTo(3);
        assertThat(metrics.getIndexTimer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should distinguish a key with only blank quantities from an absent key")
    void shouldKeepAbsentAndZeroApart() {
        // Given
        List<SupplyRecord> supply = List.of(supply("J0001", "PO9", "S1", "RED", null));

        // When
        SupplyIndex index = service.buildIndex(supply, EnumSet.of(MatchStrategy.PO_ONLY), CombinePoIn.SOURCE);

        // Then
        assertThat(index.lookup(MatchStrategy.PO_ONLY, "PO9")).hasValueSatisfying(
                qty -> assertThat(qty).isEqualByComparingTo("0"));
        assertThat(index.lookup(MatchStrategy.PO_ONLY, "PO8")).isEmpty();
        assertThat(index.lookup(MatchStrategy.JOB_PO, "0001_PO9")).isEmpty();
    }

    @Test
    @DisplayName("Should build Job+PO and PO+Job keys from the last four job characters")
    void shouldBuildJobKeys() {
        List<SupplyRecord> supply = List.of(
                supply("JOB-0001", "PO1", "S1", "RED", "7"),
                supply("", "PO2", "S1", "RED", "3"));

        SupplyIndex index = service.buildIndex(supply, EnumSet.of(MatchStrategy.JOB_PO, MatchStrategy.PO_JOB),
                CombinePoIn.SOURCE);

        assertThat(index.lookup(MatchStrategy.JOB_PO, "0001_PO1")).isPresent();
        assertThat(index.lookup(MatchStrategy.PO_JOB, "PO1_0001")).isPresent();
        assertThat(index.keyCount(MatchStrategy.JOB_PO)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should build the combined key on the configured side")
    void shouldBuildCombinedKeyOnConfiguredSide() {
        List<SupplyRecord> supply = List.of(supply("J1", "PO1", "S1", "RED", "4"));

        SupplyIndex onSource = service.buildIndex(supply, EnumSet.of(MatchStrategy.COMBINED), CombinePoIn.SOURCE);
        SupplyIndex onTarget = service.buildIndex(supply, EnumSet.of(MatchStrategy.COMBINED), CombinePoIn.TARGET);

        assertThat(onSource.lookup(MatchStrategy.COMBINED, "S1-PO1")).isPresent();
        assertThat(onTarget.lookup(MatchStrategy.COMBINED, "PO1")).isPresent();
        assertThat(onTarget.lookup(MatchStrategy.COMBINED, "S1-PO1")).isEmpty();
    }

    private static SupplyRecord supply(String job, String po, String style, String color, String qty) {
        return new SupplyRecord(0, job, po, style, color, qty == null ? null : new BigDecimal(qty), "");
    }
}
