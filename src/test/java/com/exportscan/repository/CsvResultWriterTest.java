package com.exportscan.repository;

import com.exportscan.model.DemandRecord;
import com.exportscan.model.MatchStrategy;
import com.exportscan.model.Outcome;
import com.exportscan.model.OutcomeKind;
import com.exportscan.model.RawBatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvResultWriterTest {

    private final CsvBatchReader reader = new CsvBatchReader("");
    private final CsvResultWriter writer = new CsvResultWriter();

    @Test
    @DisplayName("Should keep original columns and append the status column")
    void shouldAppendStatus() {
        // Given
        RawBatch target = reader.read("PO Number,Note\nPO1,\"a, b\"\nPO2,x\n".getBytes(StandardCharsets.UTF_8), "t.csv");
        List<DemandRecord> records = List.of(
                resolved(0, Outcome.mismatch(OutcomeKind.OVER_SHIPMENT, MatchStrategy.PO_ONLY,
                        new BigDecimal("120"), new BigDecimal("150"))),
                resolved(1, Outcome.unmatched(OutcomeKind.NO_MATCH_FOUND)));

        // When
        RawBatch written = reader.read(writer.write(target, records), "out.csv");

        // Then
        assertThat(written.headers()).containsExactly("PO Number", "Note", "Status");
        assertThat(written.rows().get(0)).containsExactly("PO1", "a, b", "Over Shipment (PO Match: 120 vs 150)");
        assertThat(written.value(1, "Status")).isEqualTo("No Match Found");
    }

    @Test
    @DisplayName("Should overwrite an existing status column in place")
    void shouldReplaceExistingStatus() {
        RawBatch target = reader.read("Status,PO Number\nold,PO1\n".getBytes(StandardCharsets.UTF_8), "t.csv");

        RawBatch written = reader.read(
                writer.write(target, List.of(resolved(0, Outcome.matched(OutcomeKind.OK, MatchStrategy.JOB_PO)))),
                "out.csv");

        assertThat(written.headers()).containsExactly("Status", "PO Number");
        assertThat(written.rows().get(0)).containsExactly("Ok (Job+PO Match)", "PO1");
    }

    @Test
    @DisplayName("Should export every column of a repeated header")
    void shouldKeepDuplicateHeaderColumns() {
        // Given
        RawBatch target = reader.read(
                "Job No,PO Number,Ship Qty,Style Ref No,Color,Note,Note\nJ1,100,5,S1,RED,first,second\n"
                        .getBytes(StandardCharsets.UTF_8), "t.csv");

        // When
        byte[] csv = writer.write(target, List.of(resolved(0, Outcome.unmatched(OutcomeKind.NO_MATCH_FOUND))));

        // Then
        RawBatch written = reader.read(csv, "out.csv");
        assertThat(written.headers())
                .containsExactly("Job No", "PO Number", "Ship Qty", "Style Ref No", "Color", "Note", "Note", "Status");
        assertThat(written.rows().get(0))
                .containsExactly("J1", "100", "5", "S1", "RED", "first", "second", "No Match Found");
    }

    @Test
    @DisplayName("Should reject a record list that does not cover the batch")
    void shouldRejectSizeMismatch() {
        RawBatch target = reader.read("PO\nA\nB\n".getBytes(StandardCharsets.UTF_8), "t.csv");

        assertThatThrownBy(() -> writer.write(target, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static DemandRecord resolved(int row, Outcome outcome) {
        DemandRecord record = new DemandRecord(row, "", "", "", "", BigDecimal.ONE, "");
        record.resolve(outcome);
        return record;
    }
}
