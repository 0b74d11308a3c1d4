package com.exportscan.repository;

import com.exportscan.model.DemandRecord;
import com.exportscan.model.RawBatch;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the annotated target batch: every original column in order, plus the status column.
 * An existing first {@code Status} column is overwritten in place.
 */
@Component
public class CsvResultWriter {

    public static final String STATUS_COLUMN = "Status";

    public byte[] write(RawBatch target, List<DemandRecord> records) {
        if (records.size() != target.size()) {
            throw new IllegalArgumentException("Expected " + target.size() + " records, got " + records.size());
        }
        List<String> headers = new ArrayList<>(target.headers());
        int statusColumn = headers.indexOf(STATUS_COLUMN);
        if (statusColumn < 0) {
            statusColumn = headers.size();
            headers.add(STATUS_COLUMN);
        }

        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT)) {
            printer.printRecord(headers);
            for (DemandRecord record : records) {
                List<String> values = new ArrayList<>(headers.size());
                for (int column = 0; column < headers.size(); column++) {
                    values.add(column == statusColumn
                            ? record.getOutcome().status()
                            : target.cell(record.getRowIndex(), column));
                }
                printer.printRecord(values);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write result CSV", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }
}
