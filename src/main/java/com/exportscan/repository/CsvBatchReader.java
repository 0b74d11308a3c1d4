package com.exportscan.repository;

import com.exportscan.model.RawBatch;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a delimited text export into a {@link RawBatch}.
 *
 * The first record is the header row. Cells are kept verbatim and by position, so repeated
 * header names lose nothing; normalization happens later.
 */
@Component
@Slf4j
public class CsvBatchReader {

    private final String configuredDelimiter;

    public CsvBatchReader(@Value("${app.csv.delimiter:}") String configuredDelimiter) {
        this.configuredDelimiter = configuredDelimiter == null ? "" : configuredDelimiter;
    }

    public RawBatch read(Path path) {
        InputFileValidator.validate(path);
        try {
            return read(Files.readAllBytes(path), path.getFileName().toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    public RawBatch read(byte[] payload, String name) {
        if (payload == null || payload.length == 0) {
            throw new IllegalArgumentException("File is empty: " + name);
        }
        String content = stripBom(new String(payload, StandardCharsets.UTF_8));
        char delimiter = configuredDelimiter.isEmpty() ? sniffDelimiter(firstLine(content)) : configuredDelimiter.charAt(0);

        List<String> headers = new ArrayList<>();
        List<List<String>> rows = new ArrayList<>();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .build();

        try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
            for (CSVRecord record : parser) {
                if (headers.isEmpty()) {
                    record.forEach(headers::add);
                    continue;
                }
                List<String> row = new ArrayList<>(headers.size());
                for (int i = 0; i < headers.size(); i++) {
                    row.add(i < record.size() ? record.get(i) : null);
                }
                rows.add(row);
            }
        } catch (IOException | IllegalStateException e) {
            throw new IllegalArgumentException("Failed to read " + name + ": " + e.getMessage(), e);
        }

        if (headers.isEmpty()) {
            throw new IllegalArgumentException("No header row in " + name);
        }
        log.info("Read '{}': {} columns, {} rows (delimiter '{}')", name, headers.size(), rows.size(), delimiter);
        return new RawBatch(name, headers, rows, delimiter);
    }

    static String stripBom(String value) {
        if (value != null && !value.isEmpty() && value.charAt(0) == '\uFEFF') {
            return value.substring(1);
        }
        return value;
    }

    /**
     * Semicolon when the header line has one, comma otherwise.
     */
    static char sniffDelimiter(String headerLine) {
        if (headerLine == null || headerLine.isEmpty()) {
            return ',';
        }
        return headerLine.indexOf(';') >= 0 ? ';' : ',';
    }

    private static String firstLine(String content) {
        int newline = content.indexOf('\n');
        return newline < 0 ? content : content.substring(0, newline);
    }
}
