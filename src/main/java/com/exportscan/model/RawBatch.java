package com.exportscan.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tabular batch as read from a file: ordered headers and rows of cells by column position.
 *
 * Header names may repeat; every column is kept. {@code delimiter} is the field separator the
 * file was read with, a semicolon meaning the comma is the decimal separator.
 */
public record RawBatch(
    String name,
    List<String> headers,
    List<List<String>> rows,
    char delimiter
) {

    public RawBatch {
        headers = List.copyOf(headers);
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            // cells may be null, so no List.copyOf
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public RawBatch(String name, List<String> headers, List<List<String>> rows) {
        this(name, headers, rows, ',');
    }

    public int size() {
        return rows.size();
    }

    public boolean decimalComma() {
        return delimiter == ';';
    }

    /**
     * Cell at the given position; null when the row is shorter than the header.
     */
    public String cell(int row, int column) {
        List<String> cells = rows.get(row);
        return column < 0 || column >= cells.size() ? null : cells.get(column);
    }

    /**
     * Cell under the first column with this header name.
     */
    public String value(int row, String header) {
        return cell(row, headers.indexOf(header));
    }
}
