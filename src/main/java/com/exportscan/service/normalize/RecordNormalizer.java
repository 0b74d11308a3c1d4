package com.exportscan.service.normalize;

import com.exportscan.model.DemandRecord;
import com.exportscan.model.RawBatch;
import com.exportscan.model.SupplyRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonicalizes column names and identity values of both batches.
 *
 * Column names are trimmed, lower-cased and stripped of spaces, underscores and hyphens,
 * so "PO Number", "po_number" and "PONumber" all resolve to {@code ponumber}.
 */
@Service
@Slf4j
public class RecordNormalizer {

    public static final String JOB_NO = "jobno";
    public static final String PO_NUMBER = "ponumber";
    public static final String STYLE_REF_NO = "stylerefno";
    public static final String COLOR = "color";
    public static final String BUYER = "buyer";
    public static final String EX_FACTORY_QTY = "exfactoryqty";
    public static final String SHIP_QTY = "shipqty";

    static final Map<String, List<String>> SUPPLY_FIELDS = fields(EX_FACTORY_QTY, "availableqty");
    static final Map<String, List<String>> DEMAND_FIELDS = fields(SHIP_QTY, "requestedqty");

    private static final Pattern INTEGRAL_DECIMAL = Pattern.compile("^-?\\d+\\.0+$");

    public static String canonicalName(String column) {
        if (column == null) {
            return "";
        }
        return column.trim().toLowerCase(Locale.ROOT)
                .replace(" ", "")
                .replace("_", "")
                .replace("-", "");
    }

    /**
     * Trim and upper-case an identity value; integral decimals like "100.0" become "100".
     */
    public static String normalizeIdentity(String value) {
        if (value == null) {
            return "";
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (INTEGRAL_DECIMAL.matcher(normalized).matches()) {
            normalized = normalized.substring(0, normalized.indexOf('.'));
        }
        return normalized;
    }

    /**
     * Check both batches for their required fields.
     *
     * @throws MissingColumnsException naming every absent field of every deficient batch
     */
    public void validate(RawBatch source, RawBatch target) {
        Map<String, List<String>> missing = new LinkedHashMap<>();
        List<String> sourceMissing = missingFields(source, SUPPLY_FIELDS);
        if (!sourceMissing.isEmpty()) {
            missing.put(source.name(), sourceMissing);
        }
        List<String> targetMissing = missingFields(target, DEMAND_FIELDS);
        if (!targetMissing.isEmpty()) {
            missing.put(target.name(), targetMissing);
        }
        if (!missing.isEmpty()) {
            MissingColumnsException exception = new MissingColumnsException(missing);
            log.error(exception.getMessage());
            throw exception;
        }
    }

    public boolean hasBuyerField(RawBatch batch) {
        return resolveColumns(batch).containsKey(BUYER);
    }

    public List<SupplyRecord> normalizeSupply(RawBatch batch) {
        Map<String, Integer> columns = resolveColumns(batch);
        int qtyColumn = firstPresent(columns, SUPPLY_FIELDS.get(EX_FACTORY_QTY));

        List<SupplyRecord> records = new ArrayList<>(batch.size());
        for (int row = 0; row < batch.size(); row++) {
            records.add(new SupplyRecord(
                    row,
                    identity(batch, row, columns, JOB_NO),
                    identity(batch, row, columns, PO_NUMBER),
                    identity(batch, row, columns, STYLE_REF_NO),
                    identity(batch, row, columns, COLOR),
                    Quantities.parse(batch.cell(row, qtyColumn), batch.decimalComma()),
                    identity(batch, row, columns, BUYER)
            ));
        }
        log.debug("Normalized {} supply rows from '{}'", records.size(), batch.name());
        return records;
    }

    public List<DemandRecord> normalizeDemand(RawBatch batch) {
        Map<String, Integer> columns = resolveColumns(batch);
        int qtyColumn = firstPresent(columns, DEMAND_FIELDS.get(SHIP_QTY));

        List<DemandRecord> records = new ArrayList<>(batch.size());
        for (int row = 0; row < batch.size(); row++) {
            records.add(new DemandRecord(
                    row,
                    identity(batch, row, columns, JOB_NO),
                    identity(batch, row, columns, PO_NUMBER),
                    identity(batch, row, columns, STYLE_REF_NO),
                    identity(batch, row, columns, COLOR),
                    Quantities.parse(batch.cell(row, qtyColumn), batch.decimalComma()),
                    identity(batch, row, columns, BUYER)
            ));
        }
        log.debug("Normalized {} demand rows from '{}'", records.size(), batch.name());
        return records;
    }

    /**
     * Canonical name to column position; the first column wins on collisions.
     */
    Map<String, Integer> resolveColumns(RawBatch batch) {
        Map<String, Integer> columns = new LinkedHashMap<>();
        List<String> headers = batch.headers();
        for (int i = 0; i < headers.size(); i++) {
            columns.putIfAbsent(canonicalName(headers.get(i)), i);
        }
        return columns;
    }

    private List<String> missingFields(RawBatch batch, Map<String, List<String>> required) {
        Map<String, Integer> columns = resolveColumns(batch);
        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, List<String>> field : required.entrySet()) {
            if (firstPresent(columns, field.getValue()) < 0) {
                missing.add(field.getKey());
            }
        }
        return missing;
    }

    /**
     * Position of the first accepted name present, or -1.
     */
    private static int firstPresent(Map<String, Integer> columns, List<String> names) {
        for (String name : names) {
            Integer column = columns.get(name);
            if (column != null) {
                return column;
            }
        }
        return -1;
    }

    private static String identity(RawBatch batch, int row, Map<String, Integer> columns, String field) {
        Integer column = columns.get(field);
        return normalizeIdentity(column == null ? null : batch.cell(row, column));
    }

    /**
     * Required fields in reporting order, each with its accepted canonical names.
     */
    private static Map<String, List<String>> fields(String quantityField, String quantityAlias) {
        Map<String, List<String>> fields = new LinkedHashMap<>();
        fields.put(JOB_NO, List.of(JOB_NO));
        fields.put(PO_NUMBER, List.of(PO_NUMBER));
        fields.put(quantityField, List.of(quantityField, quantityAlias));
        fields.put(STYLE_REF_NO, List.of(STYLE_REF_NO));
        fields.put(COLOR, List.of(COLOR));
        return fields;
    }
}
