package com.exportscan.service.normalize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raised when a batch lacks required columns. Fatal: no matching is attempted.
 */
public class MissingColumnsException extends RuntimeException {

    private final Map<String, List<String>> missingByBatch;

    public MissingColumnsException(Map<String, List<String>> missingByBatch) {
        super(describe(missingByBatch));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        missingByBatch.forEach((batch, columns) -> copy.put(batch, List.copyOf(columns)));
        this.missingByBatch = Collections.unmodifiableMap(copy);
    }

    public Map<String, List<String>> getMissingByBatch() {
        return missingByBatch;
    }

    private static String describe(Map<String, List<String>> missingByBatch) {
        return missingByBatch.entrySet().stream()
                .map(e -> "Missing columns in " + e.getKey() + ": " + String.join(", ", e.getValue()))
                .collect(Collectors.joining("; "));
    }
}
