package com.exportscan.model;

import java.util.Locale;

/**
 * Which batch gets its PO number combined with the style reference for the Combined strategy.
 * The other batch is expected to already carry the combined value in its PO column.
 */
public enum CombinePoIn {
    SOURCE,
    TARGET;

    public static CombinePoIn parse(String value) {
        if (value == null || value.isBlank()) {
            return SOURCE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "SOURCE", "DF1", "SUPPLY" -> SOURCE;
            case "TARGET", "DF2", "DEMAND" -> TARGET;
            default -> throw new IllegalArgumentException("Unsupported combinePoIn: " + value);
        };
    }
}
