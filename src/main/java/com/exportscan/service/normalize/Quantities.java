package com.exportscan.service.normalize;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Numeric coercion policy for quantity cells.
 */
public final class Quantities {

    private static final Pattern COMMA_GROUPED = Pattern.compile("^-?\\d{1,3}(,\\d{3})+$");
    private static final Pattern DOT_GROUPED = Pattern.compile("^-?\\d{1,3}(\\.\\d{3})+$");

    private Quantities() {}

    public static BigDecimal parse(String raw) {
        return parse(raw, false);
    }

    /**
     * Parse a quantity cell. Blank or unparseable values yield {@code null} (absent).
     *
     * With {@code decimalComma} (semicolon-separated files) the comma is the decimal point and
     * dots group thousands: {@code 1.234,5}. Otherwise the dot is the decimal point and commas
     * group thousands ({@code 1,200}); a lone comma that is not a thousands grouping, such as
     * {@code 12,5}, is read as a decimal comma.
     */
    public static BigDecimal parse(String raw, boolean decimalComma) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim().replace(" ", "");
        if (value.isEmpty() || value.equalsIgnoreCase("nan")) {
            return null;
        }
        if (decimalComma) {
            value = value.contains(",") || DOT_GROUPED.matcher(value).matches()
                    ? value.replace(".", "").replace(",", ".")
                    : value;
        } else if (value.contains(",")) {
            boolean grouped = value.contains(".") || COMMA_GROUPED.matcher(value).matches();
            value = grouped ? value.replace(",", "") : value.replace(",", ".");
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Absent means missing, blank or numerically zero.
     */
    public static boolean isAbsent(BigDecimal quantity) {
        return quantity == null || quantity.signum() == 0;
    }

    public static BigDecimal orZero(BigDecimal quantity) {
        return quantity == null ? BigDecimal.ZERO : quantity;
    }
}
