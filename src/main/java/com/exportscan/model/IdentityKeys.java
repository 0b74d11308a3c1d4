package com.exportscan.model;

/**
 * Derived identity values shared by supply and demand records.
 */
public final class IdentityKeys {

    private IdentityKeys() {}

    /**
     * Last four characters of the trimmed value, or the whole value when shorter.
     */
    public static String last4(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        return trimmed.length() <= 4 ? trimmed : trimmed.substring(trimmed.length() - 4);
    }

    /**
     * {@code styleRefNo + "-" + poNumber}, or empty when either part is blank.
     */
    public static String combined(String styleRefNo, String poNumber) {
        if (isBlank(styleRefNo) || isBlank(poNumber)) {
            return "";
        }
        return styleRefNo + "-" + poNumber;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
