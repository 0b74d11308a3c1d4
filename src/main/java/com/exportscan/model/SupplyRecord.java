package com.exportscan.model;

import java.math.BigDecimal;

/**
 * Supply-side shipment row (source file) after normalization.
 * Identity fields are trimmed and upper-cased, never null.
 */
public record SupplyRecord(
    int rowIndex,
    String jobNo,
    String poNumber,
    String styleRefNo,
    String color,
    BigDecimal availableQty,
    String buyer
) {

    public String jobLast4() {
        return IdentityKeys.last4(jobNo);
    }

    public String combinedKey() {
        return IdentityKeys.combined(styleRefNo, poNumber);
    }
}
