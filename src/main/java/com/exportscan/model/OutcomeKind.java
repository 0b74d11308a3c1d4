package com.exportscan.model;

/**
 * Closed set of reconciliation labels.
 *
 * OVER_SHIPMENT means available &lt; requested, LESS_SHIPMENT means available &gt; requested.
 */
public enum OutcomeKind {
    NOT_CHECKED("Not Checked", false),
    OK("Ok", true),
    NO_SHIPMENT("No Shipment", true),
    OVER_SHIPMENT("Over Shipment", true),
    LESS_SHIPMENT("Less Shipment", true),
    NO_MATCH_FOUND("No Match Found", true),
    NO_MATCH_BUYER("No Match (Buyer)", true);

    private final String label;
    private final boolean terminal;

    OutcomeKind(String label, boolean terminal) {
        this.label = label;
        this.terminal = terminal;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isQuantityMismatch() {
        return this == OVER_SHIPMENT || this == LESS_SHIPMENT;
    }

    public boolean isNoMatch() {
        return this == NO_MATCH_FOUND || this == NO_MATCH_BUYER;
    }
}
