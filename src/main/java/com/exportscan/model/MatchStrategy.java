package com.exportscan.model;

/**
 * Named matching rules, tried in cascade order.
 */
public enum MatchStrategy {
    PO_ONLY("PO-only", "PO", "PO Match"),
    JOB_PO("Job+PO", "Job+PO", "Job+PO"),
    PO_JOB("PO+Job", "PO+Job", "PO+Job"),
    COMBINED("Combined", "Combined", "Combined"),
    STYLE_COLOR("Style+Color", "Style+Color", "Style+Color");

    private final String strategyName;
    private final String displayName;
    private final String mismatchTag;

    MatchStrategy(String strategyName, String displayName, String mismatchTag) {
        this.strategyName = strategyName;
        this.displayName = displayName;
        this.mismatchTag = mismatchTag;
    }

    public String strategyName() {
        return strategyName;
    }

    /** Used in "Ok (PO Match)" style statuses. */
    public String displayName() {
        return displayName;
    }

    /** Used in "Over Shipment (PO Match: 120 vs 150)" style statuses. */
    public String mismatchTag() {
        return mismatchTag;
    }
}
