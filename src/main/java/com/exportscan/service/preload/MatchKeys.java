package com.exportscan.service.preload;

import com.exportscan.model.CombinePoIn;
import com.exportscan.model.DemandRecord;
import com.exportscan.model.MatchStrategy;
import com.exportscan.model.SupplyRecord;

import static com.exportscan.model.IdentityKeys.isBlank;

/**
 * Composite key per strategy. A {@code null} key means the record cannot take part in that strategy.
 */
public final class MatchKeys {

    private MatchKeys() {}

    public static String supplyKey(MatchStrategy strategy, SupplyRecord record, CombinePoIn combinePoIn) {
        return switch (strategy) {
            case PO_ONLY -> nonBlank(record.poNumber());
            case JOB_PO -> jobPo(record.jobLast4(), record.poNumber());
            case PO_JOB -> poJob(record.poNumber(), record.jobLast4());
            case COMBINED -> combinePoIn == CombinePoIn.SOURCE
                    ? nonBlank(record.combinedKey())
                    : nonBlank(record.poNumber());
            case STYLE_COLOR -> styleColor(record.styleRefNo(), record.color());
        };
    }

    public static String demandKey(MatchStrategy strategy, DemandRecord record, CombinePoIn combinePoIn) {
        return switch (strategy) {
            case PO_ONLY -> nonBlank(record.getPoNumber());
            case JOB_PO -> jobPo(record.jobLast4(), record.getPoNumber());
            case PO_JOB -> poJob(record.getPoNumber(), record.jobLast4());
            case COMBINED -> combinePoIn == CombinePoIn.TARGET
                    ? nonBlank(record.combinedKey())
                    : nonBlank(record.getPoNumber());
            case STYLE_COLOR -> styleColor(record.getStyleRefNo(), record.getColor());
        };
    }

    private static String jobPo(String jobLast4, String po) {
        return isBlank(jobLast4) || isBlank(po) ? null : jobLast4 + "_" + po;
    }

    private static String poJob(String po, String jobLast4) {
        return isBlank(jobLast4) || isBlank(po) ? null : po + "_" + jobLast4;
    }

    private static String styleColor(String style, String color) {
        return isBlank(style) || isBlank(color) ? null : style + "|" + color;
    }

    private static String nonBlank(String value) {
        return isBlank(value) ? null : value;
    }
}
