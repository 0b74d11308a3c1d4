package com.exportscan.service.preload;

import com.exportscan.model.CombinePoIn;
import com.exportscan.model.MatchStrategy;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Precomputed supply totals for every strategy, built once per run and read-only afterwards.
 *
 * A key missing from a strategy map means no supply row carries that key; a key mapped to
 * zero means supply rows exist but carry no usable quantity.
 */
@Getter
@Builder
public class SupplyIndex {

    private final Map<MatchStrategy, Map<String, BigDecimal>> totals;
    private final Map<MatchStrategy, Map<String, Integer>> rowCounts;
    private final CombinePoIn combinePoIn;
    private final int supplyRows;

    /**
     * Aggregated available quantity for the key, empty when no supply row has it.
     */
    public Optional<BigDecimal> lookup(MatchStrategy strategy, String key) {
        if (key == null) {
            return Optional.empty();
        }
        Map<String, BigDecimal> byKey = totals.get(strategy);
        return byKey == null ? Optional.empty() : Optional.ofNullable(byKey.get(key));
    }

    public int rowCount(MatchStrategy strategy, String key) {
        Map<String, Integer> byKey = rowCounts.get(strategy);
        return byKey == null || key == null ? 0 : byKey.getOrDefault(key, 0);
    }

    public int keyCount(MatchStrategy strategy) {
        Map<String, BigDecimal> byKey = totals.get(strategy);
        return byKey == null ? 0 : byKey.size();
    }
}
