package com.exportscan.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Per-run matching options.
 *
 * @param buyerSpecific  route flagged buyers through the buyer cascade
 * @param combinePoIn    batch on which the combined style/PO key is built
 * @param flaggedBuyers  buyer names (normalized upper-case) eligible for the buyer cascade
 */
public record MatchingConfiguration(
    boolean buyerSpecific,
    CombinePoIn combinePoIn,
    Set<String> flaggedBuyers
) {

    public MatchingConfiguration {
        combinePoIn = combinePoIn == null ? CombinePoIn.SOURCE : combinePoIn;
        flaggedBuyers = normalizeBuyers(flaggedBuyers);
    }

    public static MatchingConfiguration standard() {
        return new MatchingConfiguration(false, CombinePoIn.SOURCE, Set.of());
    }

    public static MatchingConfiguration buyerSpecific(CombinePoIn combinePoIn, Collection<String> flaggedBuyers) {
        return new MatchingConfiguration(true, combinePoIn, normalizeBuyers(flaggedBuyers));
    }

    public boolean isFlagged(String buyer) {
        return buyer != null && flaggedBuyers.contains(buyer.trim().toUpperCase(Locale.ROOT));
    }

    private static Set<String> normalizeBuyers(Collection<String> buyers) {
        if (buyers == null || buyers.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String buyer : buyers) {
            if (buyer != null && !buyer.isBlank()) {
                normalized.add(buyer.trim().toUpperCase(Locale.ROOT));
            }
        }
        return Set.copyOf(normalized);
    }
}
