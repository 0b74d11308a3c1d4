package com.exportscan.config;

import com.exportscan.model.CombinePoIn;
import com.exportscan.model.MatchingConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default matching options from application properties, overridable per request.
 */
@Component
@Slf4j
public class MatchingDefaults {

    private final MatchingConfiguration defaults;

    public MatchingDefaults(
            @Value("${app.matching.buyer-specific:false}") boolean buyerSpecific,
            @Value("${app.matching.combine-po-in:SOURCE}") String combinePoIn,
            @Value("${app.matching.flagged-buyers:}") String flaggedBuyers) {
        this.defaults = new MatchingConfiguration(buyerSpecific, CombinePoIn.parse(combinePoIn), splitBuyers(flaggedBuyers));
        log.info("Matching defaults: buyerSpecific={}, combinePoIn={}, flaggedBuyers={}",
                defaults.buyerSpecific(), defaults.combinePoIn(), defaults.flaggedBuyers());
    }

    public MatchingConfiguration defaults() {
        return defaults;
    }

    /**
     * Apply request overrides; null arguments keep the defaults.
     */
    public MatchingConfiguration resolve(Boolean buyerSpecific, String combinePoIn, String flaggedBuyers) {
        return new MatchingConfiguration(
                buyerSpecific != null ? buyerSpecific : defaults.buyerSpecific(),
                combinePoIn != null ? CombinePoIn.parse(combinePoIn) : defaults.combinePoIn(),
                flaggedBuyers != null ? splitBuyers(flaggedBuyers) : defaults.flaggedBuyers()
        );
    }

    static Set<String> splitBuyers(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        List<String> names = Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
        return names.stream().collect(Collectors.toUnmodifiableSet());
    }
}
