package com.exportscan.service.processing;

import com.exportscan.model.MatchStrategy;
import com.exportscan.model.Outcome;
import com.exportscan.model.OutcomeKind;
import com.exportscan.service.normalize.Quantities;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Classifies the relationship between the aggregated available quantity and the requested one.
 * Stateless.
 */
@Component
public class QuantityClassifier {

    /**
     * Rules, first match wins:
     * <ol>
     *   <li>available missing or zero → NO_SHIPMENT</li>
     *   <li>available == requested (numeric, no tolerance) → OK</li>
     *   <li>available &lt; requested → OVER_SHIPMENT</li>
     *   <li>otherwise → LESS_SHIPMENT</li>
     * </ol>
     * A missing requested quantity compares as zero.
     */
    public Outcome classify(MatchStrategy strategy, BigDecimal available, BigDecimal requested) {
        if (Quantities.isAbsent(available)) {
            return Outcome.matched(OutcomeKind.NO_SHIPMENT, strategy);
        }
        BigDecimal wanted = Quantities.orZero(requested);
        int cmp = available.compareTo(wanted);
        if (cmp == 0) {
            return Outcome.matched(OutcomeKind.OK, strategy);
        }
        if (cmp < 0) {
            return Outcome.mismatch(OutcomeKind.OVER_SHIPMENT, strategy, available, requested);
        }
        return Outcome.mismatch(OutcomeKind.LESS_SHIPMENT, strategy, available, requested);
    }
}
