package com.exportscan.model;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Demand-side shipment row (target file) carrying its reconciliation outcome.
 *
 * The outcome starts as {@link Outcome#notChecked()} and may be resolved exactly once.
 */
@Getter
public class DemandRecord {

    private final int rowIndex;
    private final String jobNo;
    private final String poNumber;
    private final String styleRefNo;
    private final String color;
    private final BigDecimal requestedQty;
    private final String buyer;

    private final AtomicReference<Outcome> outcome = new AtomicReference<>(Outcome.notChecked());

    public DemandRecord(int rowIndex, String jobNo, String poNumber, String styleRefNo,
                        String color, BigDecimal requestedQty, String buyer) {
        this.rowIndex = rowIndex;
        this.jobNo = jobNo == null ? "" : jobNo;
        this.poNumber = poNumber == null ? "" : poNumber;
        this.styleRefNo = styleRefNo == null ? "" : styleRefNo;
        this.color = color == null ? "" : color;
        this.requestedQty = requestedQty;
        this.buyer = buyer == null ? "" : buyer;
    }

    public String jobLast4() {
        return IdentityKeys.last4(jobNo);
    }

    public String combinedKey() {
        return IdentityKeys.combined(styleRefNo, poNumber);
    }

    public Outcome getOutcome() {
        return outcome.get();
    }

    public boolean isResolved() {
        return outcome.get().kind().isTerminal();
    }

    /**
     * Assign the terminal outcome.
     *
     * @throws IllegalStateException if the record was already resolved
     */
    public void resolve(Outcome resolved) {
        if (resolved == null || !resolved.kind().isTerminal()) {
            throw new IllegalArgumentException("Outcome must be terminal: " + resolved);
        }
        Outcome current = outcome.get();
        if (current.kind().isTerminal() || !outcome.compareAndSet(current, resolved)) {
            throw new IllegalStateException("Row " + rowIndex + " already resolved as '"
                    + outcome.get().status() + "'");
        }
    }

    @Override
    public String toString() {
        return "DemandRecord[row=" + rowIndex + ", po=" + poNumber + ", job=" + jobNo
                + ", style=" + styleRefNo + ", color=" + color + ", qty=" + requestedQty
                + ", outcome=" + outcome.get().status() + "]";
    }
}
