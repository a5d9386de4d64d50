package com.flagship.escrow_ledger.exception;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Data-integrity violation: a release or refund would drive the payment's
 * remaining balance below zero even though the allocation checks passed.
 * Indicates broken allocation math upstream and must be alerted on.
 */
public class InsufficientEscrowBalanceException extends IllegalStateException {

    private final UUID escrowPaymentId;
    private final BigDecimal requested;
    private final BigDecimal remaining;

    public InsufficientEscrowBalanceException(UUID escrowPaymentId, BigDecimal requested, BigDecimal remaining) {
        super(String.format("Escrow payment %s cannot cover %s: remaining balance is %s",
                escrowPaymentId, requested, remaining));
        this.escrowPaymentId = escrowPaymentId;
        this.requested = requested;
        this.remaining = remaining;
    }

    public UUID getEscrowPaymentId() {
        return escrowPaymentId;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getRemaining() {
        return remaining;
    }
}
