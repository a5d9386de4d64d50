package com.flagship.escrow_ledger.ledger;

/**
 * Business event recorded by a ledger entry.
 */
public enum LedgerAction {
    CREATED,
    ALLOCATION_CREATED,
    ALLOCATION_ELIGIBLE,
    RELEASED,
    PARTIAL_RELEASE,
    REFUNDED,
    PARTIAL_REFUND;

    public boolean isRelease() {
        return this == RELEASED || this == PARTIAL_RELEASE;
    }

    public boolean isRefund() {
        return this == REFUNDED || this == PARTIAL_REFUND;
    }

    /**
     * Whether the action moved money out of escrow.
     */
    public boolean movesFunds() {
        return isRelease() || isRefund();
    }
}
