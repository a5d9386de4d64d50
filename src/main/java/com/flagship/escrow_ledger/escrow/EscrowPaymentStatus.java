package com.flagship.escrow_ledger.escrow;

/**
 * Payment-level summary of where the escrowed funds are.
 * Derived from the running totals, never set directly.
 */
public enum EscrowPaymentStatus {
    HELD,
    PARTIALLY_RELEASED,
    RELEASED,
    REFUNDED,
    COMPLETED;

    public boolean isClosed() {
        return this == RELEASED || this == REFUNDED || this == COMPLETED;
    }
}
