package com.flagship.escrow_ledger.exception;

import java.util.UUID;

/**
 * Transient conflict on an escrow payment: the per-payment lock could not be
 * acquired in time, or a concurrent writer bumped the row version first.
 * Callers should retry with backoff.
 */
public class ContentionException extends RuntimeException {

    private final UUID escrowPaymentId;

    public ContentionException(UUID escrowPaymentId, String message) {
        super(message);
        this.escrowPaymentId = escrowPaymentId;
    }

    public ContentionException(UUID escrowPaymentId, String message, Throwable cause) {
        super(message, cause);
        this.escrowPaymentId = escrowPaymentId;
    }

    public UUID getEscrowPaymentId() {
        return escrowPaymentId;
    }
}
