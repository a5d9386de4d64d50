package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.exception.InvalidStateTransitionException;

/**
 * Lifecycle of a monthly settlement.
 *
 * <pre>
 * CLOSED -> APPROVED -> EXPORTED
 * CLOSED -> EXPORTED
 * </pre>
 *
 * A settlement is created CLOSED. Its items never change afterwards; late
 * corrections are recorded as adjustments in every status.
 */
public enum SettlementStatus {
    CLOSED,
    APPROVED,
    EXPORTED;

    public enum Operation {
        APPROVE,
        EXPORT
    }

    public SettlementStatus next(Operation operation) {
        return switch (this) {
            case CLOSED -> switch (operation) {
                case APPROVE -> APPROVED;
                case EXPORT -> EXPORTED;
            };
            case APPROVED -> switch (operation) {
                case EXPORT -> EXPORTED;
                case APPROVE -> throw rejected(operation, "Settlement is already approved.");
            };
            case EXPORTED -> throw rejected(operation, "Settlement was exported and accepts no further transitions.");
        };
    }

    private InvalidStateTransitionException rejected(Operation operation, String reason) {
        return new InvalidStateTransitionException(name(), operation.name(),
            String.format("Cannot %s settlement in %s status. %s",
                operation.name().toLowerCase(), name(), reason));
    }
}
