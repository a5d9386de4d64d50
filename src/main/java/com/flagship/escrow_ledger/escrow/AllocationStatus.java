package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.exception.InvalidStateTransitionException;

/**
 * Lifecycle of a seller allocation.
 *
 * <pre>
 * CREATED -> ELIGIBLE -> PARTIAL_RELEASE / PARTIAL_REFUND -> RELEASED / REFUNDED
 * </pre>
 *
 * RELEASED and REFUNDED are terminal. The partial states stay open until the
 * allocation's remaining share reaches zero. Cancelling the order refunds the
 * whole remaining share from any open state, delivered or not.
 */
public enum AllocationStatus {
    CREATED,
    ELIGIBLE,
    PARTIAL_RELEASE,
    PARTIAL_REFUND,
    RELEASED,
    REFUNDED;

    /**
     * Operations that move an allocation between states.
     */
    public enum Operation {
        MARK_ELIGIBLE,
        RELEASE,
        REFUND,
        CANCEL
    }

    /**
     * Transition function for all allocation operations.
     *
     * @param operation the operation being applied
     * @param exhausted whether the operation leaves the allocation with no remaining share
     * @return the resulting status
     * @throws InvalidStateTransitionException if the operation is not valid from this status
     */
    public AllocationStatus next(Operation operation, boolean exhausted) {
        return switch (this) {
            case CREATED -> switch (operation) {
                case MARK_ELIGIBLE -> ELIGIBLE;
                case CANCEL -> REFUNDED;
                case RELEASE, REFUND -> throw rejected(operation,
                        "Allocation must be marked eligible after delivery before funds can move.");
            };
            case ELIGIBLE, PARTIAL_RELEASE, PARTIAL_REFUND -> switch (operation) {
                case RELEASE -> exhausted ? RELEASED : PARTIAL_RELEASE;
                case REFUND -> exhausted ? REFUNDED : PARTIAL_REFUND;
                case CANCEL -> REFUNDED;
                case MARK_ELIGIBLE -> throw rejected(operation,
                        "Only CREATED allocations can be marked eligible.");
            };
            case RELEASED, REFUNDED -> throw rejected(operation,
                    "Allocation is closed and accepts no further operations.");
        };
    }

    public boolean isTerminal() {
        return this == RELEASED || this == REFUNDED;
    }

    /**
     * Whether funds can be released or refunded from this status.
     */
    public boolean canMoveFunds() {
        return this == ELIGIBLE || this == PARTIAL_RELEASE || this == PARTIAL_REFUND;
    }

    private InvalidStateTransitionException rejected(Operation operation, String detail) {
        return new InvalidStateTransitionException(name(), operation.name(),
                String.format("Cannot %s allocation in %s status. %s",
                        operation.name().toLowerCase().replace('_', ' '), this, detail));
    }
}
