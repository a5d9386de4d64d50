package com.flagship.escrow_ledger.exception;

/**
 * Raised when an operation is not valid from the current allocation, payment
 * or settlement status. Retrying an operation that already completed ends here,
 * which is what keeps releases and refunds from being applied twice.
 */
public class InvalidStateTransitionException extends IllegalStateException {

    private final String currentState;
    private final String operation;

    public InvalidStateTransitionException(String currentState, String operation, String message) {
        super(message);
        this.currentState = currentState;
        this.operation = operation;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getOperation() {
        return operation;
    }
}
