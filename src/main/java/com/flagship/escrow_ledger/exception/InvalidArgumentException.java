package com.flagship.escrow_ledger.exception;

/**
 * Raised for malformed input: missing identifiers, out-of-range amounts or rates.
 * Always a caller bug and never retried.
 */
public class InvalidArgumentException extends IllegalArgumentException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
