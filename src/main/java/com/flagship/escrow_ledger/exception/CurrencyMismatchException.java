package com.flagship.escrow_ledger.exception;

/**
 * Raised when two amounts in different currencies are combined.
 * Checked before any state change.
 */
public class CurrencyMismatchException extends InvalidArgumentException {

    private final String expected;
    private final String actual;

    public CurrencyMismatchException(String expected, String actual) {
        super(String.format("Currency mismatch: expected %s but got %s", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
