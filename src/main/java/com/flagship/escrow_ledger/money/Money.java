package com.flagship.escrow_ledger.money;

import com.flagship.escrow_ledger.exception.CurrencyMismatchException;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Immutable monetary amount in a single ISO-4217 currency.
 *
 * Amounts are always held at scale 2 using HALF_UP rounding, so two Money
 * values with the same numeric amount and currency are equal.
 * Combining amounts of different currencies throws {@link CurrencyMismatchException}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Money implements Comparable<Money> {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private static final Pattern CURRENCY_PATTERN = Pattern.compile("^[A-Z]{3}$");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    BigDecimal amount;
    String currency;

    public static Money of(BigDecimal amount, String currency) {
        if (amount == null) {
            throw new InvalidArgumentException("Amount is required");
        }
        return new Money(amount.setScale(SCALE, ROUNDING), normalizeCurrency(currency));
    }

    public static Money of(String amount, String currency) {
        if (amount == null || amount.isBlank()) {
            throw new InvalidArgumentException("Amount is required");
        }
        try {
            return of(new BigDecimal(amount.trim()), currency);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Invalid amount: " + amount, e);
        }
    }

    public static Money zero(String currency) {
        return of(BigDecimal.ZERO, currency);
    }

    /**
     * Validates and upper-cases a currency code.
     *
     * @throws InvalidArgumentException if the code is blank or not three letters
     */
    public static String normalizeCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            throw new InvalidArgumentException("Currency is required");
        }
        String normalized = currency.trim().toUpperCase(Locale.ROOT);
        if (!CURRENCY_PATTERN.matcher(normalized).matches()) {
            throw new InvalidArgumentException("Currency must be a 3-letter ISO code: " + currency);
        }
        return normalized;
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(amount.add(other.amount), currency);
    }

    public Money subtract(Money other) {
        requireSameCurrency(other);
        return new Money(amount.subtract(other.amount), currency);
    }

    /**
     * Returns {@code rate} percent of this amount, rounded to 2 decimals.
     */
    public Money percentage(BigDecimal rate) {
        BigDecimal raw = amount.multiply(rate).divide(HUNDRED, SCALE, ROUNDING);
        return new Money(raw, currency);
    }

    /**
     * Returns this amount scaled by {@code numerator / denominator}, rounded to 2 decimals.
     * A zero denominator yields zero.
     */
    public Money proportion(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return zero(currency);
        }
        BigDecimal raw = amount.multiply(numerator).divide(denominator, SCALE, ROUNDING);
        return new Money(raw, currency);
    }

    public Money min(Money other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public Money negate() {
        return new Money(amount.negate(), currency);
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean isSameCurrency(Money other) {
        return currency.equals(other.currency);
    }

    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other);
        return amount.compareTo(other.amount);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }

    private void requireSameCurrency(Money other) {
        if (other == null) {
            throw new InvalidArgumentException("Amount is required");
        }
        if (!currency.equals(other.currency)) {
            throw new CurrencyMismatchException(currency, other.currency);
        }
    }
}
