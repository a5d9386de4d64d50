package com.flagship.escrow_ledger.money;

import com.flagship.escrow_ledger.exception.CurrencyMismatchException;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Money")
class MoneyTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Amounts are normalized to scale 2 with HALF_UP rounding")
        void normalizesScale() {
            assertEquals(new BigDecimal("10.00"), Money.of("10", "USD").getAmount());
            assertEquals(new BigDecimal("10.13"), Money.of("10.125", "USD").getAmount());
            assertEquals(new BigDecimal("10.12"), Money.of("10.124", "USD").getAmount());
        }

        @Test
        @DisplayName("Equal amounts with different scales are equal")
        void equalityIgnoresInputScale() {
            assertEquals(Money.of("5", "EUR"), Money.of(new BigDecimal("5.000"), "EUR"));
        }

        @Test
        @DisplayName("Currency is trimmed and upper-cased")
        void normalizesCurrency() {
            assertEquals("USD", Money.of("1.00", " usd ").getCurrency());
        }

        @Test
        @DisplayName("Invalid currency codes are rejected")
        void rejectsInvalidCurrency() {
            assertThrows(InvalidArgumentException.class, () -> Money.of("1.00", "US"));
            assertThrows(InvalidArgumentException.class, () -> Money.of("1.00", "US1"));
            assertThrows(InvalidArgumentException.class, () -> Money.of("1.00", null));
        }

        @Test
        @DisplayName("Unparseable amounts are rejected")
        void rejectsUnparseableAmount() {
            assertThrows(InvalidArgumentException.class, () -> Money.of("ten", "USD"));
            assertThrows(InvalidArgumentException.class, () -> Money.of(" ", "USD"));
            assertThrows(InvalidArgumentException.class, () -> Money.of((BigDecimal) null, "USD"));
        }
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("add and subtract keep the currency")
        void addAndSubtract() {
            Money total = Money.of("100.00", "USD");

            Money result = total.subtract(Money.of("30.50", "USD")).add(Money.of("0.50", "USD"));

            assertEquals(Money.of("70.00", "USD"), result);
        }

        @Test
        @DisplayName("Mixing currencies throws CurrencyMismatchException")
        void mixingCurrenciesFails() {
            Money usd = Money.of("10.00", "USD");
            Money eur = Money.of("10.00", "EUR");

            CurrencyMismatchException e = assertThrows(CurrencyMismatchException.class, () -> usd.add(eur));
            assertEquals("USD", e.getExpected());
            assertEquals("EUR", e.getActual());
            assertThrows(CurrencyMismatchException.class, () -> usd.compareTo(eur));
        }

        @Test
        @DisplayName("percentage rounds half up to cents")
        void percentage() {
            assertEquals(Money.of("10.00", "USD"), Money.of("100.00", "USD").percentage(new BigDecimal("10")));
            assertEquals(Money.of("0.13", "USD"), Money.of("1.25", "USD").percentage(new BigDecimal("10")));
        }

        @Test
        @DisplayName("proportion scales by a ratio and treats a zero denominator as zero")
        void proportion() {
            Money gross = Money.of("60.00", "USD");

            assertEquals(Money.of("10.00", "USD"),
                gross.proportion(new BigDecimal("20.00"), new BigDecimal("120.00")));
            assertTrue(gross.proportion(BigDecimal.ONE, BigDecimal.ZERO).isZero());
        }

        @Test
        @DisplayName("Sign checks")
        void signChecks() {
            assertTrue(Money.zero("USD").isZero());
            assertTrue(Money.of("0.01", "USD").isPositive());
            assertTrue(Money.of("0.01", "USD").negate().isNegative());
            assertTrue(Money.of("2.00", "USD").isGreaterThan(Money.of("1.99", "USD")));
            assertEquals(Money.of("1.99", "USD"), Money.of("2.00", "USD").min(Money.of("1.99", "USD")));
        }
    }

    @Test
    @DisplayName("toString shows plain amount and currency")
    void toStringFormat() {
        assertEquals("1500.00 USD", Money.of("1.5E3", "USD").toString());
    }
}
