package com.flagship.escrow_ledger.ledger;

import com.flagship.escrow_ledger.exception.CurrencyMismatchException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Totals reconstructed purely from a payment's ledger entries, in ledger order.
 */
@Value
public class LedgerReplay {
    UUID escrowPaymentId;
    String currency;
    BigDecimal collectedAmount;
    BigDecimal releasedAmount;
    BigDecimal refundedAmount;
    BigDecimal lastBalanceAfter;
    int entryCount;

    /**
     * Replays entries that are already ordered by (createdAt, sequenceNumber).
     *
     * @throws CurrencyMismatchException if entries disagree on currency
     */
    public static LedgerReplay replay(UUID escrowPaymentId, List<EscrowLedgerEntry> entries) {
        String currency = null;
        BigDecimal collected = BigDecimal.ZERO;
        BigDecimal released = BigDecimal.ZERO;
        BigDecimal refunded = BigDecimal.ZERO;
        BigDecimal lastBalance = null;

        for (EscrowLedgerEntry entry : entries) {
            if (currency == null) {
                currency = entry.getCurrency();
            } else if (!currency.equals(entry.getCurrency())) {
                throw new CurrencyMismatchException(currency, entry.getCurrency());
            }

            if (entry.getAction() == LedgerAction.CREATED) {
                collected = collected.add(entry.getAmount());
            } else if (entry.getAction().isRelease()) {
                released = released.add(entry.getAmount());
            } else if (entry.getAction().isRefund()) {
                refunded = refunded.add(entry.getAmount());
            }
            lastBalance = entry.getBalanceAfter();
        }

        return new LedgerReplay(escrowPaymentId, currency, collected, released, refunded,
            lastBalance, entries.size());
    }

    /**
     * Balance implied by the replayed movements.
     */
    public BigDecimal getComputedBalance() {
        return collectedAmount.subtract(releasedAmount).subtract(refundedAmount);
    }
}
