package com.flagship.escrow_ledger.ledger;

import com.flagship.escrow_ledger.escrow.EscrowPayment;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Comparison of a payment's stored totals against its ledger replay.
 */
@Value
public class ReconciliationResult {
    UUID escrowPaymentId;
    BigDecimal storedReleased;
    BigDecimal ledgerReleased;
    BigDecimal storedRefunded;
    BigDecimal ledgerRefunded;
    BigDecimal storedBalance;
    BigDecimal ledgerBalance;
    int entryCount;
    List<String> discrepancies;

    public static ReconciliationResult compare(EscrowPayment payment, LedgerReplay replay) {
        List<String> discrepancies = new ArrayList<>();

        BigDecimal storedReleased = payment.getReleasedAmount().getAmount();
        BigDecimal storedRefunded = payment.getRefundedAmount().getAmount();
        BigDecimal storedBalance = payment.getRemainingBalance().getAmount();

        if (replay.getEntryCount() == 0) {
            discrepancies.add("No ledger entries recorded for escrow payment");
        } else {
            if (replay.getCurrency() != null && !replay.getCurrency().equals(payment.getCurrency())) {
                discrepancies.add(String.format("Currency: stored %s, ledger %s",
                    payment.getCurrency(), replay.getCurrency()));
            }
            if (replay.getCollectedAmount().compareTo(payment.getTotalAmount().getAmount()) != 0) {
                discrepancies.add(String.format("Collected: stored %s, ledger %s",
                    payment.getTotalAmount().getAmount(), replay.getCollectedAmount()));
            }
            if (replay.getReleasedAmount().compareTo(storedReleased) != 0) {
                discrepancies.add(String.format("Released: stored %s, ledger %s",
                    storedReleased, replay.getReleasedAmount()));
            }
            if (replay.getRefundedAmount().compareTo(storedRefunded) != 0) {
                discrepancies.add(String.format("Refunded: stored %s, ledger %s",
                    storedRefunded, replay.getRefundedAmount()));
            }
            if (replay.getLastBalanceAfter().compareTo(storedBalance) != 0) {
                discrepancies.add(String.format("Balance: stored %s, last ledger entry %s",
                    storedBalance, replay.getLastBalanceAfter()));
            }
            if (replay.getComputedBalance().compareTo(storedBalance) != 0) {
                discrepancies.add(String.format("Balance: stored %s, replayed movements %s",
                    storedBalance, replay.getComputedBalance()));
            }
        }

        return new ReconciliationResult(
            payment.getId(),
            storedReleased,
            replay.getReleasedAmount(),
            storedRefunded,
            replay.getRefundedAmount(),
            storedBalance,
            replay.getLastBalanceAfter(),
            replay.getEntryCount(),
            List.copyOf(discrepancies)
        );
    }

    public boolean isConsistent() {
        return discrepancies.isEmpty();
    }
}
