package com.flagship.escrow_ledger.escrow.event;

import com.flagship.escrow_ledger.escrow.AllocationStatus;
import com.flagship.escrow_ledger.escrow.EscrowAllocation;
import com.flagship.escrow_ledger.escrow.EscrowPayment;
import com.flagship.escrow_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when funds are released to a seller.
 *
 * The amount is gross. Commission retained on this release is included so
 * payout processing does not need to recompute it.
 */
@Value
public class AllocationReleasedEvent implements EscrowEvent {
    UUID eventId;
    UUID escrowPaymentId;
    UUID allocationId;
    UUID storeId;
    BigDecimal amount;
    BigDecimal commissionRetained;
    String currency;
    AllocationStatus allocationStatus;
    BigDecimal remainingBalance;
    String payoutReference;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AllocationReleased";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AllocationReleasedEvent from(EscrowPayment payment, EscrowAllocation allocation,
                                               Money amount, String payoutReference) {
        return new AllocationReleasedEvent(
            UUID.randomUUID(),
            payment.getId(),
            allocation.getId(),
            allocation.getStoreId(),
            amount.getAmount(),
            amount.percentage(allocation.getCommissionRate()).getAmount(),
            amount.getCurrency(),
            allocation.getStatus(),
            payment.getRemainingBalance().getAmount(),
            payoutReference,
            Instant.now()
        );
    }
}
