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
 * Published when funds are refunded to the buyer.
 */
@Value
public class AllocationRefundedEvent implements EscrowEvent {
    UUID eventId;
    UUID escrowPaymentId;
    UUID allocationId;
    UUID storeId;
    UUID buyerId;
    BigDecimal amount;
    String currency;
    AllocationStatus allocationStatus;
    BigDecimal remainingBalance;
    String refundReference;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AllocationRefunded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AllocationRefundedEvent from(EscrowPayment payment, EscrowAllocation allocation,
                                               Money amount, String refundReference) {
        return new AllocationRefundedEvent(
            UUID.randomUUID(),
            payment.getId(),
            allocation.getId(),
            allocation.getStoreId(),
            payment.getBuyerId(),
            amount.getAmount(),
            amount.getCurrency(),
            allocation.getStatus(),
            payment.getRemainingBalance().getAmount(),
            refundReference,
            Instant.now()
        );
    }
}
