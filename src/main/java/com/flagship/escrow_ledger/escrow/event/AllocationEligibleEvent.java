package com.flagship.escrow_ledger.escrow.event;

import com.flagship.escrow_ledger.escrow.EscrowAllocation;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when delivery is confirmed and an allocation can be paid out.
 * Payout schedulers listen for this.
 */
@Value
public class AllocationEligibleEvent implements EscrowEvent {
    UUID eventId;
    UUID escrowPaymentId;
    UUID allocationId;
    UUID storeId;
    UUID shipmentId;
    BigDecimal sellerPayout;
    String currency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AllocationEligible";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AllocationEligibleEvent fromAllocation(EscrowAllocation allocation) {
        return new AllocationEligibleEvent(
            UUID.randomUUID(),
            allocation.getEscrowPaymentId(),
            allocation.getId(),
            allocation.getStoreId(),
            allocation.getShipmentId(),
            allocation.getSellerPayout().getAmount(),
            allocation.getCurrency(),
            Instant.now()
        );
    }
}
