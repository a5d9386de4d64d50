package com.flagship.escrow_ledger.escrow.event;

import com.flagship.escrow_ledger.escrow.EscrowAllocation;
import com.flagship.escrow_ledger.escrow.EscrowPayment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when an order's confirmed payment is placed in escrow.
 */
@Value
public class EscrowCreatedEvent implements EscrowEvent {
    UUID eventId;
    UUID escrowPaymentId;
    UUID orderId;
    UUID buyerId;
    BigDecimal totalAmount;
    String currency;
    List<AllocationSummary> allocations;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EscrowCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EscrowCreatedEvent fromPayment(EscrowPayment payment) {
        return new EscrowCreatedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getOrderId(),
            payment.getBuyerId(),
            payment.getTotalAmount().getAmount(),
            payment.getCurrency(),
            payment.getAllocations().stream().map(AllocationSummary::from).toList(),
            Instant.now()
        );
    }

    @Value
    public static class AllocationSummary {
        UUID allocationId;
        UUID storeId;
        UUID shipmentId;
        BigDecimal totalAmount;
        BigDecimal commissionAmount;
        BigDecimal sellerPayout;

        static AllocationSummary from(EscrowAllocation allocation) {
            return new AllocationSummary(
                allocation.getId(),
                allocation.getStoreId(),
                allocation.getShipmentId(),
                allocation.getTotalAmount().getAmount(),
                allocation.getCommissionAmount().getAmount(),
                allocation.getSellerPayout().getAmount()
            );
        }
    }
}
