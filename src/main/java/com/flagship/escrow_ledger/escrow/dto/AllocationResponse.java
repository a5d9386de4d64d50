package com.flagship.escrow_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_ledger.escrow.AllocationStatus;
import com.flagship.escrow_ledger.escrow.EscrowAllocation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AllocationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("escrow_payment_id")
    UUID escrowPaymentId;

    @JsonProperty("store_id")
    UUID storeId;

    @JsonProperty("shipment_id")
    UUID shipmentId;

    @JsonProperty("seller_amount")
    BigDecimal sellerAmount;

    @JsonProperty("shipping_amount")
    BigDecimal shippingAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("commission_rate")
    BigDecimal commissionRate;

    @JsonProperty("commission_amount")
    BigDecimal commissionAmount;

    @JsonProperty("seller_payout")
    BigDecimal sellerPayout;

    @JsonProperty("released_amount")
    BigDecimal releasedAmount;

    @JsonProperty("refunded_amount")
    BigDecimal refundedAmount;

    @JsonProperty("remaining_share")
    BigDecimal remainingShare;

    @JsonProperty("status")
    AllocationStatus status;

    @JsonProperty("payout_reference")
    String payoutReference;

    @JsonProperty("refund_reference")
    String refundReference;

    @JsonProperty("eligible_at")
    Instant eligibleAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AllocationResponse from(EscrowAllocation allocation) {
        return AllocationResponse.builder()
            .id(allocation.getId())
            .escrowPaymentId(allocation.getEscrowPaymentId())
            .storeId(allocation.getStoreId())
            .shipmentId(allocation.getShipmentId())
            .sellerAmount(allocation.getSellerAmount().getAmount())
            .shippingAmount(allocation.getShippingAmount().getAmount())
            .totalAmount(allocation.getTotalAmount().getAmount())
            .commissionRate(allocation.getCommissionRate())
            .commissionAmount(allocation.getCommissionAmount().getAmount())
            .sellerPayout(allocation.getSellerPayout().getAmount())
            .releasedAmount(allocation.getReleasedAmount().getAmount())
            .refundedAmount(allocation.getRefundedAmount().getAmount())
            .remainingShare(allocation.getRemainingShare().getAmount())
            .status(allocation.getStatus())
            .payoutReference(allocation.getPayoutReference())
            .refundReference(allocation.getRefundReference())
            .eligibleAt(allocation.getEligibleAt())
            .createdAt(allocation.getCreatedAt())
            .updatedAt(allocation.getUpdatedAt())
            .build();
    }
}
