package com.flagship.escrow_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_ledger.escrow.EscrowPayment;
import com.flagship.escrow_ledger.escrow.EscrowPaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for escrow payment operations.
 */
@Value
@Builder
public class EscrowPaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("order_number")
    String orderNumber;

    @JsonProperty("buyer_id")
    UUID buyerId;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("payment_transaction_id")
    String paymentTransactionId;

    @JsonProperty("released_amount")
    BigDecimal releasedAmount;

    @JsonProperty("refunded_amount")
    BigDecimal refundedAmount;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    @JsonProperty("status")
    EscrowPaymentStatus status;

    @JsonProperty("allocations")
    List<AllocationResponse> allocations;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static EscrowPaymentResponse from(EscrowPayment payment) {
        return EscrowPaymentResponse.builder()
            .id(payment.getId())
            .orderId(payment.getOrderId())
            .orderNumber(payment.getOrderNumber())
            .buyerId(payment.getBuyerId())
            .totalAmount(payment.getTotalAmount().getAmount())
            .currency(payment.getCurrency())
            .paymentTransactionId(payment.getPaymentTransactionId())
            .releasedAmount(payment.getReleasedAmount().getAmount())
            .refundedAmount(payment.getRefundedAmount().getAmount())
            .remainingBalance(payment.getRemainingBalance().getAmount())
            .status(payment.getStatus())
            .allocations(payment.getAllocations().stream().map(AllocationResponse::from).toList())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
