package com.flagship.escrow_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_ledger.settlement.SettlementItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementItemResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("escrow_allocation_id")
    UUID escrowAllocationId;

    @JsonProperty("shipment_id")
    UUID shipmentId;

    @JsonProperty("order_number")
    String orderNumber;

    @JsonProperty("seller_amount")
    BigDecimal sellerAmount;

    @JsonProperty("shipping_amount")
    BigDecimal shippingAmount;

    @JsonProperty("commission_amount")
    BigDecimal commissionAmount;

    @JsonProperty("refunded_amount")
    BigDecimal refundedAmount;

    @JsonProperty("net_amount")
    BigDecimal netAmount;

    @JsonProperty("transaction_date")
    Instant transactionDate;

    public static SettlementItemResponse from(SettlementItem item) {
        return SettlementItemResponse.builder()
            .id(item.getId())
            .escrowAllocationId(item.getEscrowAllocationId())
            .shipmentId(item.getShipmentId())
            .orderNumber(item.getOrderNumber())
            .sellerAmount(item.getSellerAmount().getAmount())
            .shippingAmount(item.getShippingAmount().getAmount())
            .commissionAmount(item.getCommissionAmount().getAmount())
            .refundedAmount(item.getRefundedAmount().getAmount())
            .netAmount(item.getNetAmount().getAmount())
            .transactionDate(item.getTransactionDate())
            .build();
    }
}
