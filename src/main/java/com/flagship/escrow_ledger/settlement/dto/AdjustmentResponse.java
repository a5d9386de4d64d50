package com.flagship.escrow_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_ledger.settlement.SettlementAdjustment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AdjustmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("settlement_id")
    UUID settlementId;

    @JsonProperty("original_year")
    int originalYear;

    @JsonProperty("original_month")
    int originalMonth;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("related_order_id")
    UUID relatedOrderId;

    @JsonProperty("related_order_number")
    String relatedOrderNumber;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AdjustmentResponse from(SettlementAdjustment adjustment) {
        return AdjustmentResponse.builder()
            .id(adjustment.getId())
            .settlementId(adjustment.getSettlementId())
            .originalYear(adjustment.getOriginalYear())
            .originalMonth(adjustment.getOriginalMonth())
            .amount(adjustment.getAmount().getAmount())
            .currency(adjustment.getAmount().getCurrency())
            .reason(adjustment.getReason())
            .relatedOrderId(adjustment.getRelatedOrderId())
            .relatedOrderNumber(adjustment.getRelatedOrderNumber())
            .createdBy(adjustment.getCreatedBy())
            .createdAt(adjustment.getCreatedAt())
            .build();
    }
}
