package com.flagship.escrow_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_ledger.settlement.Settlement;
import com.flagship.escrow_ledger.settlement.SettlementStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for settlements. Items and adjustments are only included
 * when a single settlement is requested.
 */
@Value
@Builder
public class SettlementResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("store_id")
    UUID storeId;

    @JsonProperty("settlement_number")
    String settlementNumber;

    @JsonProperty("year")
    int year;

    @JsonProperty("month")
    int month;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    SettlementStatus status;

    @JsonProperty("period_start")
    Instant periodStart;

    @JsonProperty("period_end")
    Instant periodEnd;

    @JsonProperty("gross_sales")
    BigDecimal grossSales;

    @JsonProperty("total_shipping")
    BigDecimal totalShipping;

    @JsonProperty("total_commission")
    BigDecimal totalCommission;

    @JsonProperty("total_refunds")
    BigDecimal totalRefunds;

    @JsonProperty("items_net")
    BigDecimal itemsNet;

    @JsonProperty("total_adjustments")
    BigDecimal totalAdjustments;

    @JsonProperty("net_payable")
    BigDecimal netPayable;

    @JsonProperty("order_count")
    int orderCount;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("closed_at")
    Instant closedAt;

    @JsonProperty("approved_at")
    Instant approvedAt;

    @JsonProperty("approved_by")
    String approvedBy;

    @JsonProperty("exported_at")
    Instant exportedAt;

    @JsonProperty("items")
    List<SettlementItemResponse> items;

    @JsonProperty("adjustments")
    List<AdjustmentResponse> adjustments;

    public static SettlementResponse summary(Settlement settlement) {
        return baseBuilder(settlement).build();
    }

    public static SettlementResponse withDetails(Settlement settlement) {
        return baseBuilder(settlement)
            .items(settlement.getItems().stream().map(SettlementItemResponse::from).toList())
            .adjustments(settlement.getAdjustments().stream().map(AdjustmentResponse::from).toList())
            .build();
    }

    private static SettlementResponseBuilder baseBuilder(Settlement settlement) {
        return SettlementResponse.builder()
            .id(settlement.getId())
            .storeId(settlement.getStoreId())
            .settlementNumber(settlement.getSettlementNumber())
            .year(settlement.getYear())
            .month(settlement.getMonth())
            .currency(settlement.getCurrency())
            .status(settlement.getStatus())
            .periodStart(settlement.getPeriodStart())
            .periodEnd(settlement.getPeriodEnd())
            .grossSales(settlement.getGrossSales().getAmount())
            .totalShipping(settlement.getTotalShipping().getAmount())
            .totalCommission(settlement.getTotalCommission().getAmount())
            .totalRefunds(settlement.getTotalRefunds().getAmount())
            .itemsNet(settlement.getItemsNet().getAmount())
            .totalAdjustments(settlement.getTotalAdjustments().getAmount())
            .netPayable(settlement.getNetPayable().getAmount())
            .orderCount(settlement.getOrderCount())
            .notes(settlement.getNotes())
            .closedAt(settlement.getClosedAt())
            .approvedAt(settlement.getApprovedAt())
            .approvedBy(settlement.getApprovedBy())
            .exportedAt(settlement.getExportedAt());
    }
}
