package com.flagship.escrow_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_ledger.settlement.SettlementExport;
import com.flagship.escrow_ledger.settlement.SettlementStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SettlementExportResponse {

    @JsonProperty("settlement_number")
    String settlementNumber;

    @JsonProperty("store_id")
    UUID storeId;

    @JsonProperty("period")
    String period;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("gross_sales")
    BigDecimal grossSales;

    @JsonProperty("total_shipping")
    BigDecimal totalShipping;

    @JsonProperty("total_commission")
    BigDecimal totalCommission;

    @JsonProperty("total_refunds")
    BigDecimal totalRefunds;

    @JsonProperty("total_adjustments")
    BigDecimal totalAdjustments;

    @JsonProperty("net_payable")
    BigDecimal netPayable;

    @JsonProperty("order_count")
    int orderCount;

    @JsonProperty("status")
    SettlementStatus status;

    @JsonProperty("generated_at")
    Instant generatedAt;

    @JsonProperty("lines")
    List<Line> lines;

    @Value
    @Builder
    public static class Line {

        @JsonProperty("settlement_number")
        String settlementNumber;

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

        static Line from(SettlementExport.Line line) {
            return Line.builder()
                .settlementNumber(line.getSettlementNumber())
                .orderNumber(line.getOrderNumber())
                .sellerAmount(line.getSellerAmount().getAmount())
                .shippingAmount(line.getShippingAmount().getAmount())
                .commissionAmount(line.getCommissionAmount().getAmount())
                .refundedAmount(line.getRefundedAmount().getAmount())
                .netAmount(line.getNetAmount().getAmount())
                .transactionDate(line.getTransactionDate())
                .build();
        }
    }

    public static SettlementExportResponse from(SettlementExport export) {
        return SettlementExportResponse.builder()
            .settlementNumber(export.getSettlementNumber())
            .storeId(export.getStoreId())
            .period(export.getPeriod())
            .currency(export.getCurrency())
            .grossSales(export.getGrossSales().getAmount())
            .totalShipping(export.getTotalShipping().getAmount())
            .totalCommission(export.getTotalCommission().getAmount())
            .totalRefunds(export.getTotalRefunds().getAmount())
            .totalAdjustments(export.getTotalAdjustments().getAmount())
            .netPayable(export.getNetPayable().getAmount())
            .orderCount(export.getOrderCount())
            .status(export.getStatus())
            .generatedAt(export.getGeneratedAt())
            .lines(export.getLines().stream().map(Line::from).toList())
            .build();
    }
}
