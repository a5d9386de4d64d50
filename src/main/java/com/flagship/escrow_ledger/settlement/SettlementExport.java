package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Flat view of a settlement for the payout file: one header row and one
 * line per settled allocation. Producing it does not change the settlement;
 * {@link SettlementService#markExported} records that the file was sent.
 */
@Value
@Builder
public class SettlementExport {

    String settlementNumber;
    UUID storeId;
    String period;
    String currency;
    Money grossSales;
    Money totalShipping;
    Money totalCommission;
    Money totalRefunds;
    Money totalAdjustments;
    Money netPayable;
    int orderCount;
    SettlementStatus status;
    Instant generatedAt;
    List<Line> lines;

    @Value
    public static class Line {
        String settlementNumber;
        String orderNumber;
        Money sellerAmount;
        Money shippingAmount;
        Money commissionAmount;
        Money refundedAmount;
        Money netAmount;
        Instant transactionDate;

        static Line of(String settlementNumber, SettlementItem item) {
            return new Line(settlementNumber, item.getOrderNumber(), item.getSellerAmount(),
                item.getShippingAmount(), item.getCommissionAmount(), item.getRefundedAmount(),
                item.getNetAmount(), item.getTransactionDate());
        }
    }

    public static SettlementExport of(Settlement settlement, Instant generatedAt) {
        String number = settlement.getSettlementNumber();
        return SettlementExport.builder()
            .settlementNumber(number)
            .storeId(settlement.getStoreId())
            .period(settlement.getPeriod().toString())
            .currency(settlement.getCurrency())
            .grossSales(settlement.getGrossSales())
            .totalShipping(settlement.getTotalShipping())
            .totalCommission(settlement.getTotalCommission())
            .totalRefunds(settlement.getTotalRefunds())
            .totalAdjustments(settlement.getTotalAdjustments())
            .netPayable(settlement.getNetPayable())
            .orderCount(settlement.getOrderCount())
            .status(settlement.getStatus())
            .generatedAt(generatedAt)
            .lines(settlement.getItems().stream()
                .map(item -> Line.of(number, item))
                .toList())
            .build();
    }
}
