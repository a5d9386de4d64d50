package com.flagship.escrow_ledger.settlement.event;

import com.flagship.escrow_ledger.settlement.Settlement;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a seller's period is closed into a settlement.
 */
@Value
public class SettlementClosedEvent implements SettlementEvent {
    UUID eventId;
    UUID settlementId;
    UUID storeId;
    String settlementNumber;
    int year;
    int month;
    String currency;
    BigDecimal grossSales;
    BigDecimal totalCommission;
    BigDecimal totalRefunds;
    BigDecimal itemsNet;
    int itemCount;
    int orderCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SettlementClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementClosedEvent fromSettlement(Settlement settlement) {
        return new SettlementClosedEvent(
            UUID.randomUUID(),
            settlement.getId(),
            settlement.getStoreId(),
            settlement.getSettlementNumber(),
            settlement.getYear(),
            settlement.getMonth(),
            settlement.getCurrency(),
            settlement.getGrossSales().getAmount(),
            settlement.getTotalCommission().getAmount(),
            settlement.getTotalRefunds().getAmount(),
            settlement.getItemsNet().getAmount(),
            settlement.getItems().size(),
            settlement.getOrderCount(),
            Instant.now()
        );
    }
}
