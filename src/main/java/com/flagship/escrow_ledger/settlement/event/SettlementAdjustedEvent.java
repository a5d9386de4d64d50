package com.flagship.escrow_ledger.settlement.event;

import com.flagship.escrow_ledger.settlement.Settlement;
import com.flagship.escrow_ledger.settlement.SettlementAdjustment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a correction is appended to a closed settlement.
 * Carries the settlement's net payable after the adjustment.
 */
@Value
public class SettlementAdjustedEvent implements SettlementEvent {
    UUID eventId;
    UUID settlementId;
    UUID adjustmentId;
    UUID storeId;
    int originalYear;
    int originalMonth;
    BigDecimal amount;
    String currency;
    String reason;
    UUID relatedOrderId;
    BigDecimal netPayable;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SettlementAdjusted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementAdjustedEvent from(Settlement settlement, SettlementAdjustment adjustment) {
        return new SettlementAdjustedEvent(
            UUID.randomUUID(),
            settlement.getId(),
            adjustment.getId(),
            settlement.getStoreId(),
            adjustment.getOriginalYear(),
            adjustment.getOriginalMonth(),
            adjustment.getAmount().getAmount(),
            adjustment.getAmount().getCurrency(),
            adjustment.getReason(),
            adjustment.getRelatedOrderId(),
            settlement.getNetPayable().getAmount(),
            Instant.now()
        );
    }
}
