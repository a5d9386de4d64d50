package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Signed correction appended to a closed settlement for activity that
 * belongs to an earlier (or the same) period. Positive amounts are owed to
 * the seller, negative amounts are clawed back.
 */
@Value
public class SettlementAdjustment {

    private static final int MAX_REASON_LENGTH = 500;
    private static final int MAX_ORDER_NUMBER_LENGTH = 50;
    private static final int MAX_CREATED_BY_LENGTH = 100;

    UUID id;
    UUID settlementId;
    int originalYear;
    int originalMonth;
    Money amount;
    String reason;
    UUID relatedOrderId;
    String relatedOrderNumber;
    String createdBy;
    Instant createdAt;

    public static SettlementAdjustment create(UUID settlementId, int originalYear, int originalMonth,
                                              Money amount, String reason, UUID relatedOrderId,
                                              String relatedOrderNumber, String createdBy) {
        if (settlementId == null) {
            throw new InvalidArgumentException("Settlement ID is required");
        }
        Settlement.validatePeriod(originalYear, originalMonth);
        if (amount == null || amount.isZero()) {
            throw new InvalidArgumentException("Adjustment amount must be non-zero");
        }
        if (reason == null || reason.isBlank()) {
            throw new InvalidArgumentException("Adjustment reason is required");
        }
        if (reason.length() > MAX_REASON_LENGTH) {
            throw new InvalidArgumentException("Adjustment reason must be at most " + MAX_REASON_LENGTH + " characters");
        }
        if (relatedOrderNumber != null && relatedOrderNumber.length() > MAX_ORDER_NUMBER_LENGTH) {
            throw new InvalidArgumentException("Order number must be at most " + MAX_ORDER_NUMBER_LENGTH + " characters");
        }

        String by = createdBy == null || createdBy.isBlank() ? "System" : createdBy;
        if (by.length() > MAX_CREATED_BY_LENGTH) {
            by = by.substring(0, MAX_CREATED_BY_LENGTH);
        }

        return new SettlementAdjustment(
            UUID.randomUUID(),
            settlementId,
            originalYear,
            originalMonth,
            amount,
            reason.trim(),
            relatedOrderId,
            relatedOrderNumber,
            by,
            Instant.now()
        );
    }

    public YearMonth getOriginalPeriod() {
        return YearMonth.of(originalYear, originalMonth);
    }

    public boolean isCredit() {
        return amount.isPositive();
    }
}
