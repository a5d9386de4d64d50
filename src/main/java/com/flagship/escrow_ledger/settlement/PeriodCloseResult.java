package com.flagship.escrow_ledger.settlement;

import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of closing one store's period.
 */
@Value
public class PeriodCloseResult {

    public enum Outcome {
        CLOSED,
        ALREADY_CLOSED,
        NO_DATA
    }

    UUID storeId;
    int year;
    int month;
    Outcome outcome;
    Settlement settlement;

    public static PeriodCloseResult closed(Settlement settlement) {
        return new PeriodCloseResult(settlement.getStoreId(), settlement.getYear(), settlement.getMonth(),
            Outcome.CLOSED, settlement);
    }

    public static PeriodCloseResult alreadyClosed(Settlement settlement) {
        return new PeriodCloseResult(settlement.getStoreId(), settlement.getYear(), settlement.getMonth(),
            Outcome.ALREADY_CLOSED, settlement);
    }

    public static PeriodCloseResult noData(UUID storeId, int year, int month) {
        return new PeriodCloseResult(storeId, year, month, Outcome.NO_DATA, null);
    }

    public Optional<Settlement> getSettlementIfPresent() {
        return Optional.ofNullable(settlement);
    }
}
