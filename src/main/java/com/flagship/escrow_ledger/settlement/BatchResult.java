package com.flagship.escrow_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Summary of one batch period close across all stores with activity.
 */
@Value
@Builder
public class BatchResult {
    int year;
    int month;
    int storesFound;
    int closed;
    int skipped;
    int failed;
    int cancelled;
    List<UUID> failedStores;
    Duration duration;

    public boolean isComplete() {
        return failed == 0 && cancelled == 0;
    }
}
