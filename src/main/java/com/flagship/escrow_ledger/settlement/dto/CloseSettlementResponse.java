package com.flagship.escrow_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_ledger.settlement.PeriodCloseResult;
import lombok.Value;

import java.util.UUID;

@Value
public class CloseSettlementResponse {

    @JsonProperty("store_id")
    UUID storeId;

    @JsonProperty("year")
    int year;

    @JsonProperty("month")
    int month;

    @JsonProperty("outcome")
    PeriodCloseResult.Outcome outcome;

    @JsonProperty("settlement")
    SettlementResponse settlement;

    public static CloseSettlementResponse from(PeriodCloseResult result) {
        return new CloseSettlementResponse(
            result.getStoreId(),
            result.getYear(),
            result.getMonth(),
            result.getOutcome(),
            result.getSettlementIfPresent().map(SettlementResponse::withDetails).orElse(null)
        );
    }
}
