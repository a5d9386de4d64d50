package com.flagship.escrow_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_ledger.settlement.SettlementStatus;
import com.flagship.escrow_ledger.settlement.SettlementSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class SettlementSummaryResponse {

    @JsonProperty("year")
    int year;

    @JsonProperty("month")
    int month;

    @JsonProperty("total_settlements")
    int totalSettlements;

    @JsonProperty("closed")
    int closed;

    @JsonProperty("approved")
    int approved;

    @JsonProperty("exported")
    int exported;

    @JsonProperty("net_payable_by_currency")
    Map<String, BigDecimal> netPayableByCurrency;

    public static SettlementSummaryResponse from(SettlementSummary summary) {
        Map<String, BigDecimal> netPayable = new LinkedHashMap<>();
        summary.getNetPayableByCurrency().forEach((currency, amount) -> netPayable.put(currency, amount.getAmount()));

        return SettlementSummaryResponse.builder()
            .year(summary.getYear())
            .month(summary.getMonth())
            .totalSettlements(summary.getTotalSettlements())
            .closed(summary.getCount(SettlementStatus.CLOSED))
            .approved(summary.getCount(SettlementStatus.APPROVED))
            .exported(summary.getCount(SettlementStatus.EXPORTED))
            .netPayableByCurrency(netPayable)
            .build();
    }
}
