package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.money.Money;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Totals over all stores' settlements of one period.
 *
 * Net payable is summed per currency; settlements in different currencies
 * are never added together.
 */
@Value
public class SettlementSummary {

    int year;
    int month;
    int totalSettlements;
    Map<SettlementStatus, Integer> countByStatus;
    Map<String, Money> netPayableByCurrency;

    public static SettlementSummary of(int year, int month, List<Settlement> settlements) {
        Map<SettlementStatus, Integer> counts = new EnumMap<>(SettlementStatus.class);
        for (SettlementStatus status : SettlementStatus.values()) {
            counts.put(status, 0);
        }
        Map<String, Money> netPayable = new TreeMap<>();

        for (Settlement settlement : settlements) {
            counts.merge(settlement.getStatus(), 1, Integer::sum);
            netPayable.merge(settlement.getCurrency(), settlement.getNetPayable(), Money::add);
        }
        return new SettlementSummary(year, month, settlements.size(), Collections.unmodifiableMap(counts),
            Collections.unmodifiableMap(netPayable));
    }

    public int getCount(SettlementStatus status) {
        return countByStatus.getOrDefault(status, 0);
    }
}
