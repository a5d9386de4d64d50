package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.money.Money;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Funds a seller still has in escrow, in one currency.
 *
 * held: allocations waiting for delivery confirmation.
 * eligible: remaining share of allocations that can be paid out.
 * pendingCommission: commission the platform will retain if everything remaining is released.
 */
@Value
public class SellerBalance {
    UUID storeId;
    String currency;
    Money heldAmount;
    Money eligibleAmount;
    Money pendingCommission;
    int openAllocations;

    /**
     * Summarizes open allocations, one balance per currency.
     */
    public static List<SellerBalance> summarize(UUID storeId, List<EscrowAllocation> openAllocations) {
        Map<String, List<EscrowAllocation>> byCurrency = openAllocations.stream()
            .collect(Collectors.groupingBy(EscrowAllocation::getCurrency));

        return byCurrency.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .map(e -> summarize(storeId, e.getKey(), e.getValue()))
            .toList();
    }

    private static SellerBalance summarize(UUID storeId, String currency, List<EscrowAllocation> allocations) {
        Money held = Money.zero(currency);
        Money eligible = Money.zero(currency);
        Money commission = Money.zero(currency);

        for (EscrowAllocation allocation : allocations) {
            Money remaining = allocation.getRemainingShare();
            if (allocation.getStatus() == AllocationStatus.CREATED) {
                held = held.add(remaining);
            } else {
                eligible = eligible.add(remaining);
            }
            commission = commission.add(remaining.percentage(allocation.getCommissionRate()));
        }
        return new SellerBalance(storeId, currency, held, eligible, commission, allocations.size());
    }
}
