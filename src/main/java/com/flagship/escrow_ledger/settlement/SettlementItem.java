package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.escrow.EscrowAllocation;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.ledger.EscrowLedgerEntry;
import com.flagship.escrow_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One allocation's fund movements within a settlement period.
 *
 * Amounts are gross movements split into seller and shipping parts in the
 * allocation's original proportion. Commission is only earned on released
 * funds, so {@code netAmount} equals released minus commission.
 */
@Value
public class SettlementItem {
    UUID id;
    UUID settlementId;
    UUID escrowAllocationId;
    UUID shipmentId;
    String orderNumber;
    Money sellerAmount;
    Money shippingAmount;
    Money commissionAmount;
    Money refundedAmount;
    Money netAmount;
    Instant transactionDate;
    Instant createdAt;

    /**
     * Folds an allocation's release and refund entries for the period into one item.
     *
     * @param movements ledger entries of the allocation, all RELEASED/PARTIAL_RELEASE/REFUNDED/PARTIAL_REFUND
     * @throws InvalidArgumentException if there are no movements or one belongs to another allocation
     */
    public static SettlementItem fromMovements(UUID settlementId, EscrowAllocation allocation, String orderNumber,
                                               List<EscrowLedgerEntry> movements) {
        if (movements == null || movements.isEmpty()) {
            throw new InvalidArgumentException("Settlement item needs at least one movement");
        }

        String currency = allocation.getCurrency();
        Money released = Money.zero(currency);
        Money refunded = Money.zero(currency);
        Instant lastMovement = null;

        for (EscrowLedgerEntry entry : movements) {
            if (!allocation.getId().equals(entry.getAllocationId())) {
                throw new InvalidArgumentException(String.format(
                    "Ledger entry %s belongs to allocation %s, not %s",
                    entry.getId(), entry.getAllocationId(), allocation.getId()));
            }
            Money amount = Money.of(entry.getAmount(), entry.getCurrency());
            if (entry.getAction().isRelease()) {
                released = released.add(amount);
            } else if (entry.getAction().isRefund()) {
                refunded = refunded.add(amount);
            } else {
                throw new InvalidArgumentException("Ledger entry " + entry.getId() + " does not move funds");
            }
            if (lastMovement == null || entry.getCreatedAt().isAfter(lastMovement)) {
                lastMovement = entry.getCreatedAt();
            }
        }

        Money gross = released.add(refunded);
        Money shipping = gross.proportion(allocation.getShippingAmount().getAmount(),
            allocation.getTotalAmount().getAmount());
        Money seller = gross.subtract(shipping);
        Money commission = released.percentage(allocation.getCommissionRate());
        Money net = seller.add(shipping).subtract(commission).subtract(refunded);

        return new SettlementItem(
            UUID.randomUUID(),
            settlementId,
            allocation.getId(),
            allocation.getShipmentId(),
            orderNumber,
            seller,
            shipping,
            commission,
            refunded,
            net,
            lastMovement,
            Instant.now()
        );
    }

    public String getCurrency() {
        return netAmount.getCurrency();
    }

    public Money getGrossAmount() {
        return sellerAmount.add(shippingAmount);
    }
}
