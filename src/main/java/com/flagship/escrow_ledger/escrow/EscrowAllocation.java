package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.exception.CurrencyMismatchException;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One seller's share of an escrowed order payment.
 *
 * The gross share ({@code totalAmount}) is the seller's item amount plus the
 * shipping they charged. Commission is taken on the gross share, and the seller
 * payout is what remains after commission.
 *
 * Released and refunded portions are tracked separately. Either may draw the
 * remaining share down until {@code released + refunded == total}.
 *
 * Instances are immutable: every operation returns a new snapshot.
 */
@Value
@Builder(toBuilder = true)
public class EscrowAllocation {

    private static final BigDecimal MAX_RATE = BigDecimal.valueOf(100);

    UUID id;
    UUID escrowPaymentId;
    UUID storeId;
    UUID shipmentId;
    Money sellerAmount;
    Money shippingAmount;
    Money totalAmount;
    BigDecimal commissionRate;
    Money commissionAmount;
    Money sellerPayout;
    Money releasedAmount;
    Money refundedAmount;
    Money refundedCommissionAmount;
    AllocationStatus status;
    String payoutReference;
    String refundReference;
    Instant eligibleAt;
    Instant releasedAt;
    Instant refundedAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new allocation in CREATED status with commission and payout
     * computed from the gross share.
     *
     * @throws InvalidArgumentException if the rate is outside [0, 100] or an amount is negative
     */
    public static EscrowAllocation create(UUID escrowPaymentId, UUID storeId, UUID shipmentId,
                                          Money sellerAmount, Money shippingAmount,
                                          BigDecimal commissionRate) {
        if (escrowPaymentId == null) {
            throw new InvalidArgumentException("Escrow payment ID is required");
        }
        if (storeId == null) {
            throw new InvalidArgumentException("Store ID is required");
        }
        if (sellerAmount == null || shippingAmount == null) {
            throw new InvalidArgumentException("Seller and shipping amounts are required");
        }
        if (sellerAmount.isNegative() || shippingAmount.isNegative()) {
            throw new InvalidArgumentException(
                String.format("Allocation amounts cannot be negative: seller=%s, shipping=%s",
                    sellerAmount, shippingAmount));
        }
        if (commissionRate == null
                || commissionRate.signum() < 0
                || commissionRate.compareTo(MAX_RATE) > 0) {
            throw new InvalidArgumentException(
                "Commission rate must be between 0 and 100, got: " + commissionRate);
        }

        Money total = sellerAmount.add(shippingAmount);
        Money commission = total.percentage(commissionRate);
        Money zero = Money.zero(total.getCurrency());
        Instant now = Instant.now();

        return EscrowAllocation.builder()
            .id(UUID.randomUUID())
            .escrowPaymentId(escrowPaymentId)
            .storeId(storeId)
            .shipmentId(shipmentId)
            .sellerAmount(sellerAmount)
            .shippingAmount(shippingAmount)
            .totalAmount(total)
            .commissionRate(commissionRate)
            .commissionAmount(commission)
            .sellerPayout(total.subtract(commission))
            .releasedAmount(zero)
            .refundedAmount(zero)
            .refundedCommissionAmount(zero)
            .status(AllocationStatus.CREATED)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Creates an allocation whose gross share carries no separate shipping amount.
     */
    public static EscrowAllocation create(UUID escrowPaymentId, UUID storeId,
                                          Money totalAmount, BigDecimal commissionRate) {
        if (totalAmount == null) {
            throw new InvalidArgumentException("Total amount is required");
        }
        return create(escrowPaymentId, storeId, null, totalAmount,
            Money.zero(totalAmount.getCurrency()), commissionRate);
    }

    /**
     * Share not yet released or refunded.
     */
    public Money getRemainingShare() {
        return totalAmount.subtract(releasedAmount).subtract(refundedAmount);
    }

    public String getCurrency() {
        return totalAmount.getCurrency();
    }

    /**
     * Transitions to ELIGIBLE after the matching shipment was delivered.
     *
     * @throws com.flagship.escrow_ledger.exception.InvalidStateTransitionException unless CREATED
     */
    public EscrowAllocation markEligible() {
        AllocationStatus next = status.next(AllocationStatus.Operation.MARK_ELIGIBLE, false);
        Instant now = Instant.now();
        return toBuilder()
            .status(next)
            .eligibleAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Releases part or all of the remaining share to the seller.
     *
     * @param amount gross amount to release
     * @param payoutReference external payout reference, may be null
     * @return new snapshot in PARTIAL_RELEASE or RELEASED status
     */
    public EscrowAllocation release(Money amount, String payoutReference) {
        requireFundsMovable(AllocationStatus.Operation.RELEASE);
        validateMovement(amount, "release");

        Money remainingAfter = getRemainingShare().subtract(amount);
        AllocationStatus next = status.next(AllocationStatus.Operation.RELEASE, remainingAfter.isZero());
        Instant now = Instant.now();

        return toBuilder()
            .releasedAmount(releasedAmount.add(amount))
            .status(next)
            .payoutReference(payoutReference != null ? payoutReference : this.payoutReference)
            .releasedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Refunds part or all of the remaining share to the buyer.
     *
     * Commission is returned proportionally to the refunded amount and never
     * exceeds the commission originally taken.
     *
     * @param amount gross amount to refund
     * @param refundReference external refund reference, may be null
     * @return new snapshot in PARTIAL_REFUND or REFUNDED status
     */
    public EscrowAllocation refund(Money amount, String refundReference) {
        requireFundsMovable(AllocationStatus.Operation.REFUND);
        validateMovement(amount, "refund");

        Money remainingAfter = getRemainingShare().subtract(amount);
        AllocationStatus next = status.next(AllocationStatus.Operation.REFUND, remainingAfter.isZero());

        Money commissionBack = amount.percentage(commissionRate);
        Money refundedCommission = refundedCommissionAmount.add(commissionBack).min(commissionAmount);
        Instant now = Instant.now();

        return toBuilder()
            .refundedAmount(refundedAmount.add(amount))
            .refundedCommissionAmount(refundedCommission)
            .status(next)
            .refundReference(refundReference != null ? refundReference : this.refundReference)
            .refundedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Refunds the whole remaining share to the buyer because the order was cancelled.
     * Unlike {@link #refund}, this does not wait for delivery.
     *
     * @return new snapshot in REFUNDED status
     * @throws com.flagship.escrow_ledger.exception.InvalidStateTransitionException if already RELEASED or REFUNDED
     */
    public EscrowAllocation cancel(String refundReference) {
        AllocationStatus next = status.next(AllocationStatus.Operation.CANCEL, true);
        Money amount = getRemainingShare();

        Money commissionBack = amount.percentage(commissionRate);
        Money refundedCommission = refundedCommissionAmount.add(commissionBack).min(commissionAmount);
        Instant now = Instant.now();

        return toBuilder()
            .refundedAmount(refundedAmount.add(amount))
            .refundedCommissionAmount(refundedCommission)
            .status(next)
            .refundReference(refundReference != null ? refundReference : this.refundReference)
            .refundedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Commission earned on the released portion.
     */
    public Money getEarnedCommission() {
        return releasedAmount.percentage(commissionRate);
    }

    private void requireFundsMovable(AllocationStatus.Operation operation) {
        if (!status.canMoveFunds()) {
            // the transition function rejects with the right message
            status.next(operation, false);
        }
    }

    private void validateMovement(Money amount, String operation) {
        if (amount == null || !amount.isPositive()) {
            throw new InvalidArgumentException(
                String.format("Cannot %s a non-positive amount: %s", operation, amount));
        }
        if (!amount.isSameCurrency(totalAmount)) {
            throw new CurrencyMismatchException(totalAmount.getCurrency(), amount.getCurrency());
        }
        Money remaining = getRemainingShare();
        if (amount.isGreaterThan(remaining)) {
            throw new InvalidArgumentException(
                String.format("Insufficient share on allocation %s: requested %s, remaining %s",
                    id, amount, remaining));
        }
    }
}
