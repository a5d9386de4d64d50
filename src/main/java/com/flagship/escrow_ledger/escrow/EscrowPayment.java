package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.exception.CurrencyMismatchException;
import com.flagship.escrow_ledger.exception.InsufficientEscrowBalanceException;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.exception.InvalidStateTransitionException;
import com.flagship.escrow_ledger.exception.NotFoundException;
import com.flagship.escrow_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Escrowed payment for one order, the aggregate root over its seller allocations.
 *
 * Key invariants:
 * - 0 <= released + refunded <= total
 * - once fully allocated, the allocation totals add up to the payment total
 * - released/refunded totals only change through an allocation release or refund
 *
 * Instances are immutable. Mutating operations return a new snapshot that the
 * caller persists together with the matching ledger entry.
 */
@Value
@Builder(toBuilder = true)
public class EscrowPayment {

    public static final int MAX_ORDER_NUMBER_LENGTH = 50;
    public static final int MAX_PAYMENT_TRANSACTION_ID_LENGTH = 100;

    UUID id;
    UUID orderId;
    String orderNumber;
    UUID buyerId;
    Money totalAmount;
    String paymentTransactionId;
    Money releasedAmount;
    Money refundedAmount;
    EscrowPaymentStatus status;
    List<EscrowAllocation> allocations;
    Instant createdAt;
    Instant updatedAt;
    Long version;

    /**
     * Creates a new escrow payment in HELD status with no allocations.
     *
     * @throws InvalidArgumentException if an identifier is missing or too long, or the total is not positive
     */
    public static EscrowPayment create(UUID orderId, String orderNumber, UUID buyerId,
                                       Money totalAmount, String paymentTransactionId) {
        if (orderId == null) {
            throw new InvalidArgumentException("Order ID is required");
        }
        if (buyerId == null) {
            throw new InvalidArgumentException("Buyer ID is required");
        }
        if (paymentTransactionId == null || paymentTransactionId.isBlank()) {
            throw new InvalidArgumentException("Payment transaction ID is required");
        }
        if (totalAmount == null || !totalAmount.isPositive()) {
            throw new InvalidArgumentException("Escrow total must be greater than zero, got: " + totalAmount);
        }
        String transactionId = paymentTransactionId.trim();
        if (transactionId.length() > MAX_PAYMENT_TRANSACTION_ID_LENGTH) {
            throw new InvalidArgumentException(String.format(
                "Payment transaction ID must be at most %d characters, got %d",
                MAX_PAYMENT_TRANSACTION_ID_LENGTH, transactionId.length()));
        }
        String number = orderNumber == null || orderNumber.isBlank() ? orderId.toString() : orderNumber.trim();
        if (number.length() > MAX_ORDER_NUMBER_LENGTH) {
            throw new InvalidArgumentException(String.format(
                "Order number must be at most %d characters, got %d", MAX_ORDER_NUMBER_LENGTH, number.length()));
        }

        Money zero = Money.zero(totalAmount.getCurrency());
        Instant now = Instant.now();
        return EscrowPayment.builder()
            .id(UUID.randomUUID())
            .orderId(orderId)
            .orderNumber(number)
            .buyerId(buyerId)
            .totalAmount(totalAmount)
            .paymentTransactionId(transactionId)
            .releasedAmount(zero)
            .refundedAmount(zero)
            .status(EscrowPaymentStatus.HELD)
            .allocations(List.of())
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public String getCurrency() {
        return totalAmount.getCurrency();
    }

    /**
     * Amount still held: total minus everything released or refunded.
     */
    public Money getRemainingBalance() {
        return totalAmount.subtract(releasedAmount).subtract(refundedAmount);
    }

    public Money getAllocatedAmount() {
        return allocations.stream()
            .map(EscrowAllocation::getTotalAmount)
            .reduce(Money.zero(getCurrency()), Money::add);
    }

    public EscrowAllocation getAllocation(UUID allocationId) {
        return findAllocation(allocationId)
            .orElseThrow(() -> new NotFoundException(
                String.format("Allocation %s not found on escrow payment %s", allocationId, id)));
    }

    public Optional<EscrowAllocation> findAllocation(UUID allocationId) {
        return allocations.stream()
            .filter(a -> a.getId().equals(allocationId))
            .findFirst();
    }

    public Optional<EscrowAllocation> findAllocationByShipment(UUID shipmentId) {
        return allocations.stream()
            .filter(a -> shipmentId != null && shipmentId.equals(a.getShipmentId()))
            .findFirst();
    }

    /**
     * Adds a seller allocation. Only allowed while nothing has been released or refunded.
     *
     * @throws InvalidStateTransitionException if funds have already moved
     * @throws InvalidArgumentException on a duplicate shipment or if the allocation overshoots the total
     */
    public EscrowPayment addAllocation(EscrowAllocation allocation) {
        if (status != EscrowPaymentStatus.HELD || !releasedAmount.isZero() || !refundedAmount.isZero()) {
            throw new InvalidStateTransitionException(status.name(), "ADD_ALLOCATION",
                String.format("Cannot add allocation to escrow payment in %s status. "
                    + "Allocations are fixed once funds have moved.", status));
        }
        if (!id.equals(allocation.getEscrowPaymentId())) {
            throw new InvalidArgumentException(
                String.format("Allocation belongs to escrow payment %s, not %s",
                    allocation.getEscrowPaymentId(), id));
        }
        if (!allocation.getTotalAmount().isSameCurrency(totalAmount)) {
            throw new CurrencyMismatchException(getCurrency(), allocation.getCurrency());
        }
        if (allocation.getShipmentId() != null && findAllocationByShipment(allocation.getShipmentId()).isPresent()) {
            throw new InvalidArgumentException(
                "An allocation already exists for shipment " + allocation.getShipmentId());
        }
        Money allocatedAfter = getAllocatedAmount().add(allocation.getTotalAmount());
        if (allocatedAfter.isGreaterThan(totalAmount)) {
            throw new InvalidArgumentException(
                String.format("Allocations (%s) would exceed escrow total (%s)", allocatedAfter, totalAmount));
        }

        List<EscrowAllocation> updated = new ArrayList<>(allocations);
        updated.add(allocation);
        return toBuilder()
            .allocations(List.copyOf(updated))
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Verifies that the allocations partition the total exactly.
     *
     * @throws InvalidArgumentException if the allocation totals differ from the payment total
     */
    public void requireFullyAllocated() {
        Money allocated = getAllocatedAmount();
        if (allocated.compareTo(totalAmount) != 0) {
            throw new InvalidArgumentException(
                String.format("Seller shares (%s) must add up to the escrow total (%s)", allocated, totalAmount));
        }
    }

    public EscrowPayment markEligible(UUID allocationId) {
        return replaceAllocation(allocationId, EscrowAllocation::markEligible)
            .toBuilder()
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Releases {@code amount} from one allocation to its seller.
     *
     * @throws InvalidArgumentException if the amount is not positive or exceeds the allocation's remaining share
     * @throws InvalidStateTransitionException if the allocation cannot release funds in its status
     * @throws InsufficientEscrowBalanceException if the payment balance cannot cover the amount
     */
    public EscrowPayment applyRelease(UUID allocationId, Money amount, String payoutReference) {
        EscrowPayment next = replaceAllocation(allocationId, a -> a.release(amount, payoutReference));
        requireBalanceCovers(amount);
        return next.withTotals(releasedAmount.add(amount), refundedAmount);
    }

    /**
     * Refunds {@code amount} from one allocation to the buyer.
     *
     * @throws InvalidArgumentException if the amount is not positive or exceeds the allocation's remaining share
     * @throws InvalidStateTransitionException if the allocation cannot refund funds in its status
     * @throws InsufficientEscrowBalanceException if the payment balance cannot cover the amount
     */
    public EscrowPayment applyRefund(UUID allocationId, Money amount, String refundReference) {
        EscrowPayment next = replaceAllocation(allocationId, a -> a.refund(amount, refundReference));
        requireBalanceCovers(amount);
        return next.withTotals(releasedAmount, refundedAmount.add(amount));
    }

    /**
     * Refunds one allocation's whole remaining share after the order was cancelled.
     *
     * @throws InvalidStateTransitionException if the allocation is already RELEASED or REFUNDED
     * @throws InsufficientEscrowBalanceException if the payment balance cannot cover the share
     */
    public EscrowPayment applyCancellation(UUID allocationId, String refundReference) {
        Money amount = getAllocation(allocationId).getRemainingShare();
        EscrowPayment next = replaceAllocation(allocationId, a -> a.cancel(refundReference));
        requireBalanceCovers(amount);
        return next.withTotals(releasedAmount, refundedAmount.add(amount));
    }

    /**
     * Allocations a cancellation still has to refund: not terminal and holding funds.
     */
    public List<EscrowAllocation> getCancellableAllocations() {
        return allocations.stream()
            .filter(a -> !a.getStatus().isTerminal() && a.getRemainingShare().isPositive())
            .toList();
    }

    private void requireBalanceCovers(Money amount) {
        Money remaining = getRemainingBalance();
        if (amount.isGreaterThan(remaining)) {
            throw new InsufficientEscrowBalanceException(id, amount.getAmount(), remaining.getAmount());
        }
    }

    private EscrowPayment withTotals(Money released, Money refunded) {
        return toBuilder()
            .releasedAmount(released)
            .refundedAmount(refunded)
            .status(deriveStatus(totalAmount, released, refunded))
            .updatedAt(Instant.now())
            .build();
    }

    private EscrowPayment replaceAllocation(UUID allocationId, UnaryOperator<EscrowAllocation> change) {
        EscrowAllocation current = getAllocation(allocationId);
        EscrowAllocation changed = change.apply(current);
        List<EscrowAllocation> updated = allocations.stream()
            .map(a -> Objects.equals(a.getId(), allocationId) ? changed : a)
            .toList();
        return toBuilder().allocations(updated).build();
    }

    static EscrowPaymentStatus deriveStatus(Money total, Money released, Money refunded) {
        if (released.isZero() && refunded.isZero()) {
            return EscrowPaymentStatus.HELD;
        }
        Money remaining = total.subtract(released).subtract(refunded);
        if (!remaining.isZero()) {
            return EscrowPaymentStatus.PARTIALLY_RELEASED;
        }
        if (refunded.isZero()) {
            return EscrowPaymentStatus.RELEASED;
        }
        if (released.isZero()) {
            return EscrowPaymentStatus.REFUNDED;
        }
        return EscrowPaymentStatus.COMPLETED;
    }
}
