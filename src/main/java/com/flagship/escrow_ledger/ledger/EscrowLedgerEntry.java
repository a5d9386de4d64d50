package com.flagship.escrow_ledger.ledger;

import com.flagship.escrow_ledger.escrow.AllocationStatus;
import com.flagship.escrow_ledger.escrow.EscrowAllocation;
import com.flagship.escrow_ledger.escrow.EscrowPayment;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One immutable audit record of a balance-affecting escrow action.
 *
 * Entries are only built through the static factories below, each taking the
 * payment/allocation snapshot after the state change was applied. Amount,
 * balance and timestamp come from that snapshot, so the factories have no
 * dependencies beyond their arguments.
 *
 * Ledger amounts are gross. {@code balanceAfter} is the payment's remaining
 * balance immediately after the action.
 */
@Value
public class EscrowLedgerEntry {

    public static final String DEFAULT_INITIATOR = "System";
    public static final int MAX_NOTES_LENGTH = 500;
    public static final int MAX_REFERENCE_LENGTH = 100;

    UUID id;
    UUID escrowPaymentId;
    UUID allocationId;
    UUID orderId;
    UUID storeId;
    UUID buyerId;
    LedgerAction action;
    BigDecimal amount;
    String currency;
    BigDecimal balanceAfter;
    String externalReference;
    String notes;
    String initiatedBy;
    Instant createdAt;
    Long sequenceNumber;

    public static EscrowLedgerEntry createCreatedEntry(EscrowPayment payment, String initiatedBy) {
        return new EscrowLedgerEntry(
            UUID.randomUUID(),
            payment.getId(),
            null,
            payment.getOrderId(),
            null,
            payment.getBuyerId(),
            LedgerAction.CREATED,
            payment.getTotalAmount().getAmount(),
            payment.getCurrency(),
            payment.getRemainingBalance().getAmount(),
            truncate(payment.getPaymentTransactionId(), MAX_REFERENCE_LENGTH),
            "Escrow created from confirmed payment",
            initiator(initiatedBy),
            payment.getCreatedAt(),
            null
        );
    }

    public static EscrowLedgerEntry createAllocationEntry(EscrowPayment payment, EscrowAllocation allocation,
                                                          String initiatedBy) {
        requireOwned(payment, allocation);
        String notes = String.format("Allocation created for store. Commission: %s (%s%%)",
            allocation.getCommissionAmount(), allocation.getCommissionRate().stripTrailingZeros().toPlainString());
        return forAllocation(payment, allocation, LedgerAction.ALLOCATION_CREATED,
            allocation.getTotalAmount(), null, notes, initiatedBy, allocation.getCreatedAt());
    }

    public static EscrowLedgerEntry createEligibleEntry(EscrowPayment payment, EscrowAllocation allocation,
                                                        String initiatedBy) {
        requireOwned(payment, allocation);
        return forAllocation(payment, allocation, LedgerAction.ALLOCATION_ELIGIBLE,
            allocation.getTotalAmount(), null,
            "Allocation marked eligible for payout after delivery confirmation",
            initiatedBy, allocation.getEligibleAt());
    }

    /**
     * Records a release. The action is RELEASED when the allocation's share is
     * exhausted and PARTIAL_RELEASE otherwise.
     */
    public static EscrowLedgerEntry createReleaseEntry(EscrowPayment payment, EscrowAllocation allocation,
                                                       Money amount, String payoutReference, String initiatedBy) {
        requireOwned(payment, allocation);
        LedgerAction action = allocation.getStatus() == AllocationStatus.RELEASED
            ? LedgerAction.RELEASED
            : LedgerAction.PARTIAL_RELEASE;
        String notes = String.format("Funds released to seller. Commission retained: %s",
            amount.percentage(allocation.getCommissionRate()));
        return forAllocation(payment, allocation, action, amount, payoutReference, notes,
            initiatedBy, allocation.getReleasedAt());
    }

    /**
     * Records a refund. The action is REFUNDED when the allocation's share is
     * exhausted and PARTIAL_REFUND otherwise.
     */
    public static EscrowLedgerEntry createRefundEntry(EscrowPayment payment, EscrowAllocation allocation,
                                                      Money amount, String refundReference, String initiatedBy) {
        requireOwned(payment, allocation);
        LedgerAction action = allocation.getStatus() == AllocationStatus.REFUNDED
            ? LedgerAction.REFUNDED
            : LedgerAction.PARTIAL_REFUND;
        String notes = String.format("Funds refunded to buyer. Commission returned: %s",
            amount.percentage(allocation.getCommissionRate()));
        return forAllocation(payment, allocation, action, amount, refundReference, notes,
            initiatedBy, allocation.getRefundedAt());
    }

    private static EscrowLedgerEntry forAllocation(EscrowPayment payment, EscrowAllocation allocation,
                                                   LedgerAction action, Money amount, String reference,
                                                   String notes, String initiatedBy, Instant occurredAt) {
        return new EscrowLedgerEntry(
            UUID.randomUUID(),
            payment.getId(),
            allocation.getId(),
            payment.getOrderId(),
            allocation.getStoreId(),
            payment.getBuyerId(),
            action,
            amount.getAmount(),
            amount.getCurrency(),
            payment.getRemainingBalance().getAmount(),
            truncate(reference, MAX_REFERENCE_LENGTH),
            truncate(notes, MAX_NOTES_LENGTH),
            initiator(initiatedBy),
            occurredAt != null ? occurredAt : allocation.getUpdatedAt(),
            null
        );
    }

    private static void requireOwned(EscrowPayment payment, EscrowAllocation allocation) {
        if (!payment.getId().equals(allocation.getEscrowPaymentId())) {
            throw new InvalidArgumentException(
                String.format("Allocation %s does not belong to escrow payment %s",
                    allocation.getId(), payment.getId()));
        }
    }

    private static String initiator(String initiatedBy) {
        if (initiatedBy == null || initiatedBy.isBlank()) {
            return DEFAULT_INITIATOR;
        }
        return truncate(initiatedBy.trim(), MAX_REFERENCE_LENGTH);
    }

    static String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
