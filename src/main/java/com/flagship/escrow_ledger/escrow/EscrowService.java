package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.escrow.event.AllocationEligibleEvent;
import com.flagship.escrow_ledger.escrow.event.AllocationRefundedEvent;
import com.flagship.escrow_ledger.escrow.event.AllocationReleasedEvent;
import com.flagship.escrow_ledger.escrow.event.EscrowCreatedEvent;
import com.flagship.escrow_ledger.exception.CurrencyMismatchException;
import com.flagship.escrow_ledger.exception.InsufficientEscrowBalanceException;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.exception.InvalidStateTransitionException;
import com.flagship.escrow_ledger.exception.NotFoundException;
import com.flagship.escrow_ledger.ledger.EscrowLedgerEntry;
import com.flagship.escrow_ledger.ledger.EscrowLedgerService;
import com.flagship.escrow_ledger.ledger.LedgerReplay;
import com.flagship.escrow_ledger.ledger.ReconciliationResult;
import com.flagship.escrow_ledger.money.Money;
import com.flagship.escrow_ledger.observability.CorrelationContext;
import com.flagship.escrow_ledger.observability.EscrowMetrics;
import com.flagship.escrow_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Application service for the escrow lifecycle.
 *
 * Every mutation runs through {@link EscrowCoordinator}, which holds the
 * payment's lock across load, domain transition, persistence, ledger append
 * and outbox write. The state change, its ledger entry and its event commit
 * together or not at all.
 *
 * Flow:
 * 1. onOrderPaymentConfirmed: escrow the order total and fan out one allocation per seller
 * 2. onShipmentDelivered: mark the shipment's allocation eligible
 * 3. requestRelease / requestRefund: move part or all of an allocation's remaining share
 * 4. refundOrder: the order was cancelled, refund everything still held to the buyer
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowService {

    public static final String AGGREGATE_TYPE = "EscrowPayment";

    private final EscrowPersistenceService persistenceService;
    private final EscrowLedgerService ledgerService;
    private final EscrowCoordinator coordinator;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final EscrowMetrics metrics;

    public EscrowPayment onOrderPaymentConfirmed(UUID orderId, UUID buyerId, BigDecimal totalAmount,
                                                 String currency, String paymentTransactionId,
                                                 List<SellerShare> sellerShares) {
        return onOrderPaymentConfirmed(orderId, null, buyerId, totalAmount, currency,
            paymentTransactionId, sellerShares, null);
    }

    /**
     * Places a confirmed order payment in escrow and creates one allocation per seller share.
     *
     * Idempotent per order: if the order was already escrowed, the existing
     * payment is returned unchanged.
     *
     * @throws InvalidArgumentException if an ID is missing, an amount or rate is out of range,
     *         or the shares do not add up to the total
     */
    public EscrowPayment onOrderPaymentConfirmed(UUID orderId, String orderNumber, UUID buyerId,
                                                 BigDecimal totalAmount, String currency,
                                                 String paymentTransactionId, List<SellerShare> sellerShares,
                                                 String initiatedBy) {
        long startTime = System.currentTimeMillis();
        log.info("Escrowing confirmed payment: orderId={}, amount={} {}, sellers={}",
                orderId, totalAmount, currency, sellerShares != null ? sellerShares.size() : 0);

        try {
            if (sellerShares == null || sellerShares.isEmpty()) {
                throw new InvalidArgumentException("At least one seller share is required");
            }

            Optional<EscrowPayment> existing = findExisting(orderId);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Order already escrowed, returning existing escrow payment: escrowPaymentId={}",
                        existing.get().getId());
                return existing.get();
            }
            metrics.recordIdempotencyMiss();

            Money total = Money.of(totalAmount, currency);

            // Keyed by order: the escrow payment does not exist yet
            EscrowPayment created = coordinator.execute(orderId, () -> {
                Optional<EscrowPayment> raced = persistenceService.findByOrderId(orderId);
                if (raced.isPresent()) {
                    return raced.get();
                }

                EscrowPayment payment = EscrowPayment.create(orderId, orderNumber, buyerId, total,
                    paymentTransactionId);
                for (SellerShare share : sellerShares) {
                    payment = payment.addAllocation(toAllocation(payment, share));
                }
                payment.requireFullyAllocated();

                EscrowPayment saved = persistenceService.save(payment);

                List<EscrowLedgerEntry> entries = new ArrayList<>();
                entries.add(EscrowLedgerEntry.createCreatedEntry(payment, initiatedBy));
                for (EscrowAllocation allocation : payment.getAllocations()) {
                    entries.add(EscrowLedgerEntry.createAllocationEntry(payment, allocation, initiatedBy));
                }
                ledgerService.appendAll(entries);

                outboxService.saveEvent(AGGREGATE_TYPE, saved.getId(),
                        EscrowCreatedEvent.EVENT_TYPE, EscrowCreatedEvent.fromPayment(saved));
                return saved;
            });

            idempotencyService.rememberEscrowForOrder(orderId, created.getId());

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEscrowCreated(created.getCurrency(), "success");
            metrics.recordLatency("create", duration);
            log.info("Escrow created: escrowPaymentId={}, orderId={}, allocations={}, duration={}ms",
                    created.getId(), orderId, created.getAllocations().size(), duration);
            return created;

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordEscrowCreated(currency, "error");
            metrics.recordLatency("create", duration);
            log.warn("Escrow creation failed: orderId={}, error={}, duration={}ms", orderId, e.getMessage(), duration);
            throw e;
        }
    }

    /**
     * Marks an allocation eligible for payout after its shipment was delivered.
     *
     * @throws com.flagship.escrow_ledger.exception.InvalidStateTransitionException unless the allocation is CREATED
     */
    public EscrowAllocation onShipmentDelivered(UUID allocationId) {
        return onShipmentDelivered(allocationId, null);
    }

    public EscrowAllocation onShipmentDelivered(UUID allocationId, String initiatedBy) {
        UUID escrowPaymentId = resolvePaymentId(allocationId);
        return mutate(escrowPaymentId, "mark_eligible", () -> {
            EscrowPayment payment = load(escrowPaymentId);
            EscrowPayment updated = payment.markEligible(allocationId);
            persistenceService.update(updated);

            EscrowAllocation allocation = updated.getAllocation(allocationId);
            ledgerService.append(EscrowLedgerEntry.createEligibleEntry(updated, allocation, initiatedBy));
            outboxService.saveEvent(AGGREGATE_TYPE, escrowPaymentId,
                    AllocationEligibleEvent.EVENT_TYPE, AllocationEligibleEvent.fromAllocation(allocation));

            log.info("Allocation eligible for payout: allocationId={}, storeId={}, payout={}",
                    allocationId, allocation.getStoreId(), allocation.getSellerPayout());
            return allocation;
        });
    }

    /**
     * Marks every allocation of a delivered shipment eligible. Allocations that
     * are already past CREATED are skipped, so replaying a delivery is harmless.
     *
     * @return allocations that became eligible by this call
     */
    public List<EscrowAllocation> onShipmentDeliveredByShipment(UUID shipmentId, String initiatedBy) {
        if (shipmentId == null) {
            throw new InvalidArgumentException("Shipment ID is required");
        }
        List<EscrowAllocation> changed = new ArrayList<>();
        for (EscrowAllocationEntity candidate : persistenceService.findAllocationsByShipment(shipmentId)) {
            if (candidate.getStatus() != AllocationStatus.CREATED) {
                log.info("Allocation {} for shipment {} already {}, skipping",
                        candidate.getId(), shipmentId, candidate.getStatus());
                continue;
            }
            changed.add(onShipmentDelivered(candidate.getId(), initiatedBy));
        }
        if (changed.isEmpty()) {
            log.info("No allocation became eligible for delivered shipment {}", shipmentId);
        }
        return changed;
    }

    public EscrowPayment requestRelease(UUID allocationId, BigDecimal amount, String payoutReference) {
        return requestRelease(allocationId, amount, null, payoutReference, null);
    }

    /**
     * Releases funds from an allocation to its seller.
     *
     * @param amount gross amount, or null to release the whole remaining share
     * @param currency currency of {@code amount}, or null to use the payment's currency
     * @return the escrow payment after the release
     * @throws InvalidArgumentException if the amount is not positive or exceeds the remaining share
     * @throws com.flagship.escrow_ledger.exception.InvalidStateTransitionException if the allocation cannot release
     * @throws com.flagship.escrow_ledger.exception.ContentionException if the payment is busy
     */
    public EscrowPayment requestRelease(UUID allocationId, BigDecimal amount, String currency,
                                        String payoutReference, String initiatedBy) {
        UUID escrowPaymentId = resolvePaymentId(allocationId);
        return mutate(escrowPaymentId, "release", () -> {
            EscrowPayment payment = load(escrowPaymentId);
            Money requested = resolveAmount(payment, allocationId, amount, currency);

            EscrowPayment updated = payment.applyRelease(allocationId, requested, payoutReference);
            EscrowPayment saved = persistenceService.update(updated);

            EscrowAllocation allocation = updated.getAllocation(allocationId);
            ledgerService.append(EscrowLedgerEntry.createReleaseEntry(
                updated, allocation, requested, payoutReference, initiatedBy));
            outboxService.saveEvent(AGGREGATE_TYPE, escrowPaymentId, AllocationReleasedEvent.EVENT_TYPE,
                    AllocationReleasedEvent.from(updated, allocation, requested, payoutReference));

            metrics.recordFundsMoved("release", requested.getCurrency(), allocation.getStatus().isTerminal());
            log.info("Released {} from allocation {}: status={}, remainingBalance={}",
                    requested, allocationId, allocation.getStatus(), updated.getRemainingBalance());
            return saved;
        });
    }

    public EscrowPayment requestRefund(UUID allocationId, BigDecimal amount, String refundReference) {
        return requestRefund(allocationId, amount, null, refundReference, null);
    }

    /**
     * Refunds funds from an allocation to the buyer.
     *
     * @param amount gross amount, or null to refund the whole remaining share
     * @param currency currency of {@code amount}, or null to use the payment's currency
     * @return the escrow payment after the refund
     */
    public EscrowPayment requestRefund(UUID allocationId, BigDecimal amount, String currency,
                                       String refundReference, String initiatedBy) {
        UUID escrowPaymentId = resolvePaymentId(allocationId);
        return mutate(escrowPaymentId, "refund", () -> {
            EscrowPayment payment = load(escrowPaymentId);
            Money requested = resolveAmount(payment, allocationId, amount, currency);

            EscrowPayment updated = payment.applyRefund(allocationId, requested, refundReference);
            EscrowPayment saved = persistenceService.update(updated);

            EscrowAllocation allocation = updated.getAllocation(allocationId);
            ledgerService.append(EscrowLedgerEntry.createRefundEntry(
                updated, allocation, requested, refundReference, initiatedBy));
            outboxService.saveEvent(AGGREGATE_TYPE, escrowPaymentId, AllocationRefundedEvent.EVENT_TYPE,
                    AllocationRefundedEvent.from(updated, allocation, requested, refundReference));

            metrics.recordFundsMoved("refund", requested.getCurrency(), allocation.getStatus().isTerminal());
            log.info("Refunded {} from allocation {}: status={}, remainingBalance={}",
                    requested, allocationId, allocation.getStatus(), updated.getRemainingBalance());
            return saved;
        });
    }

    /**
     * Refunds everything still held for an order to the buyer after the order was cancelled.
     *
     * All open allocations, delivered or not, are refunded in full under one lock
     * and in one transaction, with one ledger entry and one event each.
     * Allocations already released or refunded keep their state, so repeating
     * the call changes nothing.
     *
     * @return the escrow payment after the refund
     * @throws NotFoundException if the order was never escrowed
     * @throws InvalidStateTransitionException if the whole escrow was already released to sellers
     */
    public EscrowPayment refundOrder(UUID orderId, String refundReference, String initiatedBy) {
        if (orderId == null) {
            throw new InvalidArgumentException("Order ID is required");
        }
        UUID escrowPaymentId = getByOrderId(orderId).getId();
        return mutate(escrowPaymentId, "refund_order", () -> {
            EscrowPayment payment = load(escrowPaymentId);
            if (payment.getStatus() == EscrowPaymentStatus.RELEASED) {
                throw new InvalidStateTransitionException(payment.getStatus().name(), "REFUND_ORDER",
                    "Cannot refund an escrow that was fully released to its sellers.");
            }

            List<EscrowAllocation> open = payment.getCancellableAllocations();
            if (open.isEmpty()) {
                log.info("Nothing left to refund for order {}: status={}", orderId, payment.getStatus());
                return payment;
            }

            EscrowPayment updated = payment;
            for (EscrowAllocation candidate : open) {
                Money amount = candidate.getRemainingShare();
                updated = updated.applyCancellation(candidate.getId(), refundReference);

                EscrowAllocation allocation = updated.getAllocation(candidate.getId());
                ledgerService.append(EscrowLedgerEntry.createRefundEntry(
                    updated, allocation, amount, refundReference, initiatedBy));
                outboxService.saveEvent(AGGREGATE_TYPE, escrowPaymentId, AllocationRefundedEvent.EVENT_TYPE,
                        AllocationRefundedEvent.from(updated, allocation, amount, refundReference));
                metrics.recordFundsMoved("refund", amount.getCurrency(), true);
            }
            EscrowPayment saved = persistenceService.update(updated);

            log.info("Refunded order {}: allocations={}, refunded={}, status={}",
                    orderId, open.size(), saved.getRefundedAmount(), saved.getStatus());
            return saved;
        });
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public EscrowPayment getEscrowPayment(UUID escrowPaymentId) {
        return load(escrowPaymentId);
    }

    @Transactional(readOnly = true)
    public Optional<EscrowPayment> findByOrderId(UUID orderId) {
        return persistenceService.findByOrderId(orderId);
    }

    @Transactional(readOnly = true)
    public EscrowPayment getByOrderId(UUID orderId) {
        return findByOrderId(orderId)
            .orElseThrow(() -> new NotFoundException("No escrow payment for order " + orderId));
    }

    /**
     * Ledger of an escrow payment, ordered by (createdAt, sequenceNumber).
     */
    @Transactional(readOnly = true)
    public List<EscrowLedgerEntry> getLedger(UUID escrowPaymentId) {
        requireExists(escrowPaymentId);
        return ledgerService.findByEscrowPaymentId(escrowPaymentId);
    }

    @Transactional(readOnly = true)
    public Money getRemainingBalance(UUID escrowPaymentId) {
        return load(escrowPaymentId).getRemainingBalance();
    }

    /**
     * Replays the ledger and compares it with the stored running totals.
     */
    @Transactional(readOnly = true)
    public ReconciliationResult reconcile(UUID escrowPaymentId) {
        EscrowPayment payment = load(escrowPaymentId);
        List<EscrowLedgerEntry> entries = ledgerService.findByEscrowPaymentId(escrowPaymentId);
        ReconciliationResult result = ReconciliationResult.compare(payment, LedgerReplay.replay(escrowPaymentId, entries));

        if (result.isConsistent()) {
            log.debug("Escrow payment {} reconciles with {} ledger entries", escrowPaymentId, entries.size());
        } else {
            metrics.recordIntegrityViolation();
            log.error("Escrow payment {} does not reconcile with its ledger: {}",
                    escrowPaymentId, result.getDiscrepancies());
        }
        return result;
    }

    @Transactional(readOnly = true)
    public List<SellerBalance> getSellerBalance(UUID storeId) {
        if (storeId == null) {
            throw new InvalidArgumentException("Store ID is required");
        }
        return SellerBalance.summarize(storeId, persistenceService.findOpenAllocationsForStore(storeId));
    }

    // ==================== Helpers ====================

    private <T> T mutate(UUID escrowPaymentId, String operation, Supplier<T> body) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ESCROW_PAYMENT_ID_MDC_KEY, escrowPaymentId.toString());
        try {
            T result = coordinator.execute(escrowPaymentId, body);
            metrics.recordOperation(operation, "success");
            return result;

        } catch (InsufficientEscrowBalanceException e) {
            metrics.recordOperation(operation, "integrity_violation");
            metrics.recordIntegrityViolation();
            log.error("Escrow balance guard tripped during {}: {}", operation, e.getMessage(), e);
            throw e;

        } catch (Exception e) {
            metrics.recordOperation(operation, e.getClass().getSimpleName());
            log.warn("Escrow {} rejected: error={}", operation, e.getMessage());
            throw e;

        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.ESCROW_PAYMENT_ID_MDC_KEY);
        }
    }

    private Optional<EscrowPayment> findExisting(UUID orderId) {
        if (orderId == null) {
            throw new InvalidArgumentException("Order ID is required");
        }
        return idempotencyService.findEscrowForOrder(orderId)
            .flatMap(persistenceService::findById);
    }

    private EscrowAllocation toAllocation(EscrowPayment payment, SellerShare share) {
        if (share == null) {
            throw new InvalidArgumentException("Seller share cannot be null");
        }
        BigDecimal shipping = share.getShippingAmount() != null ? share.getShippingAmount() : BigDecimal.ZERO;
        return EscrowAllocation.create(
            payment.getId(),
            share.getStoreId(),
            share.getShipmentId(),
            Money.of(share.getSellerAmount(), payment.getCurrency()),
            Money.of(shipping, payment.getCurrency()),
            share.getCommissionRate()
        );
    }

    private Money resolveAmount(EscrowPayment payment, UUID allocationId, BigDecimal amount, String currency) {
        if (currency != null && !Money.normalizeCurrency(currency).equals(payment.getCurrency())) {
            throw new CurrencyMismatchException(payment.getCurrency(), Money.normalizeCurrency(currency));
        }
        if (amount == null) {
            return payment.getAllocation(allocationId).getRemainingShare();
        }
        return Money.of(amount, payment.getCurrency());
    }

    private UUID resolvePaymentId(UUID allocationId) {
        if (allocationId == null) {
            throw new InvalidArgumentException("Allocation ID is required");
        }
        return persistenceService.findEscrowPaymentIdByAllocation(allocationId)
            .orElseThrow(() -> NotFoundException.of("Escrow allocation", allocationId));
    }

    private EscrowPayment load(UUID escrowPaymentId) {
        return persistenceService.findById(escrowPaymentId)
            .orElseThrow(() -> NotFoundException.of("Escrow payment", escrowPaymentId));
    }

    private void requireExists(UUID escrowPaymentId) {
        load(escrowPaymentId);
    }
}
