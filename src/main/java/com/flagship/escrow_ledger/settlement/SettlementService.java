package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.escrow.EscrowAllocation;
import com.flagship.escrow_ledger.escrow.EscrowPayment;
import com.flagship.escrow_ledger.escrow.EscrowPersistenceService;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.exception.NotFoundException;
import com.flagship.escrow_ledger.ledger.EscrowLedgerEntry;
import com.flagship.escrow_ledger.ledger.EscrowLedgerService;
import com.flagship.escrow_ledger.money.Money;
import com.flagship.escrow_ledger.observability.CorrelationContext;
import com.flagship.escrow_ledger.observability.EscrowMetrics;
import com.flagship.escrow_ledger.outbox.OutboxService;
import com.flagship.escrow_ledger.settlement.event.SettlementAdjustedEvent;
import com.flagship.escrow_ledger.settlement.event.SettlementClosedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Application service for monthly seller settlements.
 *
 * Closing a period folds the store's release and refund ledger entries into
 * one settlement item per allocation. The settlement and all of its items are
 * written in a single transaction: either the whole period is settled or
 * nothing is.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    public static final String AGGREGATE_TYPE = "Settlement";

    private final SettlementPersistenceService persistenceService;
    private final EscrowLedgerService ledgerService;
    private final EscrowPersistenceService escrowPersistenceService;
    private final OutboxService outboxService;
    private final EscrowMetrics metrics;
    private final Clock clock;

    @Transactional
    public PeriodCloseResult closeSettlementPeriod(UUID storeId, int year, int month) {
        return closeSettlementPeriod(storeId, year, month, () -> false);
    }

    /**
     * Closes a store's period into a settlement.
     *
     * Idempotent: an existing settlement for (store, year, month) is returned unchanged.
     * Only completed months can be closed; movements of a closed month are final.
     *
     * @param cancelled checked between items; when it turns true the close aborts and rolls back
     * @throws InvalidArgumentException if the period is invalid, has not ended yet,
     *         or the store moved funds in more than one currency
     * @throws CancellationException if the close was cancelled before it committed
     */
    @Transactional
    public PeriodCloseResult closeSettlementPeriod(UUID storeId, int year, int month, BooleanSupplier cancelled) {
        long startTime = System.currentTimeMillis();
        if (storeId == null) {
            throw new InvalidArgumentException("Store ID is required");
        }
        Settlement.validatePeriod(year, month);

        log.info("Closing settlement period: storeId={}, period={}-{}", storeId, year, String.format("%02d", month));

        try {
            Instant periodStart = Settlement.periodStart(year, month);
            Instant periodEnd = Settlement.periodEnd(year, month);
            if (periodEnd.isAfter(clock.instant())) {
                throw new InvalidArgumentException(String.format(
                    "Period %d-%02d has not ended yet, it can be closed from %s", year, month, periodEnd));
            }

            var existing = persistenceService.findByStoreAndPeriod(storeId, year, month);
            if (existing.isPresent()) {
                metrics.recordSettlementClosed("already_closed");
                log.info("Settlement {} already exists for period, returning it", existing.get().getSettlementNumber());
                return PeriodCloseResult.alreadyClosed(existing.get());
            }

            List<EscrowLedgerEntry> movements = ledgerService.findMovementsForStore(storeId, periodStart, periodEnd);
            if (movements.isEmpty()) {
                metrics.recordSettlementClosed("no_data");
                log.info("No escrow movements for store {} in {}-{}", storeId, year, String.format("%02d", month));
                return PeriodCloseResult.noData(storeId, year, month);
            }

            UUID settlementId = UUID.randomUUID();
            MDC.put(CorrelationContext.SETTLEMENT_ID_MDC_KEY, settlementId.toString());

            List<SettlementItem> items = buildItems(settlementId, storeId, movements, cancelled);
            requireSingleCurrency(storeId, items);
            checkCancelled(cancelled, storeId);

            Settlement settlement = persistenceService.save(Settlement.close(settlementId, storeId, year, month, items));
            outboxService.saveEvent(AGGREGATE_TYPE, settlement.getId(),
                    SettlementClosedEvent.EVENT_TYPE, SettlementClosedEvent.fromSettlement(settlement));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSettlementClosed("closed");
            metrics.recordPeriodCloseDuration(Duration.ofMillis(duration));
            log.info("Settlement closed: number={}, items={}, itemsNet={}, duration={}ms",
                    settlement.getSettlementNumber(), items.size(), settlement.getItemsNet(), duration);
            return PeriodCloseResult.closed(settlement);

        } catch (CancellationException e) {
            metrics.recordSettlementClosed("cancelled");
            log.warn("Settlement close cancelled: storeId={}, period={}-{}", storeId, year, month);
            throw e;

        } catch (Exception e) {
            metrics.recordSettlementClosed("error");
            log.error("Settlement close failed: storeId={}, period={}-{}, error={}",
                    storeId, year, month, e.getMessage());
            throw e;

        } finally {
            MDC.remove(CorrelationContext.SETTLEMENT_ID_MDC_KEY);
        }
    }

    /**
     * Appends a signed correction to a settlement.
     *
     * @throws InvalidArgumentException if the amount is zero, the reason is missing,
     *         or the original period is later than the settlement's
     */
    @Transactional
    public SettlementAdjustment recordAdjustment(UUID settlementId, int originalYear, int originalMonth,
                                                 BigDecimal amount, String reason, UUID relatedOrderId,
                                                 String relatedOrderNumber, String createdBy) {
        MDC.put(CorrelationContext.SETTLEMENT_ID_MDC_KEY, String.valueOf(settlementId));
        try {
            Settlement settlement = load(settlementId);
            if (amount == null) {
                throw new InvalidArgumentException("Adjustment amount is required");
            }

            SettlementAdjustment adjustment = SettlementAdjustment.create(settlementId, originalYear, originalMonth,
                Money.of(amount, settlement.getCurrency()), reason, relatedOrderId, relatedOrderNumber, createdBy);
            Settlement adjusted = settlement.withAdjustment(adjustment);

            SettlementAdjustment saved = persistenceService.appendAdjustment(adjustment);
            outboxService.saveEvent(AGGREGATE_TYPE, settlementId,
                    SettlementAdjustedEvent.EVENT_TYPE, SettlementAdjustedEvent.from(adjusted, saved));

            metrics.recordAdjustment(saved.isCredit() ? "credit" : "debit");
            log.info("Adjustment recorded on settlement {}: amount={}, original period={}, netPayable={}",
                    settlement.getSettlementNumber(), saved.getAmount(), saved.getOriginalPeriod(),
                    adjusted.getNetPayable());
            return saved;

        } catch (Exception e) {
            log.warn("Adjustment rejected: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.SETTLEMENT_ID_MDC_KEY);
        }
    }

    @Transactional
    public Settlement approve(UUID settlementId, String approvedBy) {
        Settlement approved = persistenceService.update(load(settlementId).approve(approvedBy));
        log.info("Settlement {} approved by {}", approved.getSettlementNumber(), approvedBy);
        return approved;
    }

    @Transactional
    public Settlement markExported(UUID settlementId) {
        Settlement exported = persistenceService.update(load(settlementId).markExported());
        log.info("Settlement {} exported", exported.getSettlementNumber());
        return exported;
    }

    @Transactional
    public Settlement updateNotes(UUID settlementId, String notes) {
        return persistenceService.update(load(settlementId).withNotes(notes));
    }

    @Transactional(readOnly = true)
    public Settlement getSettlement(UUID settlementId) {
        return load(settlementId);
    }

    @Transactional(readOnly = true)
    public List<Settlement> getSettlementsForStore(UUID storeId) {
        if (storeId == null) {
            throw new InvalidArgumentException("Store ID is required");
        }
        return persistenceService.findByStore(storeId);
    }

    /**
     * Header and lines of the payout file for a settlement.
     */
    @Transactional(readOnly = true)
    public SettlementExport getExport(UUID settlementId) {
        SettlementExport export = SettlementExport.of(load(settlementId), clock.instant());
        log.debug("Export built for settlement {}: lines={}, netPayable={}",
                export.getSettlementNumber(), export.getLines().size(), export.getNetPayable());
        return export;
    }

    @Transactional(readOnly = true)
    public SettlementSummary getSummary(int year, int month) {
        Settlement.validatePeriod(year, month);
        return SettlementSummary.of(year, month, persistenceService.findByPeriod(year, month));
    }

    private List<SettlementItem> buildItems(UUID settlementId, UUID storeId, List<EscrowLedgerEntry> movements,
                                            BooleanSupplier cancelled) {
        Map<UUID, List<EscrowLedgerEntry>> byAllocation = new LinkedHashMap<>();
        for (EscrowLedgerEntry entry : movements) {
            byAllocation.computeIfAbsent(entry.getAllocationId(), id -> new ArrayList<>()).add(entry);
        }

        Map<UUID, EscrowPayment> payments = new HashMap<>();
        List<SettlementItem> items = new ArrayList<>();
        for (Map.Entry<UUID, List<EscrowLedgerEntry>> group : byAllocation.entrySet()) {
            checkCancelled(cancelled, storeId);

            UUID paymentId = group.getValue().get(0).getEscrowPaymentId();
            EscrowPayment payment = payments.computeIfAbsent(paymentId, id -> escrowPersistenceService.findById(id)
                .orElseThrow(() -> NotFoundException.of("Escrow payment", id)));
            EscrowAllocation allocation = payment.getAllocation(group.getKey());

            items.add(SettlementItem.fromMovements(settlementId, allocation, payment.getOrderNumber(), group.getValue()));
        }
        return items;
    }

    private void requireSingleCurrency(UUID storeId, List<SettlementItem> items) {
        List<String> currencies = items.stream().map(SettlementItem::getCurrency).distinct().toList();
        if (currencies.size() > 1) {
            throw new InvalidArgumentException(String.format(
                "Store %s moved funds in several currencies %s; a settlement covers one currency", storeId, currencies));
        }
    }

    private void checkCancelled(BooleanSupplier cancelled, UUID storeId) {
        if (cancelled.getAsBoolean()) {
            throw new CancellationException("Settlement close cancelled for store " + storeId);
        }
    }

    private Settlement load(UUID settlementId) {
        if (settlementId == null) {
            throw new InvalidArgumentException("Settlement ID is required");
        }
        return persistenceService.findById(settlementId)
            .orElseThrow(() -> NotFoundException.of("Settlement", settlementId));
    }
}
