package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the Settlement aggregate and its three tables.
 *
 * Items are written once together with their settlement. Adjustments are
 * appended one at a time and never rewritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementPersistenceService {

    private final SettlementRepository settlementRepository;
    private final SettlementItemRepository itemRepository;
    private final SettlementAdjustmentRepository adjustmentRepository;

    @Transactional
    public Settlement save(Settlement settlement) {
        SettlementEntity saved = settlementRepository.saveAndFlush(SettlementEntity.fromDomain(settlement));
        itemRepository.saveAll(settlement.getItems().stream()
            .map(SettlementItemEntity::fromDomain)
            .toList());
        itemRepository.flush();
        log.debug("Saved settlement {} with {} items", saved.getSettlementNumber(), settlement.getItems().size());
        return saved.toDomain(settlement.getItems(), settlement.getAdjustments());
    }

    /**
     * Writes lifecycle changes (status, approval, export, notes).
     *
     * @throws ObjectOptimisticLockingFailureException if another writer changed the settlement first
     */
    @Transactional
    public Settlement update(Settlement settlement) {
        SettlementEntity existing = settlementRepository.findById(settlement.getId())
            .orElseThrow(() -> NotFoundException.of("Settlement", settlement.getId()));

        if (!Objects.equals(existing.getVersion(), settlement.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(SettlementEntity.class, settlement.getId());
        }

        existing.updateFromDomain(settlement);
        SettlementEntity updated = settlementRepository.saveAndFlush(existing);
        log.debug("Updated settlement {} to status {}", updated.getSettlementNumber(), updated.getStatus());
        return updated.toDomain(settlement.getItems(), settlement.getAdjustments());
    }

    @Transactional
    public SettlementAdjustment appendAdjustment(SettlementAdjustment adjustment) {
        SettlementAdjustmentEntity saved = adjustmentRepository.saveAndFlush(
            SettlementAdjustmentEntity.fromDomain(adjustment));
        return saved.toDomain(adjustment.getAmount().getCurrency());
    }

    @Transactional(readOnly = true)
    public Optional<Settlement> findById(UUID settlementId) {
        return settlementRepository.findById(settlementId).map(this::assemble);
    }

    @Transactional(readOnly = true)
    public Optional<Settlement> findByStoreAndPeriod(UUID storeId, int year, int month) {
        return settlementRepository.findByStoreIdAndSettlementYearAndSettlementMonth(storeId, year, month)
            .map(this::assemble);
    }

    /**
     * Settlements of a store, newest period first.
     */
    @Transactional(readOnly = true)
    public List<Settlement> findByStore(UUID storeId) {
        return settlementRepository.findByStoreIdOrderBySettlementYearDescSettlementMonthDesc(storeId)
            .stream()
            .map(this::assemble)
            .toList();
    }

    /**
     * Settlements of every store for one period, by settlement number.
     */
    @Transactional(readOnly = true)
    public List<Settlement> findByPeriod(int year, int month) {
        return settlementRepository.findBySettlementYearAndSettlementMonthOrderBySettlementNumberAsc(year, month)
            .stream()
            .map(this::assemble)
            .toList();
    }

    private Settlement assemble(SettlementEntity entity) {
        String currency = entity.getCurrency();
        List<SettlementItem> items = itemRepository.findBySettlementIdOrderByTransactionDateAsc(entity.getId())
            .stream()
            .map(i -> i.toDomain(currency))
            .toList();
        List<SettlementAdjustment> adjustments = adjustmentRepository.findBySettlementIdOrderByCreatedAtAsc(entity.getId())
            .stream()
            .map(a -> a.toDomain(currency))
            .toList();
        return entity.toDomain(items, adjustments);
    }
}
