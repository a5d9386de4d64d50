package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bridges the EscrowPayment aggregate and its two tables.
 *
 * The aggregate is always written as a whole: the payment row plus every
 * allocation row. Updates are flushed immediately so version conflicts surface
 * while the caller still holds the aggregate's lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowPersistenceService {

    private final EscrowPaymentRepository paymentRepository;
    private final EscrowAllocationRepository allocationRepository;

    /**
     * Inserts a new escrow payment with its allocations.
     *
     * @return the stored aggregate, carrying its initial version
     */
    @Transactional
    public EscrowPayment save(EscrowPayment payment) {
        EscrowPaymentEntity saved = paymentRepository.saveAndFlush(EscrowPaymentEntity.fromDomain(payment));
        List<EscrowAllocationEntity> allocations = allocationRepository.saveAll(
            payment.getAllocations().stream()
                .map(EscrowAllocationEntity::fromDomain)
                .toList());
        log.debug("Saved escrow payment {} with {} allocations", saved.getId(), allocations.size());
        return assemble(saved, allocations);
    }

    /**
     * Writes the mutable state of an existing aggregate.
     *
     * @param payment snapshot derived from the version currently stored
     * @throws ObjectOptimisticLockingFailureException if another writer changed the payment first
     */
    @Transactional
    public EscrowPayment update(EscrowPayment payment) {
        EscrowPaymentEntity existing = paymentRepository.findById(payment.getId())
            .orElseThrow(() -> NotFoundException.of("Escrow payment", payment.getId()));

        if (!Objects.equals(existing.getVersion(), payment.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(EscrowPaymentEntity.class, payment.getId());
        }

        existing.updateFromDomain(payment);

        Map<UUID, EscrowAllocationEntity> stored = allocationRepository
            .findByEscrowPaymentIdOrderByCreatedAtAsc(payment.getId())
            .stream()
            .collect(Collectors.toMap(EscrowAllocationEntity::getId, Function.identity()));

        for (EscrowAllocation allocation : payment.getAllocations()) {
            EscrowAllocationEntity entity = stored.get(allocation.getId());
            if (entity == null) {
                throw NotFoundException.of("Escrow allocation", allocation.getId());
            }
            entity.updateFromDomain(allocation);
        }

        EscrowPaymentEntity updated = paymentRepository.saveAndFlush(existing);
        allocationRepository.flush();
        log.debug("Updated escrow payment {} to version {}", updated.getId(), updated.getVersion());
        return assemble(updated, List.copyOf(stored.values()));
    }

    @Transactional(readOnly = true)
    public Optional<EscrowPayment> findById(UUID escrowPaymentId) {
        return paymentRepository.findById(escrowPaymentId)
            .map(this::assemble);
    }

    @Transactional(readOnly = true)
    public Optional<EscrowPayment> findByOrderId(UUID orderId) {
        return paymentRepository.findByOrderId(orderId)
            .map(this::assemble);
    }

    /**
     * Resolves the payment that owns an allocation.
     */
    @Transactional(readOnly = true)
    public Optional<UUID> findEscrowPaymentIdByAllocation(UUID allocationId) {
        return allocationRepository.findEscrowPaymentIdById(allocationId);
    }

    @Transactional(readOnly = true)
    public List<EscrowAllocationEntity> findAllocationsByShipment(UUID shipmentId) {
        return allocationRepository.findByShipmentId(shipmentId);
    }

    /**
     * Allocations of a store that are still holding funds, as domain objects.
     */
    @Transactional(readOnly = true)
    public List<EscrowAllocation> findOpenAllocationsForStore(UUID storeId) {
        List<EscrowAllocationEntity> open = allocationRepository.findByStoreIdAndStatusIn(storeId, List.of(
            AllocationStatus.CREATED,
            AllocationStatus.ELIGIBLE,
            AllocationStatus.PARTIAL_RELEASE,
            AllocationStatus.PARTIAL_REFUND));

        Map<UUID, String> currencies = paymentRepository.findAllById(
                open.stream().map(EscrowAllocationEntity::getEscrowPaymentId).distinct().toList())
            .stream()
            .collect(Collectors.toMap(EscrowPaymentEntity::getId, EscrowPaymentEntity::getCurrency));

        return open.stream()
            .map(a -> a.toDomain(currencies.get(a.getEscrowPaymentId())))
            .toList();
    }

    /**
     * Loads one allocation as a domain object, using its payment's currency.
     */
    @Transactional(readOnly = true)
    public Optional<EscrowAllocation> findAllocation(UUID allocationId) {
        return allocationRepository.findById(allocationId)
            .flatMap(a -> paymentRepository.findById(a.getEscrowPaymentId())
                .map(p -> a.toDomain(p.getCurrency())));
    }

    /**
     * Payments that still hold funds for at least one seller.
     */
    @Transactional(readOnly = true)
    public long countOpenPayments() {
        return paymentRepository.countByStatusIn(
            List.of(EscrowPaymentStatus.HELD, EscrowPaymentStatus.PARTIALLY_RELEASED));
    }

    private EscrowPayment assemble(EscrowPaymentEntity entity) {
        return assemble(entity, allocationRepository.findByEscrowPaymentIdOrderByCreatedAtAsc(entity.getId()));
    }

    private EscrowPayment assemble(EscrowPaymentEntity entity, List<EscrowAllocationEntity> allocations) {
        List<EscrowAllocation> domain = allocations.stream()
            .sorted((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()))
            .map(a -> a.toDomain(entity.getCurrency()))
            .toList();
        return entity.toDomain(domain);
    }
}
