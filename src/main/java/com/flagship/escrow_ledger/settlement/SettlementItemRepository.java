package com.flagship.escrow_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Insert and read only. Settlement items are never updated or deleted.
 */
@Repository
public interface SettlementItemRepository extends JpaRepository<SettlementItemEntity, UUID> {

    List<SettlementItemEntity> findBySettlementIdOrderByTransactionDateAsc(UUID settlementId);
}
