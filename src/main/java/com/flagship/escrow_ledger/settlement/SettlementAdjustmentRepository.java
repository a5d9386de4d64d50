package com.flagship.escrow_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SettlementAdjustmentRepository extends JpaRepository<SettlementAdjustmentEntity, UUID> {

    List<SettlementAdjustmentEntity> findBySettlementIdOrderByCreatedAtAsc(UUID settlementId);
}
