package com.flagship.escrow_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SettlementRepository extends JpaRepository<SettlementEntity, UUID> {

    Optional<SettlementEntity> findByStoreIdAndSettlementYearAndSettlementMonth(UUID storeId, int year, int month);

    List<SettlementEntity> findByStoreIdOrderBySettlementYearDescSettlementMonthDesc(UUID storeId);

    List<SettlementEntity> findBySettlementYearAndSettlementMonthOrderBySettlementNumberAsc(int year, int month);
}
