package com.flagship.escrow_ledger.escrow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EscrowAllocationRepository extends JpaRepository<EscrowAllocationEntity, UUID> {

    List<EscrowAllocationEntity> findByEscrowPaymentIdOrderByCreatedAtAsc(UUID escrowPaymentId);

    List<EscrowAllocationEntity> findByShipmentId(UUID shipmentId);

    List<EscrowAllocationEntity> findByStoreIdAndStatusIn(UUID storeId, List<AllocationStatus> statuses);

    /**
     * Resolves the owning payment of an allocation without loading the aggregate.
     */
    @Query("SELECT a.escrowPaymentId FROM EscrowAllocationEntity a WHERE a.id = :allocationId")
    Optional<UUID> findEscrowPaymentIdById(@Param("allocationId") UUID allocationId);
}
