package com.flagship.escrow_ledger.escrow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EscrowPaymentRepository extends JpaRepository<EscrowPaymentEntity, UUID> {

    /**
     * Finds the escrow payment of an order. An order has at most one.
     */
    Optional<EscrowPaymentEntity> findByOrderId(UUID orderId);

    long countByStatusIn(Collection<EscrowPaymentStatus> statuses);
}
