package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.money.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for EscrowAllocation persistence.
 *
 * The allocation has no version of its own. Every change to an allocation
 * also rewrites its parent payment row, whose version covers both.
 */
@Entity
@Table(
    name = "escrow_allocations",
    indexes = {
        @Index(name = "idx_escrow_allocations_payment", columnList = "escrow_payment_id"),
        @Index(name = "idx_escrow_allocations_store_status", columnList = "store_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscrowAllocationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "escrow_payment_id", nullable = false, updatable = false)
    private UUID escrowPaymentId;

    @Column(name = "store_id", nullable = false, updatable = false)
    private UUID storeId;

    @Column(name = "shipment_id", updatable = false)
    private UUID shipmentId;

    @Column(name = "seller_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal sellerAmount;

    @Column(name = "shipping_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal shippingAmount;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "commission_rate", nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal commissionRate;

    @Column(name = "commission_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @Column(name = "seller_payout", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal sellerPayout;

    @Column(name = "released_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal releasedAmount;

    @Column(name = "refunded_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal refundedAmount;

    @Column(name = "refunded_commission_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal refundedCommissionAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private AllocationStatus status;

    @Column(name = "payout_reference", length = 100)
    private String payoutReference;

    @Column(name = "refund_reference", length = 100)
    private String refundReference;

    @Column(name = "eligible_at")
    private Instant eligibleAt;

    @Column(name = "released_at")
    private Instant releasedAt;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }

    static EscrowAllocationEntity fromDomain(EscrowAllocation allocation) {
        return new EscrowAllocationEntity(
            allocation.getId(),
            allocation.getEscrowPaymentId(),
            allocation.getStoreId(),
            allocation.getShipmentId(),
            allocation.getSellerAmount().getAmount(),
            allocation.getShippingAmount().getAmount(),
            allocation.getTotalAmount().getAmount(),
            allocation.getCommissionRate(),
            allocation.getCommissionAmount().getAmount(),
            allocation.getSellerPayout().getAmount(),
            allocation.getReleasedAmount().getAmount(),
            allocation.getRefundedAmount().getAmount(),
            allocation.getRefundedCommissionAmount().getAmount(),
            allocation.getStatus(),
            allocation.getPayoutReference(),
            allocation.getRefundReference(),
            allocation.getEligibleAt(),
            allocation.getReleasedAt(),
            allocation.getRefundedAt(),
            allocation.getCreatedAt(),
            allocation.getUpdatedAt()
        );
    }

    /**
     * Converts to the domain object. The currency is held on the parent payment.
     */
    public EscrowAllocation toDomain(String currency) {
        return EscrowAllocation.builder()
            .id(id)
            .escrowPaymentId(escrowPaymentId)
            .storeId(storeId)
            .shipmentId(shipmentId)
            .sellerAmount(Money.of(sellerAmount, currency))
            .shippingAmount(Money.of(shippingAmount, currency))
            .totalAmount(Money.of(totalAmount, currency))
            .commissionRate(commissionRate)
            .commissionAmount(Money.of(commissionAmount, currency))
            .sellerPayout(Money.of(sellerPayout, currency))
            .releasedAmount(Money.of(releasedAmount, currency))
            .refundedAmount(Money.of(refundedAmount, currency))
            .refundedCommissionAmount(Money.of(refundedCommissionAmount, currency))
            .status(status)
            .payoutReference(payoutReference)
            .refundReference(refundReference)
            .eligibleAt(eligibleAt)
            .releasedAt(releasedAt)
            .refundedAt(refundedAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void updateFromDomain(EscrowAllocation allocation) {
        this.releasedAmount = allocation.getReleasedAmount().getAmount();
        this.refundedAmount = allocation.getRefundedAmount().getAmount();
        this.refundedCommissionAmount = allocation.getRefundedCommissionAmount().getAmount();
        this.status = allocation.getStatus();
        this.payoutReference = allocation.getPayoutReference();
        this.refundReference = allocation.getRefundReference();
        this.eligibleAt = allocation.getEligibleAt();
        this.releasedAt = allocation.getReleasedAt();
        this.refundedAt = allocation.getRefundedAt();
        this.updatedAt = allocation.getUpdatedAt();
    }
}
