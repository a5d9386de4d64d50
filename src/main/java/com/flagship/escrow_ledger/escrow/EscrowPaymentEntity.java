package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.money.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA Entity for EscrowPayment persistence.
 *
 * Key design principles:
 * - No @Setter: state only changes through updateFromDomain()
 * - Identity fields (order, buyer, total, currency) are updatable = false
 * - @Version guards the aggregate when more than one process writes to it
 * - Allocations live in their own table and are assembled by EscrowPersistenceService
 */
@Entity
@Table(
    name = "escrow_payments",
    indexes = {
        @Index(name = "idx_escrow_payments_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscrowPaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "order_id", nullable = false, updatable = false, unique = true)
    private UUID orderId;

    @Column(name = "order_number", nullable = false, updatable = false, length = 50)
    private String orderNumber;

    @Column(name = "buyer_id", nullable = false, updatable = false)
    private UUID buyerId;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(name = "payment_transaction_id", nullable = false, updatable = false, length = 100)
    private String paymentTransactionId;

    @Column(name = "released_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal releasedAmount;

    @Column(name = "refunded_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal refundedAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private EscrowPaymentStatus status;

    @Version
    @Column(nullable = false)
    private Long version;

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

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static EscrowPaymentEntity fromDomain(EscrowPayment payment) {
        return new EscrowPaymentEntity(
            payment.getId(),
            payment.getOrderId(),
            payment.getOrderNumber(),
            payment.getBuyerId(),
            payment.getTotalAmount().getAmount(),
            payment.getCurrency(),
            payment.getPaymentTransactionId(),
            payment.getReleasedAmount().getAmount(),
            payment.getRefundedAmount().getAmount(),
            payment.getStatus(),
            null, // version - assigned on persist
            payment.getCreatedAt(),
            payment.getUpdatedAt()
        );
    }

    public EscrowPayment toDomain(List<EscrowAllocation> allocations) {
        return EscrowPayment.builder()
            .id(id)
            .orderId(orderId)
            .orderNumber(orderNumber)
            .buyerId(buyerId)
            .totalAmount(Money.of(totalAmount, currency))
            .paymentTransactionId(paymentTransactionId)
            .releasedAmount(Money.of(releasedAmount, currency))
            .refundedAmount(Money.of(refundedAmount, currency))
            .status(status)
            .allocations(List.copyOf(allocations))
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .version(version)
            .build();
    }

    /**
     * Copies the mutable running totals from the domain snapshot.
     * The updated timestamp always changes, so every aggregate write bumps the version.
     */
    void updateFromDomain(EscrowPayment payment) {
        this.releasedAmount = payment.getReleasedAmount().getAmount();
        this.refundedAmount = payment.getRefundedAmount().getAmount();
        this.status = payment.getStatus();
        this.updatedAt = payment.getUpdatedAt();
    }
}
