package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for SettlementItem persistence. Rows are insert-only; the
 * table rejects UPDATE and DELETE.
 */
@Entity
@Table(
    name = "settlement_items",
    indexes = {
        @Index(name = "idx_settlement_items_settlement", columnList = "settlement_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "settlement_id", nullable = false, updatable = false)
    private UUID settlementId;

    @Column(name = "escrow_allocation_id", nullable = false, updatable = false)
    private UUID escrowAllocationId;

    @Column(name = "shipment_id", updatable = false)
    private UUID shipmentId;

    @Column(name = "order_number", nullable = false, updatable = false, length = 50)
    private String orderNumber;

    @Column(name = "seller_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal sellerAmount;

    @Column(name = "shipping_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal shippingAmount;

    @Column(name = "commission_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @Column(name = "refunded_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal refundedAmount;

    @Column(name = "net_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal netAmount;

    @Column(name = "transaction_date", nullable = false, updatable = false)
    private Instant transactionDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static SettlementItemEntity fromDomain(SettlementItem item) {
        return new SettlementItemEntity(
            item.getId(),
            item.getSettlementId(),
            item.getEscrowAllocationId(),
            item.getShipmentId(),
            item.getOrderNumber(),
            item.getSellerAmount().getAmount(),
            item.getShippingAmount().getAmount(),
            item.getCommissionAmount().getAmount(),
            item.getRefundedAmount().getAmount(),
            item.getNetAmount().getAmount(),
            item.getTransactionDate(),
            item.getCreatedAt()
        );
    }

    public SettlementItem toDomain(String currency) {
        return new SettlementItem(
            id,
            settlementId,
            escrowAllocationId,
            shipmentId,
            orderNumber,
            Money.of(sellerAmount, currency),
            Money.of(shippingAmount, currency),
            Money.of(commissionAmount, currency),
            Money.of(refundedAmount, currency),
            Money.of(netAmount, currency),
            transactionDate,
            createdAt
        );
    }
}
