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

@Entity
@Table(
    name = "settlement_adjustments",
    indexes = {
        @Index(name = "idx_settlement_adjustments_settlement", columnList = "settlement_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementAdjustmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "settlement_id", nullable = false, updatable = false)
    private UUID settlementId;

    @Column(name = "original_year", nullable = false, updatable = false)
    private int originalYear;

    @Column(name = "original_month", nullable = false, updatable = false)
    private int originalMonth;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, length = 500)
    private String reason;

    @Column(name = "related_order_id", updatable = false)
    private UUID relatedOrderId;

    @Column(name = "related_order_number", updatable = false, length = 50)
    private String relatedOrderNumber;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static SettlementAdjustmentEntity fromDomain(SettlementAdjustment adjustment) {
        return new SettlementAdjustmentEntity(
            adjustment.getId(),
            adjustment.getSettlementId(),
            adjustment.getOriginalYear(),
            adjustment.getOriginalMonth(),
            adjustment.getAmount().getAmount(),
            adjustment.getReason(),
            adjustment.getRelatedOrderId(),
            adjustment.getRelatedOrderNumber(),
            adjustment.getCreatedBy(),
            adjustment.getCreatedAt()
        );
    }

    public SettlementAdjustment toDomain(String currency) {
        return new SettlementAdjustment(
            id,
            settlementId,
            originalYear,
            originalMonth,
            Money.of(amount, currency),
            reason,
            relatedOrderId,
            relatedOrderNumber,
            createdBy,
            createdAt
        );
    }
}
