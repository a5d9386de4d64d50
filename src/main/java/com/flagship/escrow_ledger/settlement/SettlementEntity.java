package com.flagship.escrow_ledger.settlement;

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
 * JPA Entity for Settlement persistence.
 *
 * Period and totals are fixed at close time (updatable = false). Only the
 * lifecycle columns and notes change afterwards.
 */
@Entity
@Table(
    name = "settlements",
    indexes = {
        @Index(name = "idx_settlements_store", columnList = "store_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "store_id", nullable = false, updatable = false)
    private UUID storeId;

    @Column(name = "settlement_year", nullable = false, updatable = false)
    private int settlementYear;

    @Column(name = "settlement_month", nullable = false, updatable = false)
    private int settlementMonth;

    @Column(name = "settlement_number", nullable = false, updatable = false, length = 50)
    private String settlementNumber;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SettlementStatus status;

    @Column(name = "period_start", nullable = false, updatable = false)
    private Instant periodStart;

    @Column(name = "period_end", nullable = false, updatable = false)
    private Instant periodEnd;

    @Column(name = "gross_sales", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal grossSales;

    @Column(name = "total_shipping", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalShipping;

    @Column(name = "total_commission", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalCommission;

    @Column(name = "total_refunds", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalRefunds;

    @Column(name = "items_net", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal itemsNet;

    @Column(name = "order_count", nullable = false, updatable = false)
    private int orderCount;

    @Column(length = 1000)
    private String notes;

    @Column(name = "closed_at", nullable = false, updatable = false)
    private Instant closedAt;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "approved_by", length = 100)
    private String approvedBy;

    @Column(name = "exported_at")
    private Instant exportedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static SettlementEntity fromDomain(Settlement settlement) {
        return new SettlementEntity(
            settlement.getId(),
            settlement.getStoreId(),
            settlement.getYear(),
            settlement.getMonth(),
            settlement.getSettlementNumber(),
            settlement.getCurrency(),
            settlement.getStatus(),
            settlement.getPeriodStart(),
            settlement.getPeriodEnd(),
            settlement.getGrossSales().getAmount(),
            settlement.getTotalShipping().getAmount(),
            settlement.getTotalCommission().getAmount(),
            settlement.getTotalRefunds().getAmount(),
            settlement.getItemsNet().getAmount(),
            settlement.getOrderCount(),
            settlement.getNotes(),
            settlement.getClosedAt(),
            settlement.getApprovedAt(),
            settlement.getApprovedBy(),
            settlement.getExportedAt(),
            null, // version - assigned on persist
            settlement.getCreatedAt(),
            settlement.getUpdatedAt()
        );
    }

    public Settlement toDomain(List<SettlementItem> items, List<SettlementAdjustment> adjustments) {
        return Settlement.builder()
            .id(id)
            .storeId(storeId)
            .year(settlementYear)
            .month(settlementMonth)
            .settlementNumber(settlementNumber)
            .currency(currency)
            .status(status)
            .periodStart(periodStart)
            .periodEnd(periodEnd)
            .grossSales(Money.of(grossSales, currency))
            .totalShipping(Money.of(totalShipping, currency))
            .totalCommission(Money.of(totalCommission, currency))
            .totalRefunds(Money.of(totalRefunds, currency))
            .itemsNet(Money.of(itemsNet, currency))
            .orderCount(orderCount)
            .notes(notes)
            .closedAt(closedAt)
            .approvedAt(approvedAt)
            .approvedBy(approvedBy)
            .exportedAt(exportedAt)
            .items(List.copyOf(items))
            .adjustments(List.copyOf(adjustments))
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .version(version)
            .build();
    }

    void updateFromDomain(Settlement settlement) {
        this.status = settlement.getStatus();
        this.notes = settlement.getNotes();
        this.approvedAt = settlement.getApprovedAt();
        this.approvedBy = settlement.getApprovedBy();
        this.exportedAt = settlement.getExportedAt();
        this.updatedAt = settlement.getUpdatedAt();
    }
}
