package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.exception.CurrencyMismatchException;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Monthly statement of one seller's escrow movements.
 *
 * Key design principles:
 * - Immutable: lifecycle methods return new instances
 * - Items are fixed when the period is closed
 * - Later corrections are appended as adjustments, the settlement is never reopened
 * - Totals over items are stored, totals over adjustments are derived
 */
@Value
@Builder(toBuilder = true)
public class Settlement {

    public static final int MIN_YEAR = 2020;
    public static final int MAX_YEAR = 2100;
    private static final int MAX_NOTES_LENGTH = 1000;
    private static final int MAX_APPROVER_LENGTH = 100;

    UUID id;
    UUID storeId;
    int year;
    int month;
    String settlementNumber;
    String currency;
    SettlementStatus status;
    Instant periodStart;
    Instant periodEnd;
    Money grossSales;
    Money totalShipping;
    Money totalCommission;
    Money totalRefunds;
    Money itemsNet;
    int orderCount;
    String notes;
    Instant closedAt;
    Instant approvedAt;
    String approvedBy;
    Instant exportedAt;
    List<SettlementItem> items;
    List<SettlementAdjustment> adjustments;
    Instant createdAt;
    Instant updatedAt;
    Long version;

    /**
     * Creates a CLOSED settlement from the period's items.
     *
     * @throws InvalidArgumentException if the period is out of range, there are no items,
     *         or an item belongs to another settlement
     * @throws CurrencyMismatchException if items are in different currencies
     */
    public static Settlement close(UUID id, UUID storeId, int year, int month, List<SettlementItem> items) {
        if (id == null) {
            throw new InvalidArgumentException("Settlement ID is required");
        }
        if (storeId == null) {
            throw new InvalidArgumentException("Store ID is required");
        }
        validatePeriod(year, month);
        if (items == null || items.isEmpty()) {
            throw new InvalidArgumentException("A settlement needs at least one item");
        }

        String currency = items.get(0).getCurrency();
        Money gross = Money.zero(currency);
        Money shipping = Money.zero(currency);
        Money commission = Money.zero(currency);
        Money refunds = Money.zero(currency);
        Money net = Money.zero(currency);

        for (SettlementItem item : items) {
            if (!id.equals(item.getSettlementId())) {
                throw new InvalidArgumentException("Item " + item.getId() + " belongs to another settlement");
            }
            gross = gross.add(item.getGrossAmount());
            shipping = shipping.add(item.getShippingAmount());
            commission = commission.add(item.getCommissionAmount());
            refunds = refunds.add(item.getRefundedAmount());
            net = net.add(item.getNetAmount());
        }

        int orders = (int) items.stream().map(SettlementItem::getOrderNumber).distinct().count();
        Instant now = Instant.now();

        return Settlement.builder()
            .id(id)
            .storeId(storeId)
            .year(year)
            .month(month)
            .settlementNumber(settlementNumber(storeId, year, month))
            .currency(currency)
            .status(SettlementStatus.CLOSED)
            .periodStart(periodStart(year, month))
            .periodEnd(periodEnd(year, month))
            .grossSales(gross)
            .totalShipping(shipping)
            .totalCommission(commission)
            .totalRefunds(refunds)
            .itemsNet(net)
            .orderCount(orders)
            .closedAt(now)
            .items(List.copyOf(items))
            .adjustments(List.of())
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public static void validatePeriod(int year, int month) {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new InvalidArgumentException(
                String.format("Year must be between %d and %d, got %d", MIN_YEAR, MAX_YEAR, year));
        }
        if (month < 1 || month > 12) {
            throw new InvalidArgumentException("Month must be between 1 and 12, got " + month);
        }
    }

    public static Instant periodStart(int year, int month) {
        return YearMonth.of(year, month).atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    /**
     * Exclusive end of the period: the first instant of the next month, UTC.
     */
    public static Instant periodEnd(int year, int month) {
        return YearMonth.of(year, month).plusMonths(1).atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    /**
     * STL-{YYYYMM}-{store ID as 32 hex digits}, e.g. STL-202403-3F2A...C901.
     * Unique because (store, year, month) is.
     */
    public static String settlementNumber(UUID storeId, int year, int month) {
        String store = storeId.toString().replace("-", "").toUpperCase(Locale.ROOT);
        return String.format("STL-%04d%02d-%s", year, month, store);
    }

    public YearMonth getPeriod() {
        return YearMonth.of(year, month);
    }

    public Money getTotalAdjustments() {
        Money total = Money.zero(currency);
        for (SettlementAdjustment adjustment : adjustments) {
            total = total.add(adjustment.getAmount());
        }
        return total;
    }

    /**
     * Amount owed to the seller for this period including all corrections.
     */
    public Money getNetPayable() {
        return itemsNet.add(getTotalAdjustments());
    }

    public Settlement approve(String approver) {
        if (approver == null || approver.isBlank()) {
            throw new InvalidArgumentException("Approver is required");
        }
        if (approver.length() > MAX_APPROVER_LENGTH) {
            throw new InvalidArgumentException("Approver must be at most " + MAX_APPROVER_LENGTH + " characters");
        }
        Instant now = Instant.now();
        return toBuilder()
            .status(status.next(SettlementStatus.Operation.APPROVE))
            .approvedAt(now)
            .approvedBy(approver)
            .updatedAt(now)
            .build();
    }

    public Settlement markExported() {
        Instant now = Instant.now();
        return toBuilder()
            .status(status.next(SettlementStatus.Operation.EXPORT))
            .exportedAt(now)
            .updatedAt(now)
            .build();
    }

    public Settlement withNotes(String newNotes) {
        if (newNotes != null && newNotes.length() > MAX_NOTES_LENGTH) {
            throw new InvalidArgumentException("Notes must be at most " + MAX_NOTES_LENGTH + " characters");
        }
        return toBuilder()
            .notes(newNotes)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Appends a correction.
     *
     * @throws InvalidArgumentException if the adjustment targets another settlement or a later period
     * @throws CurrencyMismatchException if the adjustment is not in the settlement's currency
     */
    public Settlement withAdjustment(SettlementAdjustment adjustment) {
        if (!id.equals(adjustment.getSettlementId())) {
            throw new InvalidArgumentException("Adjustment " + adjustment.getId() + " belongs to another settlement");
        }
        if (!currency.equals(adjustment.getAmount().getCurrency())) {
            throw new CurrencyMismatchException(currency, adjustment.getAmount().getCurrency());
        }
        if (adjustment.getOriginalPeriod().isAfter(getPeriod())) {
            throw new InvalidArgumentException(String.format(
                "Adjustment for %s cannot be recorded on settlement %s for the earlier period %s",
                adjustment.getOriginalPeriod(), settlementNumber, getPeriod()));
        }

        List<SettlementAdjustment> updated = new ArrayList<>(adjustments);
        updated.add(adjustment);
        return toBuilder()
            .adjustments(List.copyOf(updated))
            .build();
    }
}
