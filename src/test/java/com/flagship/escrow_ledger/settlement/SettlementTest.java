package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.escrow.EscrowAllocation;
import com.flagship.escrow_ledger.escrow.EscrowPayment;
import com.flagship.escrow_ledger.exception.CurrencyMismatchException;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.exception.InvalidStateTransitionException;
import com.flagship.escrow_ledger.ledger.EscrowLedgerEntry;
import com.flagship.escrow_ledger.money.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Settlement aggregate: items, totals, lifecycle and adjustments.
 */
@DisplayName("Settlement")
class SettlementTest {

    private static final UUID STORE_ID = UUID.fromString("3f2a0000-0000-0000-0000-000000000001");

    private UUID settlementId;
    private EscrowPayment payment;
    private UUID allocationId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("  " + label + ": " + value);
    }

    @BeforeEach
    void setUp() {
        settlementId = UUID.randomUUID();
        EscrowPayment created = EscrowPayment.create(UUID.randomUUID(), "ORD-42", UUID.randomUUID(),
            Money.of("120.00", "USD"), "txn-42");
        EscrowAllocation allocation = EscrowAllocation.create(created.getId(), STORE_ID, UUID.randomUUID(),
            Money.of("100.00", "USD"), Money.of("20.00", "USD"), new BigDecimal("10"));
        payment = created.addAllocation(allocation).markEligible(allocation.getId());
        allocationId = allocation.getId();
    }

    private EscrowLedgerEntry release(String amount) {
        Money money = Money.of(amount, "USD");
        payment = payment.applyRelease(allocationId, money, "P");
        return EscrowLedgerEntry.createReleaseEntry(payment, payment.getAllocation(allocationId), money, "P", "ops");
    }

    private EscrowLedgerEntry refund(String amount) {
        Money money = Money.of(amount, "USD");
        payment = payment.applyRefund(allocationId, money, "R");
        return EscrowLedgerEntry.createRefundEntry(payment, payment.getAllocation(allocationId), money, "R", "ops");
    }

    private SettlementItem item(List<EscrowLedgerEntry> movements) {
        return SettlementItem.fromMovements(settlementId, payment.getAllocation(allocationId),
            payment.getOrderNumber(), movements);
    }

    @Nested
    @DisplayName("Items")
    class Items {

        @Test
        @DisplayName("Release and refund fold into one item split by the shipping proportion")
        void foldsMovements() {
            printTestHeader("Settlement item from release 60.00 and refund 30.00 of 120.00");

            List<EscrowLedgerEntry> movements = List.of(release("60.00"), refund("30.00"));
            SettlementItem item = item(movements);

            printOutput("seller", item.getSellerAmount());
            printOutput("shipping", item.getShippingAmount());
            printOutput("net", item.getNetAmount());

            // 90.00 gross, shipping share 20/120
            assertEquals(Money.of("15.00", "USD"), item.getShippingAmount());
            assertEquals(Money.of("75.00", "USD"), item.getSellerAmount());
            assertEquals(Money.of("6.00", "USD"), item.getCommissionAmount());
            assertEquals(Money.of("30.00", "USD"), item.getRefundedAmount());
            assertEquals(Money.of("54.00", "USD"), item.getNetAmount());
            assertEquals("ORD-42", item.getOrderNumber());
            assertEquals(allocationId, item.getEscrowAllocationId());
        }

        @Test
        @DisplayName("Transaction date is the latest movement")
        void transactionDateIsLatest() {
            EscrowLedgerEntry first = release("10.00");
            EscrowLedgerEntry second = release("20.00");
            Instant latest = first.getCreatedAt().isAfter(second.getCreatedAt())
                ? first.getCreatedAt() : second.getCreatedAt();

            assertEquals(latest, item(List.of(second, first)).getTransactionDate());
        }

        @Test
        @DisplayName("Non-movement entries and foreign allocations are rejected")
        void rejectsInvalidEntries() {
            EscrowLedgerEntry eligible = EscrowLedgerEntry.createEligibleEntry(payment,
                payment.getAllocation(allocationId), "ops");
            assertThrows(InvalidArgumentException.class, () -> item(List.of(eligible)));
            assertThrows(InvalidArgumentException.class, () -> item(List.of()));

            EscrowPayment other = EscrowPayment.create(UUID.randomUUID(), "ORD-43", UUID.randomUUID(),
                Money.of("5.00", "USD"), "txn-43");
            EscrowAllocation otherAllocation = EscrowAllocation.create(other.getId(), STORE_ID,
                Money.of("5.00", "USD"), BigDecimal.ZERO);
            EscrowLedgerEntry foreign = EscrowLedgerEntry.createAllocationEntry(
                other.addAllocation(otherAllocation), otherAllocation, "ops");
            assertThrows(InvalidArgumentException.class, () -> item(List.of(foreign)));
        }
    }

    @Nested
    @DisplayName("Closing a period")
    class Closing {

        @Test
        @DisplayName("Totals sum the items and orders are counted once")
        void totals() {
            SettlementItem first = item(List.of(release("60.00")));
            SettlementItem second = item(List.of(refund("30.00")));

            Settlement settlement = Settlement.close(settlementId, STORE_ID, 2024, 3, List.of(first, second));

            assertEquals(SettlementStatus.CLOSED, settlement.getStatus());
            assertEquals("STL-202403-3F2A0000000000000000000000000001", settlement.getSettlementNumber());
            assertEquals(Money.of("90.00", "USD"), settlement.getGrossSales());
            assertEquals(Money.of("6.00", "USD"), settlement.getTotalCommission());
            assertEquals(Money.of("30.00", "USD"), settlement.getTotalRefunds());
            assertEquals(Money.of("54.00", "USD"), settlement.getItemsNet());
            assertEquals(1, settlement.getOrderCount());
            assertEquals(Instant.parse("2024-03-01T00:00:00Z"), settlement.getPeriodStart());
            assertEquals(Instant.parse("2024-04-01T00:00:00Z"), settlement.getPeriodEnd());
            assertNotNull(settlement.getClosedAt());
        }

        @Test
        @DisplayName("Period bounds are validated")
        void validatesPeriod() {
            assertThrows(InvalidArgumentException.class, () -> Settlement.validatePeriod(2019, 12));
            assertThrows(InvalidArgumentException.class, () -> Settlement.validatePeriod(2101, 1));
            assertThrows(InvalidArgumentException.class, () -> Settlement.validatePeriod(2024, 13));
            assertThrows(InvalidArgumentException.class, () -> Settlement.validatePeriod(2024, 0));
            assertDoesNotThrow(() -> Settlement.validatePeriod(2024, 12));
        }

        @Test
        @DisplayName("Stores sharing an ID prefix get distinct settlement numbers")
        void settlementNumberUsesWholeStoreId() {
            printTestHeader("Two stores with the same leading hex digits close the same month");

            UUID first = UUID.fromString("abcd0000-0000-0000-0000-000000000001");
            UUID second = UUID.fromString("abcd9999-0000-0000-0000-000000000002");

            String firstNumber = Settlement.settlementNumber(first, 2024, 3);
            String secondNumber = Settlement.settlementNumber(second, 2024, 3);
            printOutput("first", firstNumber);
            printOutput("second", secondNumber);

            assertNotEquals(firstNumber, secondNumber);
            assertNotEquals(firstNumber, Settlement.settlementNumber(first, 2024, 4));
            assertTrue(firstNumber.length() <= 50);
        }

        @Test
        @DisplayName("December wraps into January of the next year")
        void decemberPeriodEnd() {
            assertEquals(Instant.parse("2025-01-01T00:00:00Z"), Settlement.periodEnd(2024, 12));
        }

        @Test
        @DisplayName("A settlement needs items of its own")
        void requiresOwnItems() {
            assertThrows(InvalidArgumentException.class,
                () -> Settlement.close(settlementId, STORE_ID, 2024, 3, List.of()));

            SettlementItem foreign = SettlementItem.fromMovements(UUID.randomUUID(),
                payment.getAllocation(allocationId), "ORD-42", List.of(release("1.00")));
            assertThrows(InvalidArgumentException.class,
                () -> Settlement.close(settlementId, STORE_ID, 2024, 3, List.of(foreign)));
        }
    }

    @Nested
    @DisplayName("Lifecycle and adjustments")
    class LifecycleAndAdjustments {

        private Settlement settlement;

        @BeforeEach
        void close() {
            settlement = Settlement.close(settlementId, STORE_ID, 2024, 3, List.of(item(List.of(release("50.00")))));
        }

        @Test
        @DisplayName("CLOSED -> APPROVED -> EXPORTED")
        void approveThenExport() {
            Settlement approved = settlement.approve("finance@example.com");
            Settlement exported = approved.markExported();

            assertEquals(SettlementStatus.APPROVED, approved.getStatus());
            assertEquals("finance@example.com", approved.getApprovedBy());
            assertNotNull(approved.getApprovedAt());
            assertEquals(SettlementStatus.EXPORTED, exported.getStatus());
            assertNotNull(exported.getExportedAt());

            assertThrows(InvalidStateTransitionException.class, exported::markExported);
        }

        @Test
        @DisplayName("Approving twice or after export is rejected")
        void invalidTransitions() {
            Settlement approved = settlement.approve("a");
            assertThrows(InvalidStateTransitionException.class, () -> approved.approve("b"));

            Settlement exported = settlement.markExported();
            assertThrows(InvalidStateTransitionException.class, () -> exported.approve("a"));
            assertThrows(InvalidStateTransitionException.class, exported::markExported);
            assertThrows(InvalidArgumentException.class, () -> settlement.approve(" "));
        }

        @Test
        @DisplayName("Adjustments change the net payable but not the item totals")
        void adjustmentsChangeNetPayable() {
            SettlementAdjustment credit = SettlementAdjustment.create(settlementId, 2024, 2,
                Money.of("12.50", "USD"), "Late delivery credit", null, "ORD-9", null);
            SettlementAdjustment debit = SettlementAdjustment.create(settlementId, 2024, 3,
                Money.of("-2.50", "USD"), "Chargeback", UUID.randomUUID(), null, "ops");

            Settlement adjusted = settlement.markExported().withAdjustment(credit).withAdjustment(debit);

            assertEquals(2, adjusted.getAdjustments().size());
            assertEquals(Money.of("10.00", "USD"), adjusted.getTotalAdjustments());
            assertEquals(settlement.getItemsNet(), adjusted.getItemsNet());
            assertEquals(settlement.getItemsNet().add(Money.of("10.00", "USD")), adjusted.getNetPayable());
            assertTrue(credit.isCredit());
            assertFalse(debit.isCredit());
            assertEquals("System", credit.getCreatedBy());
        }

        @Test
        @DisplayName("Adjustments for a later period or another currency are rejected")
        void rejectsInvalidAdjustments() {
            SettlementAdjustment later = SettlementAdjustment.create(settlementId, 2024, 4,
                Money.of("1.00", "USD"), "Too late", null, null, null);
            SettlementAdjustment euro = SettlementAdjustment.create(settlementId, 2024, 3,
                Money.of("1.00", "EUR"), "Wrong currency", null, null, null);
            SettlementAdjustment foreign = SettlementAdjustment.create(UUID.randomUUID(), 2024, 3,
                Money.of("1.00", "USD"), "Other settlement", null, null, null);

            assertThrows(InvalidArgumentException.class, () -> settlement.withAdjustment(later));
            assertThrows(CurrencyMismatchException.class, () -> settlement.withAdjustment(euro));
            assertThrows(InvalidArgumentException.class, () -> settlement.withAdjustment(foreign));
        }

        @Test
        @DisplayName("Adjustment input is validated")
        void validatesAdjustment() {
            assertThrows(InvalidArgumentException.class, () -> SettlementAdjustment.create(settlementId, 2024, 3,
                Money.zero("USD"), "Zero", null, null, null));
            assertThrows(InvalidArgumentException.class, () -> SettlementAdjustment.create(settlementId, 2024, 3,
                Money.of("1.00", "USD"), " ", null, null, null));
            assertThrows(InvalidArgumentException.class, () -> SettlementAdjustment.create(settlementId, 2024, 3,
                Money.of("1.00", "USD"), "x".repeat(501), null, null, null));
            assertThrows(InvalidArgumentException.class, () -> SettlementAdjustment.create(settlementId, 2024, 3,
                Money.of("1.00", "USD"), "Reason", null, "9".repeat(51), null));
        }

        @Test
        @DisplayName("Notes are limited to 1000 characters")
        void notesLimit() {
            assertEquals("checked", settlement.withNotes("checked").getNotes());
            assertThrows(InvalidArgumentException.class, () -> settlement.withNotes("n".repeat(1001)));
        }
    }

    @Nested
    @DisplayName("Export and period summary")
    class ExportAndSummary {

        private Settlement minimal(String currency, SettlementStatus status, String net) {
            return Settlement.builder()
                .id(UUID.randomUUID())
                .storeId(UUID.randomUUID())
                .year(2024)
                .month(3)
                .currency(currency)
                .status(status)
                .itemsNet(Money.of(net, currency))
                .adjustments(List.of())
                .build();
        }

        @Test
        @DisplayName("Export carries the header totals and one line per item")
        void exportRows() {
            printTestHeader("Export of a settlement with one item and one adjustment");

            Settlement settlement = Settlement.close(settlementId, STORE_ID, 2024, 3,
                List.of(item(List.of(release("50.00")))));
            settlement = settlement.withAdjustment(SettlementAdjustment.create(settlementId, 2024, 3,
                Money.of("5.00", "USD"), "Goodwill", null, null, null));
            Instant generatedAt = Instant.parse("2024-04-02T06:00:00Z");

            SettlementExport export = SettlementExport.of(settlement, generatedAt);

            printOutput("number", export.getSettlementNumber());
            printOutput("netPayable", export.getNetPayable());

            assertEquals(settlement.getSettlementNumber(), export.getSettlementNumber());
            assertEquals("2024-03", export.getPeriod());
            assertEquals(STORE_ID, export.getStoreId());
            assertEquals(Money.of("50.00", "USD"), export.getGrossSales());
            assertEquals(Money.of("5.00", "USD"), export.getTotalAdjustments());
            assertEquals(Money.of("50.00", "USD"), export.getNetPayable());
            assertEquals(1, export.getOrderCount());
            assertEquals(SettlementStatus.CLOSED, export.getStatus());
            assertEquals(generatedAt, export.getGeneratedAt());

            assertEquals(1, export.getLines().size());
            SettlementExport.Line line = export.getLines().get(0);
            assertEquals(export.getSettlementNumber(), line.getSettlementNumber());
            assertEquals("ORD-42", line.getOrderNumber());
            assertEquals(Money.of("45.00", "USD"), line.getNetAmount());
            assertEquals(settlement.getItems().get(0).getTransactionDate(), line.getTransactionDate());
        }

        @Test
        @DisplayName("Summary counts every status and sums net payable per currency")
        void summaryByStatusAndCurrency() {
            List<Settlement> settlements = List.of(
                minimal("USD", SettlementStatus.CLOSED, "100.00"),
                minimal("USD", SettlementStatus.APPROVED, "25.50"),
                minimal("EUR", SettlementStatus.EXPORTED, "40.00"));

            SettlementSummary summary = SettlementSummary.of(2024, 3, settlements);

            assertEquals(3, summary.getTotalSettlements());
            assertEquals(1, summary.getCount(SettlementStatus.CLOSED));
            assertEquals(1, summary.getCount(SettlementStatus.APPROVED));
            assertEquals(1, summary.getCount(SettlementStatus.EXPORTED));
            assertEquals(Money.of("125.50", "USD"), summary.getNetPayableByCurrency().get("USD"));
            assertEquals(Money.of("40.00", "EUR"), summary.getNetPayableByCurrency().get("EUR"));
        }

        @Test
        @DisplayName("Summary of an empty period has zero counts and no totals")
        void emptySummary() {
            SettlementSummary summary = SettlementSummary.of(2024, 3, List.of());

            assertEquals(0, summary.getTotalSettlements());
            assertEquals(0, summary.getCount(SettlementStatus.EXPORTED));
            assertTrue(summary.getNetPayableByCurrency().isEmpty());
        }
    }
}
