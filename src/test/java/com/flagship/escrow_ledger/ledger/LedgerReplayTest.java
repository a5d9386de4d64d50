package com.flagship.escrow_ledger.ledger;

import com.flagship.escrow_ledger.escrow.EscrowAllocation;
import com.flagship.escrow_ledger.escrow.EscrowPayment;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.money.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Ledger entries, replay and reconciliation")
class LedgerReplayTest {

    private EscrowPayment payment;
    private UUID allocationId;
    private final List<EscrowLedgerEntry> entries = new ArrayList<>();

    @BeforeEach
    void setUp() {
        EscrowPayment created = EscrowPayment.create(UUID.randomUUID(), "ORD-7", UUID.randomUUID(),
            Money.of("100.00", "USD"), "txn-7");
        EscrowAllocation allocation = EscrowAllocation.create(created.getId(), UUID.randomUUID(),
            Money.of("100.00", "USD"), new BigDecimal("10"));
        payment = created.addAllocation(allocation);
        allocationId = allocation.getId();

        entries.add(EscrowLedgerEntry.createCreatedEntry(payment, null));
        entries.add(EscrowLedgerEntry.createAllocationEntry(payment, allocation, null));
    }

    private void release(String amount) {
        Money money = Money.of(amount, "USD");
        payment = payment.applyRelease(allocationId, money, "P");
        entries.add(EscrowLedgerEntry.createReleaseEntry(payment, payment.getAllocation(allocationId),
            money, "P", "ops"));
    }

    private void refund(String amount) {
        Money money = Money.of(amount, "USD");
        payment = payment.applyRefund(allocationId, money, "R");
        entries.add(EscrowLedgerEntry.createRefundEntry(payment, payment.getAllocation(allocationId),
            money, "R", "ops"));
    }

    @Test
    @DisplayName("Factories record gross amount, balance after and default initiator")
    void factories() {
        EscrowLedgerEntry created = entries.get(0);
        assertEquals(LedgerAction.CREATED, created.getAction());
        assertEquals(new BigDecimal("100.00"), created.getAmount());
        assertEquals(new BigDecimal("100.00"), created.getBalanceAfter());
        assertEquals("txn-7", created.getExternalReference());
        assertEquals(EscrowLedgerEntry.DEFAULT_INITIATOR, created.getInitiatedBy());
        assertNull(created.getAllocationId());

        EscrowLedgerEntry allocated = entries.get(1);
        assertEquals(LedgerAction.ALLOCATION_CREATED, allocated.getAction());
        assertEquals(allocationId, allocated.getAllocationId());
        assertTrue(allocated.getNotes().contains("10%"));

        payment = payment.markEligible(allocationId);
        release("40.00");
        EscrowLedgerEntry partial = entries.get(entries.size() - 1);
        assertEquals(LedgerAction.PARTIAL_RELEASE, partial.getAction());
        assertEquals(new BigDecimal("60.00"), partial.getBalanceAfter());
        assertEquals("ops", partial.getInitiatedBy());
    }

    @Test
    @DisplayName("Entry for a foreign allocation is rejected")
    void rejectsForeignAllocation() {
        EscrowAllocation foreign = EscrowAllocation.create(UUID.randomUUID(), UUID.randomUUID(),
            Money.of("1.00", "USD"), BigDecimal.ZERO);

        assertThrows(InvalidArgumentException.class,
            () -> EscrowLedgerEntry.createAllocationEntry(payment, foreign, "ops"));
    }

    @Test
    @DisplayName("Replay reconstructs released and refunded totals")
    void replayTotals() {
        payment = payment.markEligible(allocationId);
        entries.add(EscrowLedgerEntry.createEligibleEntry(payment, payment.getAllocation(allocationId), "ops"));
        release("25.00");
        refund("15.00");
        release("60.00");

        LedgerReplay replay = LedgerReplay.replay(payment.getId(), entries);

        assertEquals(6, replay.getEntryCount());
        assertEquals(0, new BigDecimal("100.00").compareTo(replay.getCollectedAmount()));
        assertEquals(0, new BigDecimal("85.00").compareTo(replay.getReleasedAmount()));
        assertEquals(0, new BigDecimal("15.00").compareTo(replay.getRefundedAmount()));
        assertEquals(0, replay.getComputedBalance().signum());
        assertEquals(0, replay.getLastBalanceAfter().signum());
        assertEquals(LedgerAction.RELEASED, entries.get(entries.size() - 1).getAction());
    }

    @Test
    @DisplayName("Reconciliation of a consistent payment has no discrepancies")
    void reconcileConsistent() {
        payment = payment.markEligible(allocationId);
        release("30.00");
        refund("10.00");

        ReconciliationResult result = ReconciliationResult.compare(payment,
            LedgerReplay.replay(payment.getId(), entries));

        assertTrue(result.isConsistent(), () -> "Unexpected discrepancies: " + result.getDiscrepancies());
        assertEquals(0, new BigDecimal("60.00").compareTo(result.getStoredBalance()));
        assertEquals(0, result.getLedgerBalance().compareTo(result.getStoredBalance()));
    }

    @Test
    @DisplayName("A movement missing from the ledger is reported")
    void reconcileMissingEntry() {
        payment = payment.markEligible(allocationId);
        release("30.00");
        entries.remove(entries.size() - 1);

        ReconciliationResult result = ReconciliationResult.compare(payment,
            LedgerReplay.replay(payment.getId(), entries));

        assertFalse(result.isConsistent());
        assertTrue(result.getDiscrepancies().stream().anyMatch(d -> d.startsWith("Released")));
    }

    @Test
    @DisplayName("A payment without ledger entries is inconsistent")
    void reconcileEmptyLedger() {
        ReconciliationResult result = ReconciliationResult.compare(payment,
            LedgerReplay.replay(payment.getId(), List.of()));

        assertFalse(result.isConsistent());
        assertEquals(0, result.getEntryCount());
    }
}
