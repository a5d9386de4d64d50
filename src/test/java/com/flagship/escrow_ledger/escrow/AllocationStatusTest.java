package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.escrow.AllocationStatus.Operation;
import com.flagship.escrow_ledger.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AllocationStatus transitions")
class AllocationStatusTest {

    @Test
    @DisplayName("CREATED accepts MARK_ELIGIBLE and a cancellation, never a release or refund")
    void createdOnlyBecomesEligible() {
        assertEquals(AllocationStatus.ELIGIBLE, AllocationStatus.CREATED.next(Operation.MARK_ELIGIBLE, false));

        InvalidStateTransitionException e = assertThrows(InvalidStateTransitionException.class,
            () -> AllocationStatus.CREATED.next(Operation.RELEASE, false));
        assertEquals("CREATED", e.getCurrentState());
        assertEquals("RELEASE", e.getOperation());

        assertThrows(InvalidStateTransitionException.class,
            () -> AllocationStatus.CREATED.next(Operation.REFUND, true));

        assertEquals(AllocationStatus.REFUNDED, AllocationStatus.CREATED.next(Operation.CANCEL, true));
    }

    @ParameterizedTest
    @EnumSource(value = AllocationStatus.class, names = {"ELIGIBLE", "PARTIAL_RELEASE", "PARTIAL_REFUND"})
    @DisplayName("Open states move funds and close once the share is exhausted")
    void openStatesMoveFunds(AllocationStatus status) {
        assertTrue(status.canMoveFunds());
        assertEquals(AllocationStatus.PARTIAL_RELEASE, status.next(Operation.RELEASE, false));
        assertEquals(AllocationStatus.RELEASED, status.next(Operation.RELEASE, true));
        assertEquals(AllocationStatus.PARTIAL_REFUND, status.next(Operation.REFUND, false));
        assertEquals(AllocationStatus.REFUNDED, status.next(Operation.REFUND, true));
        assertEquals(AllocationStatus.REFUNDED, status.next(Operation.CANCEL, true));
        assertThrows(InvalidStateTransitionException.class, () -> status.next(Operation.MARK_ELIGIBLE, false));
    }

    @ParameterizedTest
    @EnumSource(value = AllocationStatus.class, names = {"RELEASED", "REFUNDED"})
    @DisplayName("Terminal states reject every operation")
    void terminalStatesRejectEverything(AllocationStatus status) {
        assertTrue(status.isTerminal());
        assertFalse(status.canMoveFunds());
        for (Operation operation : Operation.values()) {
            assertThrows(InvalidStateTransitionException.class, () -> status.next(operation, false));
        }
    }
}
