package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.ledger.EscrowLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("SettlementBatchJob")
class SettlementBatchJobTest {

    private static final int YEAR = 2024;
    private static final int MONTH = 3;

    @Mock
    private SettlementService settlementService;

    @Mock
    private EscrowLedgerService ledgerService;

    private SettlementBatchJob batchJob;

    @BeforeEach
    void setUp() {
        batchJob = new SettlementBatchJob(settlementService, ledgerService, 2, false);
    }

    private static PeriodCloseResult closed(UUID storeId) {
        Settlement settlement = mock(Settlement.class);
        when(settlement.getStoreId()).thenReturn(storeId);
        when(settlement.getYear()).thenReturn(YEAR);
        when(settlement.getMonth()).thenReturn(MONTH);
        return PeriodCloseResult.closed(settlement);
    }

    @Test
    @DisplayName("Counts closed, skipped and failed stores separately")
    void countsOutcomes() {
        UUID closedStore = UUID.randomUUID();
        UUID emptyStore = UUID.randomUUID();
        UUID failingStore = UUID.randomUUID();
        when(ledgerService.findStoresWithMovements(any(), any()))
            .thenReturn(List.of(closedStore, emptyStore, failingStore));
        PeriodCloseResult closedResult = closed(closedStore);
        when(settlementService.closeSettlementPeriod(eq(closedStore), eq(YEAR), eq(MONTH), any()))
            .thenReturn(closedResult);
        when(settlementService.closeSettlementPeriod(eq(emptyStore), eq(YEAR), eq(MONTH), any()))
            .thenReturn(PeriodCloseResult.noData(emptyStore, YEAR, MONTH));
        when(settlementService.closeSettlementPeriod(eq(failingStore), eq(YEAR), eq(MONTH), any()))
            .thenThrow(new IllegalArgumentException("mixed currencies"));

        BatchResult result = batchJob.runForPeriod(YEAR, MONTH);

        assertEquals(3, result.getStoresFound());
        assertEquals(1, result.getClosed());
        assertEquals(1, result.getSkipped());
        assertEquals(1, result.getFailed());
        assertEquals(List.of(failingStore), result.getFailedStores());
        assertFalse(result.isComplete());
        assertFalse(batchJob.isRunning());
    }

    @Test
    @DisplayName("Cancelled stores are reported as cancelled, not failed")
    void cancelledStores() {
        UUID storeId = UUID.randomUUID();
        when(ledgerService.findStoresWithMovements(any(), any())).thenReturn(List.of(storeId));
        when(settlementService.closeSettlementPeriod(eq(storeId), eq(YEAR), eq(MONTH), any()))
            .thenThrow(new CancellationException("cancelled"));

        BatchResult result = batchJob.runForPeriod(YEAR, MONTH);

        assertEquals(1, result.getCancelled());
        assertEquals(0, result.getFailed());
    }

    @Test
    @DisplayName("No stores with activity is a complete, empty batch")
    void emptyBatch() {
        when(ledgerService.findStoresWithMovements(any(), any())).thenReturn(List.of());

        BatchResult result = batchJob.runForPeriod(YEAR, MONTH);

        assertTrue(result.isComplete());
        assertEquals(0, result.getStoresFound());
        verify(settlementService, never()).closeSettlementPeriod(any(), eq(YEAR), eq(MONTH), any());
    }

    @Test
    @DisplayName("A second batch is rejected while one is running")
    void singleBatchAtATime() throws Exception {
        UUID storeId = UUID.randomUUID();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        when(ledgerService.findStoresWithMovements(any(), any())).thenReturn(List.of(storeId));
        when(settlementService.closeSettlementPeriod(eq(storeId), eq(YEAR), eq(MONTH), any())).thenAnswer(inv -> {
            started.countDown();
            finish.await(5, TimeUnit.SECONDS);
            return PeriodCloseResult.noData(storeId, YEAR, MONTH);
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<BatchResult> first = executor.submit(() -> batchJob.runForPeriod(YEAR, MONTH));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(batchJob.isRunning());
        assertThrows(IllegalStateException.class, () -> batchJob.runForPeriod(YEAR, MONTH));

        finish.countDown();
        assertEquals(1, first.get(5, TimeUnit.SECONDS).getSkipped());
        executor.shutdown();
    }

    @Test
    @DisplayName("Parallelism below one is rejected")
    void invalidParallelism() {
        assertThrows(IllegalArgumentException.class,
            () -> new SettlementBatchJob(settlementService, ledgerService, 0, false));
    }

    @Test
    @DisplayName("Scheduled trigger does nothing while disabled")
    void disabledSchedule() {
        batchJob.closePreviousMonth();

        verify(ledgerService, never()).findStoresWithMovements(any(), any());
    }
}
