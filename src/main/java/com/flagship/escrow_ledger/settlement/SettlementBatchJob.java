package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.ledger.EscrowLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes a settlement period for every store with escrow movements in it.
 *
 * Stores are closed in parallel on a fixed pool sized by
 * settlement.batch.parallelism. Each store commits or rolls back on its own,
 * so one failing store does not stop the others. {@link #cancel()} stops
 * stores that have not committed yet; stores already closed stay closed.
 *
 * Only one batch runs at a time.
 */
@Component
@Slf4j
public class SettlementBatchJob {

    private final SettlementService settlementService;
    private final EscrowLedgerService ledgerService;
    private final int parallelism;
    private final boolean scheduleEnabled;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    @Autowired
    public SettlementBatchJob(SettlementService settlementService,
                              EscrowLedgerService ledgerService,
                              @Value("${settlement.batch.parallelism:4}") int parallelism,
                              @Value("${settlement.batch.enabled:false}") boolean scheduleEnabled) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("settlement.batch.parallelism must be at least 1");
        }
        this.settlementService = settlementService;
        this.ledgerService = ledgerService;
        this.parallelism = parallelism;
        this.scheduleEnabled = scheduleEnabled;
    }

    /**
     * Monthly trigger. Closes the previous calendar month (UTC).
     */
    @Scheduled(cron = "${settlement.batch.cron:0 30 2 1 * *}", zone = "UTC")
    public void closePreviousMonth() {
        if (!scheduleEnabled) {
            return;
        }
        YearMonth previous = YearMonth.now(ZoneOffset.UTC).minusMonths(1);
        try {
            BatchResult result = runForPeriod(previous.getYear(), previous.getMonthValue());
            if (!result.isComplete()) {
                log.error("Scheduled settlement batch for {} incomplete: failed={}, cancelled={}, failedStores={}",
                        previous, result.getFailed(), result.getCancelled(), result.getFailedStores());
            }
        } catch (IllegalStateException e) {
            log.warn("Scheduled settlement batch for {} skipped: {}", previous, e.getMessage());
        }
    }

    /**
     * Closes the period for all stores with activity.
     *
     * @throws IllegalStateException if another batch is already running
     */
    public BatchResult runForPeriod(int year, int month) {
        Settlement.validatePeriod(year, month);
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A settlement batch is already running");
        }
        cancelRequested.set(false);

        long startTime = System.currentTimeMillis();
        try {
            Instant from = Settlement.periodStart(year, month);
            Instant to = Settlement.periodEnd(year, month);
            List<UUID> stores = ledgerService.findStoresWithMovements(from, to);

            log.info("Settlement batch started: period={}-{}, stores={}, parallelism={}",
                    year, String.format("%02d", month), stores.size(), parallelism);

            BatchResult result = closeAll(stores, year, month, startTime);

            log.info("Settlement batch finished: period={}-{}, closed={}, skipped={}, failed={}, cancelled={}, duration={}ms",
                    year, String.format("%02d", month), result.getClosed(), result.getSkipped(),
                    result.getFailed(), result.getCancelled(), result.getDuration().toMillis());
            return result;

        } finally {
            running.set(false);
        }
    }

    /**
     * Requests cancellation of the running batch. Stores not yet committed are rolled back.
     */
    public void cancel() {
        if (running.get()) {
            log.warn("Settlement batch cancellation requested");
        }
        cancelRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    private BatchResult closeAll(List<UUID> stores, int year, int month, long startTime) {
        int closed = 0;
        int skipped = 0;
        int cancelled = 0;
        List<UUID> failedStores = new ArrayList<>();

        if (!stores.isEmpty()) {
            ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, stores.size()));
            Map<String, String> mdc = MDC.getCopyOfContextMap();
            try {
                List<Future<PeriodCloseResult>> futures = new ArrayList<>();
                for (UUID storeId : stores) {
                    futures.add(executor.submit(() -> closeStore(storeId, year, month, mdc)));
                }

                for (int i = 0; i < futures.size(); i++) {
                    UUID storeId = stores.get(i);
                    try {
                        PeriodCloseResult result = futures.get(i).get();
                        if (result.getOutcome() == PeriodCloseResult.Outcome.CLOSED) {
                            closed++;
                        } else {
                            skipped++;
                        }
                    } catch (ExecutionException e) {
                        if (e.getCause() instanceof CancellationException) {
                            cancelled++;
                        } else {
                            failedStores.add(storeId);
                            log.error("Settlement close failed for store {}: {}", storeId,
                                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        cancelRequested.set(true);
                        cancelled += futures.size() - i;
                        break;
                    }
                }
            } finally {
                executor.shutdownNow();
            }
        }

        return BatchResult.builder()
            .year(year)
            .month(month)
            .storesFound(stores.size())
            .closed(closed)
            .skipped(skipped)
            .failed(failedStores.size())
            .cancelled(cancelled)
            .failedStores(List.copyOf(failedStores))
            .duration(Duration.ofMillis(System.currentTimeMillis() - startTime))
            .build();
    }

    private PeriodCloseResult closeStore(UUID storeId, int year, int month, Map<String, String> mdc) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            if (cancelRequested.get()) {
                throw new CancellationException("Settlement batch cancelled before store " + storeId);
            }
            return settlementService.closeSettlementPeriod(storeId, year, month, cancelRequested::get);
        } finally {
            MDC.clear();
        }
    }
}
