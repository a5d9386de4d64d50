package com.flagship.escrow_ledger.observability;

import com.flagship.escrow_ledger.escrow.EscrowPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final EscrowMetrics escrowMetrics;
    private final EscrowPersistenceService escrowPersistence;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        refreshOpenPayments();
    }

    void refreshOpenPayments() {
        try {
            escrowMetrics.updateOpenPayments(escrowPersistence.countOpenPayments());
        } catch (Exception e) {
            log.warn("Failed to refresh open escrow payment gauge: {}", e.getMessage());
        }
    }
}
