package com.flagship.escrow_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for escrow and settlement operations.
 *
 * Metrics exposed:
 * - escrow.created: escrow payments created, tagged by currency and outcome
 * - escrow.released / escrow.refunded: fund movements, tagged by currency and full/partial
 * - escrow.operations: every coordinated mutation, tagged by operation and outcome
 * - escrow.latency: operation latency
 * - escrow.contention: lock timeouts and version conflicts
 * - escrow.integrity_violation: balance guard failures, alert on any increment
 * - escrow.open.payments: payments still holding funds, refreshed by {@link MetricsScheduler}
 * - settlement.closed / settlement.adjustments: period close and corrections
 */
@Component
public class EscrowMetrics {

    private final MeterRegistry registry;

    private final Counter integrityViolations;
    private final Timer periodCloseTimer;
    private final AtomicLong openPayments = new AtomicLong(0);

    public EscrowMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.integrityViolations = Counter.builder("escrow.integrity_violation")
                .description("Releases or refunds rejected by the escrow balance guard")
                .register(registry);

        this.periodCloseTimer = Timer.builder("settlement.close.duration")
                .description("Time taken to close a settlement period for one store")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder("escrow.open.payments", openPayments, AtomicLong::get)
                .description("Escrow payments in HELD or PARTIALLY_RELEASED")
                .register(registry);
    }

    // ==================== Escrow Lifecycle ====================

    public void recordEscrowCreated(String currency, String status) {
        registry.counter("escrow.created",
                "currency", sanitizeTag(currency),
                "status", sanitizeTag(status)
        ).increment();
    }

    /**
     * Records a release or refund.
     *
     * @param operation "release" or "refund"
     * @param full whether the allocation's share was exhausted
     */
    public void recordFundsMoved(String operation, String currency, boolean full) {
        String name = "release".equals(operation) ? "escrow.released" : "escrow.refunded";
        registry.counter(name,
                "currency", sanitizeTag(currency),
                "kind", full ? "full" : "partial"
        ).increment();
    }

    public void recordOperation(String operation, String outcome) {
        registry.counter("escrow.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("escrow.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordContention(String reason) {
        registry.counter("escrow.contention", "reason", sanitizeTag(reason)).increment();
    }

    public void recordIntegrityViolation() {
        integrityViolations.increment();
    }

    public void updateOpenPayments(long count) {
        openPayments.set(count);
    }

    // ==================== Idempotency ====================

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // ==================== Settlement ====================

    public void recordSettlementClosed(String outcome) {
        registry.counter("settlement.closed", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordPeriodCloseDuration(Duration duration) {
        periodCloseTimer.record(duration);
    }

    public void recordAdjustment(String direction) {
        registry.counter("settlement.adjustments", "direction", sanitizeTag(direction)).increment();
    }

    // ==================== Event Processing ====================

    public void recordEventProcessed(String eventType, boolean wasNew) {
        registry.counter("event.processed",
                "event_type", sanitizeTag(eventType),
                "was_new", String.valueOf(wasNew)
        ).increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        registry.counter("event.processing.failure",
                "event_type", sanitizeTag(eventType),
                "error", sanitizeTag(error)
        ).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
