package com.flagship.escrow_ledger.consumer;

import com.flagship.escrow_ledger.observability.EscrowMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs an inbound event's handler at most once per consumer group.
 *
 * The processed_events row is written in the same transaction as the
 * handler's effects. If the handler fails, both roll back and the event is
 * redelivered by Kafka.
 *
 * Usage:
 * <pre>
 * eventProcessor.processEvent(
 *     eventId, eventType, aggregateType, aggregateId, consumerGroup,
 *     () -> escrowService.onShipmentDeliveredByShipment(shipmentId, initiator)
 * );
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final EscrowMetrics metrics;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping",
                    eventId, consumerGroup);
            metrics.recordEventProcessed(eventType, false);
            return false;
        }

        try {
            handler.run();

            repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.success(
                eventId, eventType, aggregateType, aggregateId, consumerGroup
            )));
            metrics.recordEventProcessed(eventType, true);

            log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
            return true;

        } catch (Exception e) {
            metrics.recordEventProcessingFailure(eventType, e.getClass().getSimpleName());
            log.error("Failed to process event {} by consumer group {}: {}",
                    eventId, consumerGroup, e.getMessage());
            throw e;
        }
    }

    /**
     * Records an event that needs no handling so a replay does not look at it again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }

        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(
            eventId, eventType, aggregateType, aggregateId, consumerGroup, reason
        )));

        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
