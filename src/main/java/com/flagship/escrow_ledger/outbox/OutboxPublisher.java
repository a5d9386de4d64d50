package com.flagship.escrow_ledger.outbox;

import com.flagship.escrow_ledger.escrow.EscrowService;
import com.flagship.escrow_ledger.observability.OutboxMetrics;
import com.flagship.escrow_ledger.settlement.SettlementService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Publishes outbox events to Kafka.
 *
 * Each poll locks a batch of unpublished events (SKIP LOCKED), sends them
 * one by one and marks each published once Kafka acknowledged it. The
 * aggregate ID is the message key, so all events of one escrow payment or
 * settlement land on one partition in order.
 *
 * A failed send increments the event's retry count. After
 * outbox.publisher.max-retries attempts the event is dead-lettered: it stays
 * in the table for manual replay and is no longer polled.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final String escrowEventsTopic;
    private final int batchSize;
    private final int maxRetries;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${kafka.topic.escrow-events:escrow-events}") String escrowEventsTopic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.escrowEventsTopic = escrowEventsTopic;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
    }

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize, maxRetries);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());

            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = topicFor(event);
        String key = event.getAggregateId().toString();

        try {
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, event.getPayload());
            SendResult<String, String> result = future.get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getAggregateType(), event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}, will retry on next poll", event.getId());

        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getAggregateType(), event.getEventType());

            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached {} attempts and is dead-lettered: eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    /**
     * All escrow and settlement events share one topic; consumers route on eventType.
     */
    String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case EscrowService.AGGREGATE_TYPE, SettlementService.AGGREGATE_TYPE -> escrowEventsTopic;
            default -> {
                log.warn("Unknown aggregate type {} on event {}, using {}",
                        event.getAggregateType(), event.getId(), escrowEventsTopic);
                yield escrowEventsTopic;
            }
        };
    }

    /**
     * Runs one poll immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
