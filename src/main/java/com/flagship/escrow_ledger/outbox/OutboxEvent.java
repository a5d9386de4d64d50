package com.flagship.escrow_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An escrow or settlement event waiting in the outbox.
 *
 * Written in the same transaction as the state change it describes and
 * published to Kafka afterwards by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "EscrowPayment" or "Settlement"
    UUID aggregateId;          // Kafka message key
    String eventType;          // e.g. "AllocationReleased"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        if (aggregateType == null || aggregateId == null || eventType == null) {
            throw new IllegalArgumentException("Outbox event needs aggregate type, aggregate ID and event type");
        }
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * True once the publisher gave up on this event.
     */
    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
