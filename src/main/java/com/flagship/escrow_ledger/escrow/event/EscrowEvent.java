package com.flagship.escrow_ledger.escrow.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events published about an escrow payment.
 *
 * All escrow events share:
 * - Event ID for deduplication in consumers
 * - Escrow payment ID (aggregate ID and Kafka key)
 * - Timestamp of when the event occurred
 */
public interface EscrowEvent {

    /**
     * Unique identifier for this event instance.
     */
    UUID getEventId();

    /**
     * The escrow payment this event is about.
     */
    UUID getEscrowPaymentId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
