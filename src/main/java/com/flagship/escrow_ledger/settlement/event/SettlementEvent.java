package com.flagship.escrow_ledger.settlement.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events published about a settlement. The settlement ID
 * is the aggregate ID and Kafka key.
 */
public interface SettlementEvent {

    UUID getEventId();

    UUID getSettlementId();

    Instant getOccurredAt();

    String getEventType();
}
