package com.flagship.escrow_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Inbound event from the order service: the buyer's order was cancelled.
 * {@code refundReference} is the payment provider's refund ID when one exists.
 */
@Value
public class OrderCancelledEvent {
    UUID eventId;
    String eventType;
    UUID orderId;
    String reason;
    String refundReference;
    Instant cancelledAt;

    public static final String EVENT_TYPE = "OrderCancelled";
}
