package com.flagship.escrow_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Inbound event from fulfillment: a shipment reached the buyer.
 */
@Value
public class ShipmentDeliveredEvent {
    UUID eventId;
    String eventType;
    UUID orderId;
    UUID shipmentId;
    Instant deliveredAt;

    public static final String EVENT_TYPE = "ShipmentDelivered";
}
