package com.flagship.escrow_ledger.consumer;

import com.flagship.escrow_ledger.escrow.SellerShare;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Inbound event from order processing: the buyer's payment was captured and
 * the order split into seller shares.
 */
@Value
public class OrderPaymentConfirmedEvent {
    UUID eventId;
    String eventType;
    UUID orderId;
    String orderNumber;
    UUID buyerId;
    BigDecimal totalAmount;
    String currency;
    String paymentTransactionId;
    List<SellerShare> sellerShares;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderPaymentConfirmed";
}
