package com.flagship.escrow_ledger.consumer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.observability.CorrelationContext;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("OrderEventConsumer")
class OrderEventConsumerTest {

    @Mock
    private IdempotentEventProcessor eventProcessor;

    @Mock
    private OrderEventHandler eventHandler;

    @Mock
    private Acknowledgment ack;

    private OrderEventConsumer consumer;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        consumer = new OrderEventConsumer(eventProcessor, eventHandler, objectMapper);

        // Run the handler the way the real processor does for a first delivery
        when(eventProcessor.processEvent(any(), anyString(), anyString(), any(), anyString(), any()))
            .thenAnswer(inv -> {
                Runnable handler = inv.getArgument(5);
                handler.run();
                return true;
            });
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("order-events", 0, 42L, "key", value);
    }

    private static String paymentConfirmedJson(UUID eventId, UUID orderId, UUID storeId, UUID shipmentId) {
        return """
            {
              "eventId": "%s",
              "eventType": "OrderPaymentConfirmed",
              "orderId": "%s",
              "orderNumber": "ORD-1001",
              "buyerId": "%s",
              "totalAmount": 100.00,
              "currency": "USD",
              "paymentTransactionId": "txn-1",
              "sellerShares": [
                {
                  "storeId": "%s",
                  "shipmentId": "%s",
                  "sellerAmount": 90.00,
                  "shippingAmount": 10.00,
                  "commissionRate": 10
                }
              ],
              "occurredAt": "2024-03-15T10:00:00Z"
            }
            """.formatted(eventId, orderId, UUID.randomUUID(), storeId, shipmentId);
    }

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("OrderPaymentConfirmed is deserialized and handed to the handler")
        void routesPaymentConfirmed() {
            UUID eventId = UUID.randomUUID();
            UUID orderId = UUID.randomUUID();
            UUID storeId = UUID.randomUUID();
            UUID shipmentId = UUID.randomUUID();

            consumer.consume(record(paymentConfirmedJson(eventId, orderId, storeId, shipmentId)), ack);

            ArgumentCaptor<OrderPaymentConfirmedEvent> captor = ArgumentCaptor.forClass(OrderPaymentConfirmedEvent.class);
            verify(eventHandler).onOrderPaymentConfirmed(captor.capture());
            OrderPaymentConfirmedEvent event = captor.getValue();
            assertEquals(orderId, event.getOrderId());
            assertEquals("ORD-1001", event.getOrderNumber());
            assertEquals(0, new BigDecimal("100.00").compareTo(event.getTotalAmount()));
            assertEquals(1, event.getSellerShares().size());
            assertEquals(storeId, event.getSellerShares().get(0).getStoreId());
            assertEquals(shipmentId, event.getSellerShares().get(0).getShipmentId());

            verify(eventProcessor).processEvent(eq(eventId), eq(OrderPaymentConfirmedEvent.EVENT_TYPE),
                eq(OrderEventConsumer.AGGREGATE_TYPE), eq(orderId), eq(OrderEventConsumer.CONSUMER_GROUP), any());
            verify(ack).acknowledge();
        }

        @Test
        @DisplayName("ShipmentDelivered is deserialized and handed to the handler")
        void routesShipmentDelivered() {
            UUID shipmentId = UUID.randomUUID();
            String json = """
                {"eventId":"%s","eventType":"ShipmentDelivered","orderId":"%s","shipmentId":"%s",
                 "deliveredAt":"2024-03-18T09:30:00Z"}
                """.formatted(UUID.randomUUID(), UUID.randomUUID(), shipmentId);

            consumer.consume(record(json), ack);

            ArgumentCaptor<ShipmentDeliveredEvent> captor = ArgumentCaptor.forClass(ShipmentDeliveredEvent.class);
            verify(eventHandler).onShipmentDelivered(captor.capture());
            assertEquals(shipmentId, captor.getValue().getShipmentId());
            verify(ack).acknowledge();
        }

        @Test
        @DisplayName("Unknown event types are recorded as skipped and acknowledged")
        void skipsUnknownType() {
            UUID eventId = UUID.randomUUID();
            UUID orderId = UUID.randomUUID();
            String json = """
                {"eventId":"%s","eventType":"OrderShipped","orderId":"%s"}
                """.formatted(eventId, orderId);

            consumer.consume(record(json), ack);

            verify(eventProcessor).skipEvent(eq(eventId), eq("OrderShipped"), eq(OrderEventConsumer.AGGREGATE_TYPE),
                eq(orderId), eq(OrderEventConsumer.CONSUMER_GROUP), anyString());
            verify(eventHandler, never()).onOrderPaymentConfirmed(any());
            verify(eventHandler, never()).onShipmentDelivered(any());
            verify(eventHandler, never()).onOrderCancelled(any());
            verify(ack).acknowledge();
        }

        @Test
        @DisplayName("OrderCancelled is deserialized and handed to the handler")
        void routesOrderCancelled() {
            UUID eventId = UUID.randomUUID();
            UUID orderId = UUID.randomUUID();
            String json = """
                {"eventId":"%s","eventType":"OrderCancelled","orderId":"%s","reason":"buyer_request",
                 "refundReference":"re_123","cancelledAt":"2024-03-16T12:00:00Z"}
                """.formatted(eventId, orderId);

            consumer.consume(record(json), ack);

            ArgumentCaptor<OrderCancelledEvent> captor = ArgumentCaptor.forClass(OrderCancelledEvent.class);
            verify(eventHandler).onOrderCancelled(captor.capture());
            assertEquals(orderId, captor.getValue().getOrderId());
            assertEquals("re_123", captor.getValue().getRefundReference());
            verify(eventProcessor).processEvent(eq(eventId), eq(OrderCancelledEvent.EVENT_TYPE),
                eq(OrderEventConsumer.AGGREGATE_TYPE), eq(orderId), eq(OrderEventConsumer.CONSUMER_GROUP), any());
            verify(eventProcessor, never()).skipEvent(any(), anyString(), anyString(), any(), anyString(), anyString());
            verify(ack).acknowledge();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Malformed JSON is acknowledged and dropped")
        void dropsMalformed() {
            consumer.consume(record("{not json"), ack);

            verify(ack).acknowledge();
            verify(eventProcessor, never()).processEvent(any(), anyString(), anyString(), any(), anyString(), any());
        }

        @Test
        @DisplayName("Envelope without an eventId is acknowledged and dropped")
        void dropsIncompleteEnvelope() {
            consumer.consume(record("{\"eventType\":\"ShipmentDelivered\",\"orderId\":\"" + UUID.randomUUID() + "\"}"), ack);

            verify(ack).acknowledge();
            verify(eventHandler, never()).onShipmentDelivered(any());
        }

        @Test
        @DisplayName("Handler failure is rethrown and the record is not acknowledged")
        void handlerFailureNotAcknowledged() {
            doThrow(new InvalidArgumentException("no shipment"))
                .when(eventHandler).onShipmentDelivered(any());
            String json = """
                {"eventId":"%s","eventType":"ShipmentDelivered","orderId":"%s","shipmentId":"%s"}
                """.formatted(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

            assertThrows(InvalidArgumentException.class, () -> consumer.consume(record(json), ack));

            verify(ack, never()).acknowledge();
        }
    }

    @Nested
    @DisplayName("Correlation")
    class Correlation {

        @Test
        @DisplayName("Correlation header is propagated while handling and cleared afterwards")
        void propagatesCorrelationId() {
            String[] seen = new String[1];
            doAnswer(inv -> {
                seen[0] = CorrelationContext.getCorrelationId();
                return null;
            }).when(eventHandler).onShipmentDelivered(any());
            ConsumerRecord<String, String> record = record("""
                {"eventId":"%s","eventType":"ShipmentDelivered","orderId":"%s","shipmentId":"%s"}
                """.formatted(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID()));
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                "corr-123".getBytes(StandardCharsets.UTF_8));

            consumer.consume(record, ack);

            assertEquals("corr-123", seen[0]);
            assertFalse(CorrelationContext.hasCorrelationId());
        }
    }

    @Test
    @DisplayName("parseEvent rejects a non-UUID eventId")
    void parseRejectsBadUuid() {
        assertNull(consumer.parseEvent("{\"eventId\":\"abc\",\"eventType\":\"X\",\"orderId\":\"" + UUID.randomUUID() + "\"}"));
    }
}
