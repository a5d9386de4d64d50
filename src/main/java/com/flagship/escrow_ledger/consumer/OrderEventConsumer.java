package com.flagship.escrow_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.escrow_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Kafka consumer for order and fulfillment events.
 *
 * This consumer:
 * 1. Receives events from the order-events topic
 * 2. Reads the envelope (eventId, eventType, orderId)
 * 3. Routes OrderPaymentConfirmed, ShipmentDelivered and OrderCancelled to {@link OrderEventHandler}
 * 4. Acknowledges only after the handler's transaction committed
 *
 * Unparseable records are acknowledged and dropped. Handler failures are not
 * acknowledged, so Kafka redelivers them.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OrderEventConsumer {

    static final String CONSUMER_GROUP = "escrow-order-consumer";
    static final String AGGREGATE_TYPE = "Order";

    private final IdempotentEventProcessor eventProcessor;
    private final OrderEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.order-events:order-events}",
        groupId = "${spring.kafka.consumer.group-id:escrow-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String correlationId = headerValue(record, CorrelationContext.CORRELATION_ID_HEADER);
        CorrelationContext.setCorrelationId(correlationId);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());

        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        try {
            EventEnvelope envelope = parseEvent(record.value());

            if (envelope == null) {
                log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            boolean processed = routeEvent(envelope, record.value());
            ack.acknowledge();

            if (processed) {
                log.info("Processed event: type={}, eventId={}, orderId={}",
                        envelope.eventType, envelope.eventId, envelope.orderId);
            }

        } catch (Exception e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;

        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clear();
        }
    }

    private boolean routeEvent(EventEnvelope envelope, String rawPayload) {
        return switch (envelope.eventType) {
            case OrderPaymentConfirmedEvent.EVENT_TYPE -> eventProcessor.processEvent(
                envelope.eventId, envelope.eventType, AGGREGATE_TYPE, envelope.orderId, CONSUMER_GROUP,
                () -> eventHandler.onOrderPaymentConfirmed(deserialize(rawPayload, OrderPaymentConfirmedEvent.class))
            );
            case ShipmentDeliveredEvent.EVENT_TYPE -> eventProcessor.processEvent(
                envelope.eventId, envelope.eventType, AGGREGATE_TYPE, envelope.orderId, CONSUMER_GROUP,
                () -> eventHandler.onShipmentDelivered(deserialize(rawPayload, ShipmentDeliveredEvent.class))
            );
            case OrderCancelledEvent.EVENT_TYPE -> eventProcessor.processEvent(
                envelope.eventId, envelope.eventType, AGGREGATE_TYPE, envelope.orderId, CONSUMER_GROUP,
                () -> eventHandler.onOrderCancelled(deserialize(rawPayload, OrderCancelledEvent.class))
            );
            default -> {
                log.debug("Unhandled event type: {}, skipping", envelope.eventType);
                eventProcessor.skipEvent(
                    envelope.eventId, envelope.eventType, AGGREGATE_TYPE, envelope.orderId,
                    CONSUMER_GROUP, "Unhandled event type"
                );
                yield false;
            }
        };
    }

    /**
     * Reads the fields every order event carries.
     *
     * @return null if the payload is not JSON or a field is missing
     */
    EventEnvelope parseEvent(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("eventType")
                    || !node.hasNonNull("orderId")) {
                log.warn("Event envelope is missing eventId, eventType or orderId");
                return null;
            }
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                UUID.fromString(node.get("orderId").asText()),
                node.get("eventType").asText()
            );

        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static String headerValue(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }

    record EventEnvelope(UUID eventId, UUID orderId, String eventType) {}
}
