package com.flagship.escrow_ledger.consumer;

import com.flagship.escrow_ledger.escrow.EscrowAllocation;
import com.flagship.escrow_ledger.escrow.EscrowPayment;
import com.flagship.escrow_ledger.escrow.EscrowPaymentStatus;
import com.flagship.escrow_ledger.escrow.EscrowService;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Applies order and fulfillment events to escrow.
 *
 * Handlers run behind {@link IdempotentEventProcessor}. Each operation is
 * also idempotent on its own: a confirmed order is escrowed once, an already
 * eligible allocation is left alone and a refunded order has nothing left to refund.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderEventHandler {

    static final String INITIATOR = "order-events";

    private final EscrowService escrowService;

    public void onOrderPaymentConfirmed(OrderPaymentConfirmedEvent event) {
        log.info("Handling OrderPaymentConfirmed: orderId={}, amount={} {}, sellers={}",
                event.getOrderId(), event.getTotalAmount(), event.getCurrency(),
                event.getSellerShares() != null ? event.getSellerShares().size() : 0);

        EscrowPayment payment = escrowService.onOrderPaymentConfirmed(
            event.getOrderId(),
            event.getOrderNumber(),
            event.getBuyerId(),
            event.getTotalAmount(),
            event.getCurrency(),
            event.getPaymentTransactionId(),
            event.getSellerShares(),
            INITIATOR
        );

        log.debug("Order {} held in escrow payment {}", event.getOrderId(), payment.getId());
    }

    public void onShipmentDelivered(ShipmentDeliveredEvent event) {
        if (event.getShipmentId() == null) {
            throw new InvalidArgumentException("ShipmentDelivered event " + event.getEventId() + " has no shipment ID");
        }
        log.info("Handling ShipmentDelivered: orderId={}, shipmentId={}", event.getOrderId(), event.getShipmentId());

        List<EscrowAllocation> eligible = escrowService.onShipmentDeliveredByShipment(event.getShipmentId(), INITIATOR);

        log.debug("Shipment {} made {} allocation(s) eligible", event.getShipmentId(), eligible.size());
    }

    /**
     * Refunds whatever the cancelled order still holds in escrow.
     *
     * An order cancelled before payment has no escrow, and an order whose funds
     * all went to sellers cannot be refunded from escrow; both are logged and
     * the event is consumed.
     */
    public void onOrderCancelled(OrderCancelledEvent event) {
        log.info("Handling OrderCancelled: orderId={}, reason={}", event.getOrderId(), event.getReason());

        Optional<EscrowPayment> escrow = escrowService.findByOrderId(event.getOrderId());
        if (escrow.isEmpty()) {
            log.info("Cancelled order {} was never escrowed, nothing to refund", event.getOrderId());
            return;
        }
        if (escrow.get().getStatus() == EscrowPaymentStatus.RELEASED) {
            log.warn("Cancelled order {} was already released to its sellers, refund must be handled outside escrow",
                    event.getOrderId());
            return;
        }

        String reference = event.getRefundReference() != null
            ? event.getRefundReference()
            : "cancel-" + event.getEventId();
        EscrowPayment refunded = escrowService.refundOrder(event.getOrderId(), reference, INITIATOR);

        log.debug("Cancelled order {} refunded: status={}", event.getOrderId(), refunded.getStatus());
    }
}
