package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.escrow.dto.AllocationResponse;
import com.flagship.escrow_ledger.escrow.dto.BalanceResponse;
import com.flagship.escrow_ledger.escrow.dto.CreateEscrowRequest;
import com.flagship.escrow_ledger.escrow.dto.EscrowPaymentResponse;
import com.flagship.escrow_ledger.escrow.dto.FundsMovementRequest;
import com.flagship.escrow_ledger.escrow.dto.LedgerEntryResponse;
import com.flagship.escrow_ledger.escrow.dto.SellerBalanceResponse;
import com.flagship.escrow_ledger.ledger.ReconciliationResult;
import com.flagship.escrow_ledger.money.Money;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST Controller for escrow operations.
 *
 * Creation is idempotent per order ID: repeating the request returns the
 * existing escrow payment with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/escrow")
@RequiredArgsConstructor
@Slf4j
public class EscrowController {

    private static final String INITIATOR_HEADER = "X-Initiated-By";

    private final EscrowService escrowService;

    @PostMapping
    public ResponseEntity<EscrowPaymentResponse> createEscrow(@Valid @RequestBody CreateEscrowRequest request) {
        log.info("Received escrow creation request: orderId={}, amount={} {}",
                request.getOrderId(), request.getTotalAmount(), request.getCurrency());

        boolean alreadyEscrowed = escrowService.findByOrderId(request.getOrderId()).isPresent();
        EscrowPayment payment = escrowService.onOrderPaymentConfirmed(
            request.getOrderId(),
            request.getOrderNumber(),
            request.getBuyerId(),
            request.getTotalAmount(),
            request.getCurrency(),
            request.getPaymentTransactionId(),
            request.toSellerShares(),
            request.getInitiatedBy()
        );

        HttpStatus status = alreadyEscrowed ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(EscrowPaymentResponse.from(payment));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EscrowPaymentResponse> getEscrowPayment(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(EscrowPaymentResponse.from(escrowService.getEscrowPayment(id)));
    }

    @GetMapping("/orders/{orderId}")
    public ResponseEntity<EscrowPaymentResponse> getByOrder(@PathVariable("orderId") UUID orderId) {
        return ResponseEntity.ok(EscrowPaymentResponse.from(escrowService.getByOrderId(orderId)));
    }

    @PostMapping("/orders/{orderId}/refund")
    public ResponseEntity<EscrowPaymentResponse> refundOrder(
            @PathVariable("orderId") UUID orderId,
            @RequestParam(value = "reference", required = false) String reference,
            @RequestHeader(value = INITIATOR_HEADER, required = false) String initiatedBy) {
        log.info("Received order refund request: orderId={}", orderId);
        return ResponseEntity.ok(EscrowPaymentResponse.from(escrowService.refundOrder(orderId, reference, initiatedBy)));
    }

    @GetMapping("/{id}/ledger")
    public ResponseEntity<List<LedgerEntryResponse>> getLedger(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(escrowService.getLedger(id).stream()
            .map(LedgerEntryResponse::from)
            .toList());
    }

    @GetMapping("/{id}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("id") UUID id) {
        Money remaining = escrowService.getRemainingBalance(id);
        return ResponseEntity.ok(new BalanceResponse(id, remaining.getAmount(), remaining.getCurrency()));
    }

    @GetMapping("/{id}/reconciliation")
    public ResponseEntity<ReconciliationResult> reconcile(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(escrowService.reconcile(id));
    }

    @PostMapping("/allocations/{allocationId}/eligible")
    public ResponseEntity<AllocationResponse> markEligible(
            @PathVariable("allocationId") UUID allocationId,
            @RequestHeader(value = INITIATOR_HEADER, required = false) String initiatedBy) {
        return ResponseEntity.ok(AllocationResponse.from(escrowService.onShipmentDelivered(allocationId, initiatedBy)));
    }

    @PostMapping("/allocations/{allocationId}/release")
    public ResponseEntity<EscrowPaymentResponse> release(
            @PathVariable("allocationId") UUID allocationId,
            @Valid @RequestBody FundsMovementRequest request) {
        EscrowPayment payment = escrowService.requestRelease(allocationId, request.getAmount(),
            request.getCurrency(), request.getReference(), request.getInitiatedBy());
        return ResponseEntity.ok(EscrowPaymentResponse.from(payment));
    }

    @PostMapping("/allocations/{allocationId}/refund")
    public ResponseEntity<EscrowPaymentResponse> refund(
            @PathVariable("allocationId") UUID allocationId,
            @Valid @RequestBody FundsMovementRequest request) {
        EscrowPayment payment = escrowService.requestRefund(allocationId, request.getAmount(),
            request.getCurrency(), request.getReference(), request.getInitiatedBy());
        return ResponseEntity.ok(EscrowPaymentResponse.from(payment));
    }

    @GetMapping("/stores/{storeId}/balance")
    public ResponseEntity<List<SellerBalanceResponse>> getSellerBalance(@PathVariable("storeId") UUID storeId) {
        return ResponseEntity.ok(escrowService.getSellerBalance(storeId).stream()
            .map(SellerBalanceResponse::from)
            .toList());
    }
}
