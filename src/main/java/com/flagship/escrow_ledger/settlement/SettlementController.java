package com.flagship.escrow_ledger.settlement;

import com.flagship.escrow_ledger.settlement.dto.AdjustmentRequest;
import com.flagship.escrow_ledger.settlement.dto.AdjustmentResponse;
import com.flagship.escrow_ledger.settlement.dto.ApproveSettlementRequest;
import com.flagship.escrow_ledger.settlement.dto.BatchRunRequest;
import com.flagship.escrow_ledger.settlement.dto.CloseSettlementRequest;
import com.flagship.escrow_ledger.settlement.dto.CloseSettlementResponse;
import com.flagship.escrow_ledger.settlement.dto.SettlementExportResponse;
import com.flagship.escrow_ledger.settlement.dto.SettlementResponse;
import com.flagship.escrow_ledger.settlement.dto.SettlementSummaryResponse;
import com.flagship.escrow_ledger.settlement.dto.UpdateNotesRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST Controller for settlement operations.
 *
 * Closing a period answers 201 when a settlement was created and 200 when it
 * already existed or the store had no activity (see the outcome field).
 * GET /{id}/export returns the payout file rows; POST /{id}/export records
 * that the file was sent.
 */
@RestController
@RequestMapping("/api/settlements")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private final SettlementService settlementService;
    private final SettlementBatchJob batchJob;

    @PostMapping("/close")
    public ResponseEntity<CloseSettlementResponse> closePeriod(@Valid @RequestBody CloseSettlementRequest request) {
        PeriodCloseResult result = settlementService.closeSettlementPeriod(
            request.getStoreId(), request.getYear(), request.getMonth());

        HttpStatus status = result.getOutcome() == PeriodCloseResult.Outcome.CLOSED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(CloseSettlementResponse.from(result));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchResult> runBatch(@Valid @RequestBody BatchRunRequest request) {
        log.info("Manual settlement batch requested for {}-{}", request.getYear(), request.getMonth());
        return ResponseEntity.ok(batchJob.runForPeriod(request.getYear(), request.getMonth()));
    }

    @PostMapping("/batch/cancel")
    public ResponseEntity<Void> cancelBatch() {
        batchJob.cancel();
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/summary")
    public ResponseEntity<SettlementSummaryResponse> getSummary(@RequestParam("year") int year,
                                                                @RequestParam("month") int month) {
        return ResponseEntity.ok(SettlementSummaryResponse.from(settlementService.getSummary(year, month)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SettlementResponse> getSettlement(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(SettlementResponse.withDetails(settlementService.getSettlement(id)));
    }

    @GetMapping
    public ResponseEntity<List<SettlementResponse>> getSettlementsForStore(@RequestParam("storeId") UUID storeId) {
        return ResponseEntity.ok(settlementService.getSettlementsForStore(storeId).stream()
            .map(SettlementResponse::summary)
            .toList());
    }

    @PostMapping("/{id}/adjustments")
    public ResponseEntity<AdjustmentResponse> recordAdjustment(
            @PathVariable("id") UUID id,
            @Valid @RequestBody AdjustmentRequest request) {
        SettlementAdjustment adjustment = settlementService.recordAdjustment(
            id,
            request.getOriginalYear(),
            request.getOriginalMonth(),
            request.getAmount(),
            request.getReason(),
            request.getRelatedOrderId(),
            request.getRelatedOrderNumber(),
            request.getCreatedBy()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(AdjustmentResponse.from(adjustment));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<SettlementResponse> approve(
            @PathVariable("id") UUID id,
            @Valid @RequestBody ApproveSettlementRequest request) {
        return ResponseEntity.ok(SettlementResponse.summary(settlementService.approve(id, request.getApprovedBy())));
    }

    @GetMapping("/{id}/export")
    public ResponseEntity<SettlementExportResponse> getExport(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(SettlementExportResponse.from(settlementService.getExport(id)));
    }

    @PostMapping("/{id}/export")
    public ResponseEntity<SettlementResponse> markExported(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(SettlementResponse.summary(settlementService.markExported(id)));
    }

    @PutMapping("/{id}/notes")
    public ResponseEntity<SettlementResponse> updateNotes(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateNotesRequest request) {
        return ResponseEntity.ok(SettlementResponse.summary(settlementService.updateNotes(id, request.getNotes())));
    }
}
