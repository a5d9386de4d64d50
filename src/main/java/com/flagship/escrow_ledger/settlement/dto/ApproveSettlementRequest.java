package com.flagship.escrow_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ApproveSettlementRequest {

    @NotBlank(message = "Approver is required")
    @Size(max = 100, message = "Approver must be at most 100 characters")
    @JsonProperty("approved_by")
    String approvedBy;
}
