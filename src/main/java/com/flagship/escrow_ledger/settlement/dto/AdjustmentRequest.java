package com.flagship.escrow_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request DTO for a settlement correction. The amount is signed:
 * positive is owed to the seller, negative is recovered from the seller.
 */
@Value
public class AdjustmentRequest {

    @NotNull(message = "Original year is required")
    @Min(value = 2020, message = "Original year must be between 2020 and 2100")
    @Max(value = 2100, message = "Original year must be between 2020 and 2100")
    @JsonProperty("original_year")
    Integer originalYear;

    @NotNull(message = "Original month is required")
    @Min(value = 1, message = "Original month must be between 1 and 12")
    @Max(value = 12, message = "Original month must be between 1 and 12")
    @JsonProperty("original_month")
    Integer originalMonth;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Reason is required")
    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("related_order_id")
    UUID relatedOrderId;

    @Size(max = 50, message = "Order number must be at most 50 characters")
    @JsonProperty("related_order_number")
    String relatedOrderNumber;

    @Size(max = 100, message = "Creator must be at most 100 characters")
    @JsonProperty("created_by")
    String createdBy;
}
