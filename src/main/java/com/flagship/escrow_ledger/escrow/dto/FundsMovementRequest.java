package com.flagship.escrow_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for releasing or refunding allocation funds.
 * A missing amount moves the allocation's whole remaining share.
 */
@Value
public class FundsMovementRequest {

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @Size(max = 100, message = "Reference must be at most 100 characters")
    @JsonProperty("reference")
    String reference;

    @Size(max = 100, message = "Initiator must be at most 100 characters")
    @JsonProperty("initiated_by")
    String initiatedBy;
}
