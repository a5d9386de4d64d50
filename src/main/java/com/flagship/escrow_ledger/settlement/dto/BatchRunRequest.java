package com.flagship.escrow_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class BatchRunRequest {

    @NotNull(message = "Year is required")
    @Min(value = 2020, message = "Year must be between 2020 and 2100")
    @Max(value = 2100, message = "Year must be between 2020 and 2100")
    @JsonProperty("year")
    Integer year;

    @NotNull(message = "Month is required")
    @Min(value = 1, message = "Month must be between 1 and 12")
    @Max(value = 12, message = "Month must be between 1 and 12")
    @JsonProperty("month")
    Integer month;
}
