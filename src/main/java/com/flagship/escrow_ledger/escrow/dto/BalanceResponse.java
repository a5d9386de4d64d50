package com.flagship.escrow_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class BalanceResponse {

    @JsonProperty("escrow_payment_id")
    UUID escrowPaymentId;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    @JsonProperty("currency")
    String currency;
}
