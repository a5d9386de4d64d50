package com.flagship.escrow_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_ledger.escrow.SellerBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class SellerBalanceResponse {

    @JsonProperty("store_id")
    UUID storeId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("held_amount")
    BigDecimal heldAmount;

    @JsonProperty("eligible_amount")
    BigDecimal eligibleAmount;

    @JsonProperty("pending_commission")
    BigDecimal pendingCommission;

    @JsonProperty("open_allocations")
    int openAllocations;

    public static SellerBalanceResponse from(SellerBalance balance) {
        return SellerBalanceResponse.builder()
            .storeId(balance.getStoreId())
            .currency(balance.getCurrency())
            .heldAmount(balance.getHeldAmount().getAmount())
            .eligibleAmount(balance.getEligibleAmount().getAmount())
            .pendingCommission(balance.getPendingCommission().getAmount())
            .openAllocations(balance.getOpenAllocations())
            .build();
    }
}
