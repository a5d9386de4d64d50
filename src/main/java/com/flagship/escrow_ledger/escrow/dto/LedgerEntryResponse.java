package com.flagship.escrow_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_ledger.ledger.EscrowLedgerEntry;
import com.flagship.escrow_ledger.ledger.LedgerAction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    @JsonProperty("allocation_id")
    UUID allocationId;

    @JsonProperty("store_id")
    UUID storeId;

    @JsonProperty("action")
    LedgerAction action;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("external_reference")
    String externalReference;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("initiated_by")
    String initiatedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(EscrowLedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .sequenceNumber(entry.getSequenceNumber())
            .allocationId(entry.getAllocationId())
            .storeId(entry.getStoreId())
            .action(entry.getAction())
            .amount(entry.getAmount())
            .currency(entry.getCurrency())
            .balanceAfter(entry.getBalanceAfter())
            .externalReference(entry.getExternalReference())
            .notes(entry.getNotes())
            .initiatedBy(entry.getInitiatedBy())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
