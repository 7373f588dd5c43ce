package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.transfer.TransferEntity;
import com.flagship.wealth_ledger.transfer.TransferKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("from_account_id")
    UUID fromAccountId;

    @JsonProperty("to_account_id")
    UUID toAccountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("kind")
    TransferKind kind;

    @JsonProperty("transfer_date")
    LocalDate transferDate;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransferResponse from(TransferEntity transfer) {
        return TransferResponse.builder()
            .id(transfer.getId())
            .fromAccountId(transfer.getFromAccountId())
            .toAccountId(transfer.getToAccountId())
            .amount(transfer.getAmount())
            .kind(transfer.getKind())
            .transferDate(transfer.getTransferDate())
            .notes(transfer.getNotes())
            .createdAt(transfer.getCreatedAt())
            .build();
    }
}
