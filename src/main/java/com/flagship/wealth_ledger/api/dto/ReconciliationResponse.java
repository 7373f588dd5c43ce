package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.journal.Reconciliation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("stored_balance")
    BigDecimal storedBalance;

    @JsonProperty("replayed_balance")
    BigDecimal replayedBalance;

    @JsonProperty("entry_count")
    long entryCount;

    @JsonProperty("balanced")
    boolean balanced;

    public static ReconciliationResponse from(Reconciliation reconciliation) {
        return ReconciliationResponse.builder()
            .accountId(reconciliation.getAccountId())
            .storedBalance(reconciliation.getStoredBalance())
            .replayedBalance(reconciliation.getReplayedBalance())
            .entryCount(reconciliation.getEntryCount())
            .balanced(reconciliation.isBalanced())
            .build();
    }
}
