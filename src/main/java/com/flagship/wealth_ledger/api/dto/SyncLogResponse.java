package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.sync.MarketSyncLogEntity;
import com.flagship.wealth_ledger.sync.SyncStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SyncLogResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("synced_at")
    Instant syncedAt;

    @JsonProperty("status")
    SyncStatus status;

    @JsonProperty("total_value")
    BigDecimal totalValue;

    @JsonProperty("holdings_count")
    int holdingsCount;

    @JsonProperty("failed_count")
    int failedCount;

    @JsonProperty("error_message")
    String errorMessage;

    public static SyncLogResponse from(MarketSyncLogEntity log) {
        return SyncLogResponse.builder()
            .id(log.getId())
            .accountId(log.getAccountId())
            .syncedAt(log.getSyncedAt())
            .status(log.getStatus())
            .totalValue(log.getTotalValue())
            .holdingsCount(log.getHoldingsCount())
            .failedCount(log.getFailedCount())
            .errorMessage(log.getErrorMessage())
            .build();
    }
}
