package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.sync.SyncStatus;
import com.flagship.wealth_ledger.sync.SyncSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class SyncSummaryResponse {

    @JsonProperty("log_id")
    UUID logId;

    @JsonProperty("synced_at")
    Instant syncedAt;

    @JsonProperty("status")
    SyncStatus status;

    @JsonProperty("candidates")
    int candidates;

    @JsonProperty("succeeded")
    int succeeded;

    @JsonProperty("failed_symbols")
    Map<String, String> failedSymbols;

    @JsonProperty("skipped_holdings")
    List<UUID> skippedHoldings;

    @JsonProperty("holdings_value_by_account")
    Map<UUID, BigDecimal> holdingsValueByAccount;

    @JsonProperty("total_holdings_value")
    BigDecimal totalHoldingsValue;

    public static SyncSummaryResponse from(SyncSummary summary) {
        return SyncSummaryResponse.builder()
            .logId(summary.getLogId())
            .syncedAt(summary.getSyncedAt())
            .status(summary.getStatus())
            .candidates(summary.getCandidates())
            .succeeded(summary.getSucceeded())
            .failedSymbols(summary.getFailedSymbols())
            .skippedHoldings(summary.getSkippedHoldings())
            .holdingsValueByAccount(summary.getHoldingsValueByAccount())
            .totalHoldingsValue(summary.getTotalHoldingsValue())
            .build();
    }
}
