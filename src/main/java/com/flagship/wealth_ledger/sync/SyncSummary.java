package com.flagship.wealth_ledger.sync;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Result of one price sync batch.
 */
@Value
@Builder(toBuilder = true)
public class SyncSummary {
    UUID logId;
    Instant syncedAt;
    SyncStatus status;
    int candidates;
    int succeeded;
    /**
     * Symbol → failure reason.
     */
    Map<String, String> failedSymbols;
    /**
     * Holdings that became inactive between lookup and update.
     */
    List<UUID> skippedHoldings;
    /**
     * Account id → refreshed {@code holdings_value}.
     */
    Map<UUID, BigDecimal> holdingsValueByAccount;
    BigDecimal totalHoldingsValue;
}
