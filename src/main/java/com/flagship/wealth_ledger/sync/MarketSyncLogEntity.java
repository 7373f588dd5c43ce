package com.flagship.wealth_ledger.sync;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One row per price sync batch. Observational only.
 */
@Entity
@Table(
    name = "market_sync_logs",
    indexes = {
        @Index(name = "idx_market_sync_logs_synced_at", columnList = "synced_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MarketSyncLogEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    /**
     * Null when the batch covered every account.
     */
    @Column(name = "account_id", updatable = false)
    private UUID accountId;

    @Column(name = "synced_at", nullable = false, updatable = false)
    private Instant syncedAt;

    @Column(name = "total_value", nullable = false, updatable = false, precision = 20, scale = 4)
    private BigDecimal totalValue;

    @Column(name = "holdings_count", nullable = false, updatable = false)
    private int holdingsCount;

    @Column(name = "failed_count", nullable = false, updatable = false)
    private int failedCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private SyncStatus status;

    @Column(name = "error_message", updatable = false, length = 1000)
    private String errorMessage;

    /**
     * JSON with per-symbol failures and skipped holdings.
     */
    @Column(updatable = false, columnDefinition = "text")
    private String details;

    static MarketSyncLogEntity record(UUID accountId, SyncSummary summary, String errorMessage, String details) {
        MarketSyncLogEntity entity = new MarketSyncLogEntity();
        entity.id = UUID.randomUUID();
        entity.accountId = accountId;
        entity.syncedAt = summary.getSyncedAt();
        entity.totalValue = summary.getTotalHoldingsValue();
        entity.holdingsCount = summary.getSucceeded();
        entity.failedCount = summary.getFailedSymbols().size();
        entity.status = summary.getStatus();
        entity.errorMessage = errorMessage;
        entity.details = details;
        return entity;
    }
}
