package com.flagship.wealth_ledger.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic price sync of every account against the manual quote book.
 *
 * Disabled by default; enable with {@code ledger.sync.scheduler.enabled=true}.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "ledger.sync.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class MarketSyncScheduler {

    private final MarketSyncService marketSyncService;
    private final ManualQuoteOracle quoteOracle;

    @Scheduled(fixedDelayString = "${ledger.sync.scheduler.interval-ms:900000}",
               initialDelayString = "${ledger.sync.scheduler.interval-ms:900000}")
    public void syncAll() {
        try {
            SyncSummary summary = marketSyncService.syncHoldingsValue(null, quoteOracle);
            log.debug("Scheduled market sync completed: status={}, updated={}",
                    summary.getStatus(), summary.getSucceeded());
        } catch (Exception e) {
            // Next run retries; the scheduler thread must survive.
            log.error("Scheduled market sync failed: {}", e.getMessage(), e);
        }
    }
}
