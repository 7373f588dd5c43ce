package com.flagship.wealth_ledger.sync;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the outcome of the latest price sync.
 *
 * UP after a successful run or when no run happened yet, WARNING after a
 * partial run, DOWN after a failed run.
 */
@Component("marketSyncHealth")
public class MarketSyncHealthIndicator implements HealthIndicator {

    private final MarketSyncLogRepository logRepository;

    public MarketSyncHealthIndicator(MarketSyncLogRepository logRepository) {
        this.logRepository = logRepository;
    }

    @Override
    public Health health() {
        try {
            return logRepository.findFirstByOrderBySyncedAtDesc()
                    .map(latest -> {
                        Health.Builder builder = switch (latest.getStatus()) {
                            case SUCCESS -> Health.up();
                            case PARTIAL -> Health.status("WARNING");
                            case FAILED -> Health.down();
                        };
                        builder.withDetail("lastSyncAt", latest.getSyncedAt().toString())
                                .withDetail("status", latest.getStatus().name())
                                .withDetail("holdingsUpdated", latest.getHoldingsCount())
                                .withDetail("failedSymbols", latest.getFailedCount());
                        if (latest.getErrorMessage() != null) {
                            builder.withDetail("error", latest.getErrorMessage());
                        }
                        return builder.build();
                    })
                    .orElseGet(() -> Health.up().withDetail("lastSyncAt", "never").build());

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
