package com.flagship.wealth_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: counter tagged by operation and outcome (success or an error code)
 * - ledger.operation.latency: timer tagged by operation
 * - ledger.sync.holdings: counter of holdings per price sync result
 * - ledger.sync.runs: counter of sync batches per status
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the outcome of one orchestrator or service operation.
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Records per-holding price sync results: updated, failed or skipped.
     */
    public void recordSyncHoldings(String result, int count) {
        if (count <= 0) {
            return;
        }
        registry.counter("ledger.sync.holdings", "result", sanitizeTag(result)).increment(count);
    }

    public void recordSyncRun(String status) {
        registry.counter("ledger.sync.runs", "status", sanitizeTag(status)).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
