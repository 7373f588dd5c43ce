package com.flagship.wealth_ledger.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wealth_ledger.account.AccountEntity;
import com.flagship.wealth_ledger.account.AccountLedger;
import com.flagship.wealth_ledger.config.LedgerProperties;
import com.flagship.wealth_ledger.error.ExternalDependencyException;
import com.flagship.wealth_ledger.holding.AssetKind;
import com.flagship.wealth_ledger.holding.HoldingEntity;
import com.flagship.wealth_ledger.holding.HoldingRepository;
import com.flagship.wealth_ledger.holding.HoldingStore;
import com.flagship.wealth_ledger.money.MoneyMath;
import com.flagship.wealth_ledger.observability.CorrelationContext;
import com.flagship.wealth_ledger.observability.LedgerMetrics;
import com.flagship.wealth_ledger.orchestrator.UnitOfWork;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Refreshes holding prices from a {@link PriceOracle}.
 *
 * The batch runs in three steps so that no database lock is held while the
 * oracle is called:
 * 1. read the candidate holdings (active, asset kind not excluded)
 * 2. look up each distinct symbol on a worker pool, each lookup bounded by the lookup timeout
 * 3. write each price in its own short transaction locking only that holding,
 *    then refresh each affected account's holdings_value cache
 *
 * A symbol that fails or times out is recorded and skipped; it never aborts
 * the batch. Only price fields are written, so a concurrent trade on the same
 * holding serializes on the holding row without losing its quantity change.
 */
@Service
@Slf4j
public class MarketSyncService {

    private final HoldingRepository holdingRepository;
    private final HoldingStore holdingStore;
    private final AccountLedger accountLedger;
    private final MarketSyncLogRepository logRepository;
    private final UnitOfWork unitOfWork;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutorService lookupExecutor;

    private static final long NOT_STARTED = Long.MIN_VALUE;

    /**
     * How often a lookup still waiting in the queue is checked for a start.
     */
    private static final long QUEUE_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    public MarketSyncService(HoldingRepository holdingRepository,
                             HoldingStore holdingStore,
                             AccountLedger accountLedger,
                             MarketSyncLogRepository logRepository,
                             UnitOfWork unitOfWork,
                             LedgerProperties properties,
                             LedgerMetrics metrics,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.holdingRepository = holdingRepository;
        this.holdingStore = holdingStore;
        this.accountLedger = accountLedger;
        this.logRepository = logRepository;
        this.unitOfWork = unitOfWork;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;

        AtomicInteger threadCounter = new AtomicInteger();
        this.lookupExecutor = Executors.newFixedThreadPool(
                Math.max(1, properties.getSync().getLookupThreads()),
                runnable -> {
                    Thread thread = new Thread(runnable, "price-lookup-" + threadCounter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    @PreDestroy
    public void shutdown() {
        lookupExecutor.shutdownNow();
    }

    /**
     * Syncs the holdings of one account, or of every account when
     * {@code accountId} is null.
     */
    public SyncSummary syncHoldingsValue(UUID accountId, PriceOracle oracle) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.OPERATION_MDC_KEY, "sync_holdings");
        if (accountId != null) {
            MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId.toString());
        }

        try {
            Instant syncedAt = Instant.now(clock);
            List<Candidate> candidates = loadCandidates(accountId);
            log.info("Market sync started: candidates={}", candidates.size());

            Map<String, String> failures = new LinkedHashMap<>();
            Map<String, BigDecimal> prices = lookupPrices(candidates, oracle, failures);

            int succeeded = 0;
            List<UUID> skipped = new ArrayList<>();
            Set<UUID> touchedAccounts = new LinkedHashSet<>();
            for (Candidate candidate : candidates) {
                BigDecimal price = prices.get(candidate.symbol);
                if (price == null) {
                    continue;
                }
                Optional<HoldingEntity> updated = unitOfWork.inTransaction("sync_price",
                        () -> holdingStore.updatePrice(candidate.holdingId, price, syncedAt));
                if (updated.isPresent()) {
                    succeeded++;
                    touchedAccounts.add(candidate.accountId);
                } else {
                    skipped.add(candidate.holdingId);
                }
            }

            Map<UUID, BigDecimal> valueByAccount = refreshAccounts(accountId, candidates, touchedAccounts);
            BigDecimal total = valueByAccount.values().stream()
                    .reduce(MoneyMath.ZERO_AMOUNT, BigDecimal::add);

            int failedHoldings = (int) candidates.stream().filter(c -> failures.containsKey(c.symbol)).count();
            SyncSummary summary = SyncSummary.builder()
                    .syncedAt(syncedAt)
                    .status(SyncStatus.of(succeeded, failedHoldings))
                    .candidates(candidates.size())
                    .succeeded(succeeded)
                    .failedSymbols(failures)
                    .skippedHoldings(skipped)
                    .holdingsValueByAccount(valueByAccount)
                    .totalHoldingsValue(MoneyMath.amount(total))
                    .build();

            UUID logId = writeLog(accountId, summary);
            summary = summary.toBuilder().logId(logId).build();

            metrics.recordSyncHoldings("updated", succeeded);
            metrics.recordSyncHoldings("failed", failedHoldings);
            metrics.recordSyncHoldings("skipped", skipped.size());
            metrics.recordSyncRun(summary.getStatus().name());
            metrics.recordLatency("sync_holdings", System.currentTimeMillis() - startTime);

            log.info("Market sync finished: status={}, updated={}, failedSymbols={}, totalHoldingsValue={}, duration={}ms",
                    summary.getStatus(), succeeded, failures.keySet(), summary.getTotalHoldingsValue(),
                    System.currentTimeMillis() - startTime);
            return summary;

        } finally {
            MDC.remove(CorrelationContext.OPERATION_MDC_KEY);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    public Optional<MarketSyncLogEntity> latestLog() {
        return logRepository.findFirstByOrderBySyncedAtDesc();
    }

    private List<Candidate> loadCandidates(UUID accountId) {
        return unitOfWork.inTransaction("sync_candidates", () -> {
            if (accountId != null) {
                accountLedger.lockForReversal(accountId);
            }
            Set<AssetKind> excluded = properties.getSync().getExcludedAssetKinds();
            List<HoldingEntity> holdings;
            if (accountId != null) {
                holdings = excluded.isEmpty()
                        ? holdingRepository.findByAccountIdAndActiveTrue(accountId)
                        : holdingRepository.findByAccountIdAndActiveTrueAndAssetKindNotIn(accountId, excluded);
            } else {
                holdings = excluded.isEmpty()
                        ? holdingRepository.findAll().stream().filter(HoldingEntity::isActive).toList()
                        : holdingRepository.findByActiveTrueAndAssetKindNotIn(excluded);
            }
            return holdings.stream()
                    .map(h -> new Candidate(h.getId(), h.getAccountId(), h.getSymbol()))
                    .toList();
        });
    }

    /**
     * Looks up every distinct symbol once. Failures and timeouts end up in
     * {@code failures}; the returned map holds canonical prices only.
     *
     * The lookup timeout bounds each call from the moment a worker starts it,
     * so symbols queued behind a busy pool are not charged for the wait.
     * Time spent queued is capped separately at one timeout per symbol in
     * the batch, which is only reached when every worker is stuck.
     */
    private Map<String, BigDecimal> lookupPrices(List<Candidate> candidates, PriceOracle oracle,
                                                 Map<String, String> failures) {
        Map<String, PendingLookup> pending = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            pending.computeIfAbsent(candidate.symbol, symbol -> submitLookup(symbol, oracle));
        }

        Duration timeout = properties.getSync().getLookupTimeout();
        long queueDeadline = System.nanoTime() + timeout.toNanos() * Math.max(1, pending.size());
        Map<String, BigDecimal> prices = new LinkedHashMap<>();

        for (Map.Entry<String, PendingLookup> entry : pending.entrySet()) {
            String symbol = entry.getKey();
            PendingLookup lookup = entry.getValue();
            try {
                Optional<BigDecimal> quote = lookup.await(timeout.toNanos(), queueDeadline);
                if (quote.isEmpty()) {
                    throw new ExternalDependencyException("No price available for " + symbol);
                }
                BigDecimal price = MoneyMath.fromExternal(quote.get());
                if (price.signum() <= 0) {
                    throw new ExternalDependencyException("Non-positive price " + price + " for " + symbol);
                }
                prices.put(symbol, price);

            } catch (TimeoutException e) {
                lookup.future.cancel(true);
                recordFailure(failures, symbol, lookup.isStarted()
                        ? "lookup timed out after " + timeout.toMillis() + "ms"
                        : "lookup not started, all lookup workers busy");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lookup.future.cancel(true);
                recordFailure(failures, symbol, "lookup interrupted");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                recordFailure(failures, symbol, describe(cause));
            } catch (RuntimeException e) {
                recordFailure(failures, symbol, describe(e));
            }
        }
        return prices;
    }

    private PendingLookup submitLookup(String symbol, PriceOracle oracle) {
        AtomicLong startedAt = new AtomicLong(NOT_STARTED);
        Future<Optional<BigDecimal>> future = lookupExecutor.submit(() -> {
            startedAt.set(System.nanoTime());
            return oracle.lookup(symbol);
        });
        return new PendingLookup(future, startedAt);
    }

    private void recordFailure(Map<String, String> failures, String symbol, String reason) {
        failures.put(symbol, reason);
        log.warn("Price lookup failed: symbol={}, reason={}", symbol, reason);
    }

    /**
     * Refreshes the holdings_value cache of every account that had candidates.
     * Accounts whose prices all failed still get their current cache reported.
     */
    private Map<UUID, BigDecimal> refreshAccounts(UUID accountId, List<Candidate> candidates,
                                                  Set<UUID> touchedAccounts) {
        Set<UUID> accounts = new LinkedHashSet<>();
        if (accountId != null) {
            accounts.add(accountId);
        }
        candidates.forEach(c -> accounts.add(c.accountId));

        Map<UUID, BigDecimal> values = new LinkedHashMap<>();
        for (UUID id : accounts) {
            BigDecimal value = unitOfWork.inTransaction("sync_account_cache", () -> {
                AccountEntity account = accountLedger.lockForReversal(id);
                return touchedAccounts.contains(id)
                        ? accountLedger.refreshHoldingsValue(account)
                        : account.getHoldingsValue();
            });
            values.put(id, value);
        }
        return values;
    }

    private UUID writeLog(UUID accountId, SyncSummary summary) {
        String errorMessage = summary.getFailedSymbols().isEmpty()
                ? null
                : truncate("Price lookup failed for " + String.join(", ", summary.getFailedSymbols().keySet()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("candidates", summary.getCandidates());
        details.put("failed", summary.getFailedSymbols());
        details.put("skipped_holdings", summary.getSkippedHoldings());
        details.put("holdings_value_by_account", summary.getHoldingsValueByAccount());

        String json;
        try {
            json = objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize sync details: {}", e.getMessage());
            json = null;
        }

        String detailsJson = json;
        return unitOfWork.inTransaction("sync_log",
                () -> logRepository.save(MarketSyncLogEntity.record(accountId, summary, errorMessage, detailsJson))
                        .getId());
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static String truncate(String message) {
        return message.length() > 1000 ? message.substring(0, 1000) : message;
    }

    private static final class PendingLookup {
        final Future<Optional<BigDecimal>> future;
        final AtomicLong startedAt;

        PendingLookup(Future<Optional<BigDecimal>> future, AtomicLong startedAt) {
            this.future = future;
            this.startedAt = startedAt;
        }

        boolean isStarted() {
            return startedAt.get() != NOT_STARTED;
        }

        /**
         * Waits for the result, allowing {@code timeoutNanos} from the moment
         * a worker picked the lookup up. Until then the wait is bounded only
         * by {@code queueDeadline}.
         */
        Optional<BigDecimal> await(long timeoutNanos, long queueDeadline)
                throws InterruptedException, ExecutionException, TimeoutException {
            while (!isStarted() && !future.isDone()) {
                long queued = queueDeadline - System.nanoTime();
                if (queued <= 0) {
                    throw new TimeoutException();
                }
                TimeUnit.NANOSECONDS.sleep(Math.min(queued, QUEUE_POLL_NANOS));
            }
            if (future.isDone()) {
                return future.get();
            }
            long remaining = startedAt.get() + timeoutNanos - System.nanoTime();
            return future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        }
    }

    private static final class Candidate {
        final UUID holdingId;
        final UUID accountId;
        final String symbol;

        Candidate(UUID holdingId, UUID accountId, String symbol) {
            this.holdingId = holdingId;
            this.accountId = accountId;
            this.symbol = symbol;
        }
    }
}
