package com.flagship.wealth_ledger.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wealth_ledger.account.AccountEntity;
import com.flagship.wealth_ledger.account.AccountLedger;
import com.flagship.wealth_ledger.config.LedgerProperties;
import com.flagship.wealth_ledger.holding.HoldingEntity;
import com.flagship.wealth_ledger.holding.HoldingRepository;
import com.flagship.wealth_ledger.holding.HoldingStore;
import com.flagship.wealth_ledger.observability.LedgerMetrics;
import com.flagship.wealth_ledger.orchestrator.UnitOfWork;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Lookup timeout handling with a single lookup worker and mocked persistence.
 */
class MarketSyncServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-30T18:00:00Z");

    private final UUID accountId = UUID.randomUUID();
    private HoldingRepository holdingRepository;
    private MarketSyncService service;

    @BeforeEach
    void setUp() {
        holdingRepository = mock(HoldingRepository.class);
        HoldingStore holdingStore = mock(HoldingStore.class);
        AccountLedger accountLedger = mock(AccountLedger.class);
        MarketSyncLogRepository logRepository = mock(MarketSyncLogRepository.class);

        when(holdingStore.updatePrice(any(), any(), any()))
                .thenAnswer(invocation -> Optional.of(mock(HoldingEntity.class)));
        AccountEntity account = mock(AccountEntity.class);
        when(accountLedger.lockForReversal(accountId)).thenReturn(account);
        when(accountLedger.refreshHoldingsValue(account)).thenReturn(new BigDecimal("600.00"));
        when(logRepository.save(any(MarketSyncLogEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UnitOfWork unitOfWork = new UnitOfWork() {
            @Override
            public <T> T inTransaction(String operation, Supplier<T> work) {
                return work.get();
            }
        };

        LedgerProperties properties = new LedgerProperties();
        properties.getSync().setLookupThreads(1);
        properties.getSync().setLookupTimeout(Duration.ofMillis(300));

        service = new MarketSyncService(holdingRepository, holdingStore, accountLedger, logRepository,
                unitOfWork, properties, new LedgerMetrics(new SimpleMeterRegistry()), new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private void holdings(String... symbols) {
        List<HoldingEntity> holdings = new ArrayList<>();
        for (String symbol : symbols) {
            HoldingEntity holding = mock(HoldingEntity.class);
            when(holding.getId()).thenReturn(UUID.randomUUID());
            when(holding.getAccountId()).thenReturn(accountId);
            when(holding.getSymbol()).thenReturn(symbol);
            holdings.add(holding);
        }
        when(holdingRepository.findByAccountIdAndActiveTrueAndAssetKindNotIn(eq(accountId), anyCollection()))
                .thenReturn(holdings);
    }

    private static PriceOracle sleeping(Map<String, Long> delays) {
        return symbol -> {
            try {
                Thread.sleep(delays.get(symbol));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
            return Optional.of(new BigDecimal("100"));
        };
    }

    @Test
    @DisplayName("Lookups queued behind a busy worker get the full timeout once they start")
    void queuedLookupsAreBoundedFromTheirStart() {
        holdings("AAA", "BBB", "CCC");

        SyncSummary summary = service.syncHoldingsValue(accountId,
                sleeping(Map.of("AAA", 200L, "BBB", 200L, "CCC", 200L)));

        System.out.println("Status: " + summary.getStatus() + ", failures: " + summary.getFailedSymbols());
        assertEquals(SyncStatus.SUCCESS, summary.getStatus());
        assertEquals(3, summary.getSucceeded());
        assertTrue(summary.getFailedSymbols().isEmpty());
    }

    @Test
    @DisplayName("A single slow lookup still times out without failing the ones queued after it")
    void slowLookupTimesOutAlone() {
        holdings("AAA", "SLOW", "CCC");

        SyncSummary summary = service.syncHoldingsValue(accountId,
                sleeping(Map.of("AAA", 50L, "SLOW", 2_000L, "CCC", 50L)));

        System.out.println("Status: " + summary.getStatus() + ", failures: " + summary.getFailedSymbols());
        assertEquals(SyncStatus.PARTIAL, summary.getStatus());
        assertEquals(2, summary.getSucceeded());
        assertEquals(Map.of("SLOW", "lookup timed out after 300ms"), summary.getFailedSymbols());
    }
}
