package com.flagship.wealth_ledger.api;

import com.flagship.wealth_ledger.api.dto.QuoteRequest;
import com.flagship.wealth_ledger.api.dto.QuoteResponse;
import com.flagship.wealth_ledger.api.dto.SyncLogResponse;
import com.flagship.wealth_ledger.api.dto.SyncRequest;
import com.flagship.wealth_ledger.api.dto.SyncSummaryResponse;
import com.flagship.wealth_ledger.sync.ManualQuoteOracle;
import com.flagship.wealth_ledger.sync.MarketSyncService;
import com.flagship.wealth_ledger.sync.SyncSummary;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Manual quote book and price sync against it.
 */
@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
@Slf4j
public class MarketController {

    private final MarketSyncService marketSyncService;
    private final ManualQuoteOracle quoteOracle;

    @GetMapping("/quotes")
    public List<QuoteResponse> listQuotes() {
        return quoteOracle.listQuotes().stream()
                .map(QuoteResponse::from)
                .toList();
    }

    @PutMapping("/quotes/{symbol}")
    public QuoteResponse upsertQuote(@PathVariable("symbol") String symbol, @Valid @RequestBody QuoteRequest request) {
        return QuoteResponse.from(quoteOracle.upsert(symbol, request.getPrice()));
    }

    @DeleteMapping("/quotes/{symbol}")
    public ResponseEntity<Void> removeQuote(@PathVariable("symbol") String symbol) {
        return quoteOracle.remove(symbol)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * Refreshes prices of every syncable holding, or of one account's
     * holdings when an account id is given. Failed symbols are reported in
     * the summary, not as an error.
     */
    @PostMapping("/sync")
    public SyncSummaryResponse sync(@RequestBody(required = false) SyncRequest request) {
        UUID accountId = request != null ? request.getAccountId() : null;
        log.info("Received market sync request: accountId={}", accountId);
        SyncSummary summary = marketSyncService.syncHoldingsValue(accountId, quoteOracle);
        return SyncSummaryResponse.from(summary);
    }

    @GetMapping("/sync/latest")
    public ResponseEntity<SyncLogResponse> latestSync() {
        return marketSyncService.latestLog()
                .map(latest -> ResponseEntity.ok(SyncLogResponse.from(latest)))
                .orElse(ResponseEntity.notFound().build());
    }
}
