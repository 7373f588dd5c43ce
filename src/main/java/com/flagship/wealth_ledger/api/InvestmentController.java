package com.flagship.wealth_ledger.api;

import com.flagship.wealth_ledger.api.dto.HoldingResponse;
import com.flagship.wealth_ledger.api.dto.RecordTradeRequest;
import com.flagship.wealth_ledger.api.dto.RegisterHoldingRequest;
import com.flagship.wealth_ledger.api.dto.TradeResponse;
import com.flagship.wealth_ledger.holding.HoldingEntity;
import com.flagship.wealth_ledger.holding.HoldingStore;
import com.flagship.wealth_ledger.holding.InvestmentTransactionEntity;
import com.flagship.wealth_ledger.orchestrator.TransactionOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Holdings and the trades that move them.
 */
@RestController
@RequestMapping("/api/investments")
@RequiredArgsConstructor
@Slf4j
public class InvestmentController {

    private final TransactionOrchestrator orchestrator;
    private final HoldingStore holdingStore;

    /**
     * Registers an existing position without moving cash.
     */
    @PostMapping("/holdings")
    public ResponseEntity<HoldingResponse> registerHolding(@Valid @RequestBody RegisterHoldingRequest request) {
        log.info("Received holding registration: accountId={}, symbol={}", request.getAccountId(), request.getSymbol());
        HoldingEntity holding = orchestrator.registerHolding(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(HoldingResponse.from(holding));
    }

    @GetMapping("/holdings/{id}")
    public HoldingResponse getHolding(@PathVariable("id") UUID id) {
        return HoldingResponse.from(holdingStore.get(id));
    }

    @PostMapping("/trades")
    public ResponseEntity<TradeResponse> recordTrade(@Valid @RequestBody RecordTradeRequest request) {
        log.info("Received trade request: accountId={}, symbol={}, kind={}",
                request.getAccountId(), request.getSymbol(), request.getKind());
        InvestmentTransactionEntity trade = orchestrator.recordTrade(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(TradeResponse.from(trade));
    }

    @GetMapping("/trades/{id}")
    public TradeResponse getTrade(@PathVariable("id") UUID id) {
        return TradeResponse.from(holdingStore.getTransaction(id));
    }

    /**
     * Reverses a trade. Later trades on the same holding are replayed so
     * quantity and average cost end up as if it never happened.
     */
    @DeleteMapping("/trades/{id}")
    public ResponseEntity<Void> deleteTrade(@PathVariable("id") UUID id) {
        orchestrator.deleteTrade(id);
        return ResponseEntity.noContent().build();
    }
}
