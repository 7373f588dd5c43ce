package com.flagship.wealth_ledger.api;

import com.flagship.wealth_ledger.account.AccountEntity;
import com.flagship.wealth_ledger.account.AccountService;
import com.flagship.wealth_ledger.api.dto.AccountResponse;
import com.flagship.wealth_ledger.api.dto.CreateAccountRequest;
import com.flagship.wealth_ledger.api.dto.EntryIdResponse;
import com.flagship.wealth_ledger.api.dto.HoldingResponse;
import com.flagship.wealth_ledger.api.dto.IncomeRequest;
import com.flagship.wealth_ledger.api.dto.JournalEntryResponse;
import com.flagship.wealth_ledger.api.dto.ReconciliationResponse;
import com.flagship.wealth_ledger.api.dto.TradeResponse;
import com.flagship.wealth_ledger.api.dto.TransferResponse;
import com.flagship.wealth_ledger.api.dto.UpdateAccountRequest;
import com.flagship.wealth_ledger.holding.HoldingStore;
import com.flagship.wealth_ledger.journal.CashFlowJournal;
import com.flagship.wealth_ledger.orchestrator.TransactionOrchestrator;
import com.flagship.wealth_ledger.transfer.TransferRepository;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Accounts, their journal and the income entry point.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final TransactionOrchestrator orchestrator;
    private final CashFlowJournal journal;
    private final HoldingStore holdingStore;
    private final TransferRepository transferRepository;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        log.info("Received account creation request: name={}, kind={}", request.getName(), request.getKind());
        AccountEntity account = accountService.createAccount(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(account));
    }

    @GetMapping
    public List<AccountResponse> listAccounts(
            @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return accountService.list(includeInactive).stream()
                .map(this::toResponse)
                .toList();
    }

    @GetMapping("/{id}")
    public AccountResponse getAccount(@PathVariable("id") UUID id) {
        return toResponse(accountService.get(id));
    }

    @PutMapping("/{id}")
    public AccountResponse updateAccount(@PathVariable("id") UUID id,
                                         @Valid @RequestBody UpdateAccountRequest request) {
        AccountEntity account = accountService.updateDetails(id, request.getName(), request.getInstitution(),
                request.getAccountNumber(), request.getNotes());
        return toResponse(account);
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<Void> deactivateAccount(@PathVariable("id") UUID id) {
        accountService.deactivate(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Hard delete. Refused with 409 once the account has journal activity.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAccount(@PathVariable("id") UUID id) {
        accountService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/income")
    public ResponseEntity<EntryIdResponse> recordIncome(@PathVariable("id") UUID id,
                                                        @Valid @RequestBody IncomeRequest request) {
        UUID entryId = orchestrator.recordIncome(id, request.getAmount(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(new EntryIdResponse(entryId));
    }

    @GetMapping("/{id}/entries")
    public List<JournalEntryResponse> listEntries(@PathVariable("id") UUID id) {
        accountService.get(id);
        return journal.entriesForAccount(id).stream()
                .map(JournalEntryResponse::from)
                .toList();
    }

    @GetMapping("/{id}/reconciliation")
    public ReconciliationResponse reconcile(@PathVariable("id") UUID id) {
        return ReconciliationResponse.from(accountService.reconcile(id));
    }

    @GetMapping("/{id}/holdings")
    public List<HoldingResponse> listHoldings(@PathVariable("id") UUID id) {
        accountService.get(id);
        return holdingStore.activeHoldings(id).stream()
                .map(HoldingResponse::from)
                .toList();
    }

    @GetMapping("/{id}/trades")
    public List<TradeResponse> listTrades(@PathVariable("id") UUID id) {
        accountService.get(id);
        return holdingStore.transactions(id).stream()
                .map(TradeResponse::from)
                .toList();
    }

    @GetMapping("/{id}/transfers")
    public List<TransferResponse> listTransfers(@PathVariable("id") UUID id) {
        accountService.get(id);
        return transferRepository.findByAccount(id).stream()
                .map(TransferResponse::from)
                .toList();
    }

    private AccountResponse toResponse(AccountEntity account) {
        return AccountResponse.from(account, accountService.projectedValues(account.getId()));
    }
}
