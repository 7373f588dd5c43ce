package com.flagship.wealth_ledger.account;

import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.NotFoundException;
import com.flagship.wealth_ledger.error.StateConflictException;
import com.flagship.wealth_ledger.error.ValidationException;
import com.flagship.wealth_ledger.journal.CashFlowJournal;
import com.flagship.wealth_ledger.journal.FlowKind;
import com.flagship.wealth_ledger.journal.JournalLink;
import com.flagship.wealth_ledger.journal.Reconciliation;
import com.flagship.wealth_ledger.money.MoneyMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Account lifecycle: open, edit, deactivate, delete, read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final String DEFAULT_CURRENCY = "CNY";
    static final String OPENING_BALANCE = "Opening balance";

    private final AccountRepository accountRepository;
    private final AccountLedger accountLedger;
    private final CashFlowJournal journal;

    /**
     * Opens an account. A positive opening balance is credited and journaled
     * as income, so the journal replays to the balance from the first entry.
     */
    @Transactional
    public AccountEntity createAccount(CreateAccountCommand command) {
        if (command.getName() == null || command.getName().isBlank()) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST, "Account name is required");
        }
        if (command.getKind() == null) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST, "Account kind is required");
        }
        BigDecimal opening = MoneyMath.requireNonNegative(command.getOpeningBalance(), "opening balance");
        String currency = command.getCurrency() != null
                ? command.getCurrency().toUpperCase(Locale.ROOT)
                : DEFAULT_CURRENCY;

        AccountEntity account = AccountEntity.open(command.getName(), command.getKind(), currency,
                command.getInstitution(), command.getAccountNumber(), command.getNotes());
        account = accountRepository.saveAndFlush(account);

        if (opening.signum() > 0) {
            BigDecimal balanceAfter = accountLedger.credit(account, opening);
            journal.append(account.getId(), FlowKind.INCOME, opening, balanceAfter,
                    OPENING_BALANCE, JournalLink.none(), false);
        }

        log.info("Account created: accountId={}, kind={}, currency={}, openingBalance={}",
                account.getId(), account.getKind(), currency, opening);
        return account;
    }

    @Transactional
    public AccountEntity updateDetails(UUID accountId, String name, String institution,
                                       String accountNumber, String notes) {
        AccountEntity account = accountLedger.lock(accountId);
        account.rename(name, institution, accountNumber, notes);
        return account;
    }

    /**
     * Soft delete. The balance and journal stay untouched.
     */
    @Transactional
    public void deactivate(UUID accountId) {
        AccountEntity account = accountLedger.lock(accountId);
        account.deactivate();
        log.info("Account deactivated: accountId={}", accountId);
    }

    /**
     * Hard delete, allowed only for accounts that never had a journal entry.
     */
    @Transactional
    public void delete(UUID accountId) {
        AccountEntity account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.ACCOUNT_NOT_FOUND, "Account", accountId));
        if (journal.hasEntries(accountId)) {
            throw new StateConflictException(LedgerErrorCode.ACCOUNT_HAS_ACTIVITY,
                    "Account " + accountId + " has journal activity; deactivate it instead");
        }
        accountRepository.delete(account);
        log.info("Account deleted: accountId={}", accountId);
    }

    @Transactional(readOnly = true)
    public AccountEntity get(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.ACCOUNT_NOT_FOUND, "Account", accountId));
    }

    @Transactional(readOnly = true)
    public List<AccountEntity> list(boolean includeInactive) {
        return includeInactive
                ? accountRepository.findAllByOrderByCreatedAtAsc()
                : accountRepository.findByActiveTrueOrderByCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public ProjectedValues projectedValues(UUID accountId) {
        return accountLedger.projectedValues(get(accountId));
    }

    @Transactional(readOnly = true)
    public Reconciliation reconcile(UUID accountId) {
        return journal.reconcile(accountId, get(accountId).getBalance());
    }
}
