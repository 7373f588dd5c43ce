package com.flagship.wealth_ledger.orchestrator;

import com.flagship.wealth_ledger.account.AccountEntity;
import com.flagship.wealth_ledger.budget.BudgetEntity;
import com.flagship.wealth_ledger.config.LedgerProperties;
import com.flagship.wealth_ledger.error.IntegrityViolationException;
import com.flagship.wealth_ledger.holding.HoldingEntity;
import com.flagship.wealth_ledger.journal.CashFlowJournal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Post-mutation invariant checks, run inside the unit of work right before
 * it commits.
 *
 * Checks:
 * 1. Balance-enforced accounts are not negative
 * 2. Replaying the journal of each touched account reproduces its balance
 * 3. {@code remaining == allocated - spent} and {@code spent >= 0} for touched budgets
 * 4. Touched holdings have a non-negative quantity
 *
 * A failure throws {@link IntegrityViolationException}, which rolls back the unit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerIntegrityVerifier {

    private final CashFlowJournal journal;
    private final LedgerProperties properties;

    public void verify(IntegrityScope scope) {
        if (!properties.isIntegrityCheckEnabled()) {
            return;
        }
        for (AccountEntity account : scope.getAccounts()) {
            verifyAccount(account);
        }
        for (BudgetEntity budget : scope.getBudgets()) {
            verifyBudget(budget);
        }
        for (HoldingEntity holding : scope.getHoldings()) {
            if (holding.getQuantity().signum() < 0) {
                fail(String.format("Holding %s has negative quantity %s", holding.getId(), holding.getQuantity()));
            }
        }
    }

    private void verifyAccount(AccountEntity account) {
        if (account.isBalanceEnforced() && account.getBalance().signum() < 0) {
            fail(String.format("Account %s has negative balance %s", account.getId(), account.getBalance()));
        }
        BigDecimal replayed = journal.replayBalance(account.getId());
        if (replayed.compareTo(account.getBalance()) != 0) {
            fail(String.format("Account %s balance %s does not match journal replay %s",
                    account.getId(), account.getBalance(), replayed));
        }
    }

    private void verifyBudget(BudgetEntity budget) {
        if (budget.getSpent().signum() < 0) {
            fail(String.format("Budget %s has negative spent %s", budget.getId(), budget.getSpent()));
        }
        BigDecimal expected = budget.getAllocated().subtract(budget.getSpent());
        if (expected.compareTo(budget.getRemaining()) != 0) {
            fail(String.format("Budget %s remaining %s != allocated %s - spent %s",
                    budget.getId(), budget.getRemaining(), budget.getAllocated(), budget.getSpent()));
        }
    }

    private void fail(String message) {
        log.error("Integrity violation: {}", message);
        throw new IntegrityViolationException(message);
    }
}
