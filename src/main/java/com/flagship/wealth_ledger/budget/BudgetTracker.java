package com.flagship.wealth_ledger.budget;

import com.flagship.wealth_ledger.account.AccountEntity;
import com.flagship.wealth_ledger.account.AccountLedger;
import com.flagship.wealth_ledger.account.AccountRepository;
import com.flagship.wealth_ledger.config.LedgerProperties;
import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.NotFoundException;
import com.flagship.wealth_ledger.error.StateConflictException;
import com.flagship.wealth_ledger.error.ValidationException;
import com.flagship.wealth_ledger.money.MoneyMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Owns budget allocation, spending and lifecycle.
 *
 * Expense linking happens inside the orchestrator's unit of work, after the
 * funding accounts are locked; lifecycle transitions run as their own
 * transactions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetTracker {

    private final BudgetRepository budgetRepository;
    private final AccountRepository accountRepository;
    private final AccountLedger accountLedger;
    private final LedgerProperties properties;
    private final Clock clock;

    @Transactional
    public BudgetEntity create(CreateBudgetCommand command) {
        if (command.getName() == null || command.getName().isBlank()) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST, "Budget name is required");
        }
        BigDecimal allocated = MoneyMath.requirePositive(command.getAllocated(), "allocated");
        if (command.getPeriodStart() == null || command.getPeriodEnd() == null) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST, "Budget period is required");
        }
        if (command.getPeriodStart().isAfter(command.getPeriodEnd())) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST,
                    String.format("Period start %s is after period end %s",
                            command.getPeriodStart(), command.getPeriodEnd()));
        }
        if (command.getEligibleAccountIds() != null) {
            for (UUID accountId : command.getEligibleAccountIds()) {
                if (!accountRepository.existsById(accountId)) {
                    throw NotFoundException.of(LedgerErrorCode.ACCOUNT_NOT_FOUND, "Account", accountId);
                }
            }
        }

        BudgetEntity budget = BudgetEntity.create(command.getName(),
                command.getKind() != null ? command.getKind() : BudgetKind.PERIODIC,
                allocated, command.getPeriodStart(), command.getPeriodEnd(),
                command.getEligibleAccountIds(), command.getNotes());
        BudgetEntity saved = budgetRepository.save(budget);

        log.info("Budget created: budgetId={}, kind={}, allocated={}, eligibleAccounts={}",
                saved.getId(), saved.getKind(), allocated, saved.getEligibleAccountIds().size());
        return saved;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public BudgetEntity lock(UUID budgetId) {
        return budgetRepository.findByIdForUpdate(budgetId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.BUDGET_NOT_FOUND, "Budget", budgetId));
    }

    /**
     * Checks that a new expense on {@code accountId} may be linked to the budget.
     *
     * @throws StateConflictException BUDGET_NOT_ACTIVE or BUDGET_NOT_ELIGIBLE
     */
    public void requireLinkable(BudgetEntity budget, UUID accountId) {
        if (budget.getStatus() != BudgetStatus.ACTIVE) {
            throw new StateConflictException(LedgerErrorCode.BUDGET_NOT_ACTIVE,
                    String.format("Budget %s is %s and accepts no new expenses", budget.getId(), budget.getStatus()));
        }
        if (!budget.isEligible(accountId)) {
            throw new StateConflictException(LedgerErrorCode.BUDGET_NOT_ELIGIBLE,
                    String.format("Account %s is not eligible for budget %s", accountId, budget.getId()));
        }
    }

    public void linkExpense(BudgetEntity budget, BigDecimal amount) {
        budget.link(MoneyMath.amount(amount), properties.getOverspendPolicy());
        log.debug("Expense linked to budget: budgetId={}, amount={}, spent={}, remaining={}",
                budget.getId(), amount, budget.getSpent(), budget.getRemaining());
    }

    public void unlinkExpense(BudgetEntity budget, BigDecimal amount) {
        boolean adjusted = budget.unlink(MoneyMath.amount(amount), properties.getTerminalBudgetUnlink());
        if (adjusted) {
            log.debug("Expense unlinked from budget: budgetId={}, amount={}, spent={}, remaining={}",
                    budget.getId(), amount, budget.getSpent(), budget.getRemaining());
        } else {
            log.info("Budget {} is {}; spent left frozen at {} after expense removal of {}",
                    budget.getId(), budget.getStatus(), budget.getSpent(), amount);
        }
    }

    /**
     * ACTIVE → COMPLETED, storing the final spent/remaining snapshot.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BudgetEntity complete(UUID budgetId) {
        BudgetEntity budget = lock(budgetId);
        budget.complete(Instant.now(clock));
        log.info("Budget completed: budgetId={}, finalSpent={}, finalRemaining={}",
                budgetId, budget.getFinalSpent(), budget.getFinalRemaining());
        return budget;
    }

    /**
     * ACTIVE → CANCELLED.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BudgetEntity cancel(UUID budgetId) {
        BudgetEntity budget = lock(budgetId);
        budget.cancel(Instant.now(clock));
        log.info("Budget cancelled: budgetId={}, spent={}", budgetId, budget.getSpent());
        return budget;
    }

    @Transactional
    public BudgetEntity reallocate(UUID budgetId, BigDecimal allocated) {
        BigDecimal amount = MoneyMath.requirePositive(allocated, "allocated");
        BudgetEntity budget = lock(budgetId);
        budget.reallocate(amount);
        log.info("Budget reallocated: budgetId={}, allocated={}, remaining={}",
                budgetId, budget.getAllocated(), budget.getRemaining());
        return budget;
    }

    @Transactional
    public BudgetEntity updateDetails(UUID budgetId, UpdateBudgetCommand command) {
        BudgetEntity budget = lock(budgetId);
        if (command.getEligibleAccountIds() != null) {
            for (UUID accountId : command.getEligibleAccountIds()) {
                if (!accountRepository.existsById(accountId)) {
                    throw NotFoundException.of(LedgerErrorCode.ACCOUNT_NOT_FOUND, "Account", accountId);
                }
            }
        }
        budget.updateDetails(command.getName(), command.getPeriodStart(), command.getPeriodEnd(),
                command.getEligibleAccountIds(), command.getNotes());
        if (budget.getPeriodStart().isAfter(budget.getPeriodEnd())) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST,
                    String.format("Period start %s is after period end %s",
                            budget.getPeriodStart(), budget.getPeriodEnd()));
        }
        return budget;
    }

    /**
     * Sums the available cash of the budget's eligible active accounts (all
     * active accounts when the eligible set is empty).
     */
    @Transactional(readOnly = true)
    public BudgetFunds availableFunds(UUID budgetId) {
        BudgetEntity budget = get(budgetId);
        List<AccountEntity> accounts = budget.getEligibleAccountIds().isEmpty()
                ? accountRepository.findByActiveTrueOrderByCreatedAtAsc()
                : accountRepository.findAllById(budget.getEligibleAccountIds()).stream()
                        .filter(AccountEntity::isActive)
                        .toList();

        Map<UUID, BigDecimal> byAccount = new LinkedHashMap<>();
        BigDecimal total = MoneyMath.ZERO_AMOUNT;
        for (AccountEntity account : accounts) {
            BigDecimal available = accountLedger.projectedValues(account).getAvailableCash();
            byAccount.put(account.getId(), available);
            total = total.add(available);
        }
        return new BudgetFunds(budgetId, budget.getRemaining(), MoneyMath.amount(total), byAccount);
    }

    @Transactional(readOnly = true)
    public BudgetEntity get(UUID budgetId) {
        return budgetRepository.findById(budgetId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.BUDGET_NOT_FOUND, "Budget", budgetId));
    }

    @Transactional(readOnly = true)
    public List<BudgetEntity> list(BudgetStatus status) {
        return status != null
                ? budgetRepository.findByStatusOrderByCreatedAtDesc(status)
                : budgetRepository.findAllByOrderByCreatedAtDesc();
    }
}
