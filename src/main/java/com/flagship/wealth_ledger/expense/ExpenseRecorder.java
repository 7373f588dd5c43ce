package com.flagship.wealth_ledger.expense;

import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.NotFoundException;
import com.flagship.wealth_ledger.error.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Persistence of expense rows. Balance and budget effects are applied by the
 * orchestrator around these calls.
 */
@Service
@RequiredArgsConstructor
public class ExpenseRecorder {

    private final ExpenseRepository expenseRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public ExpenseEntity record(UUID accountId, UUID budgetId, BigDecimal amount, LocalDate expenseDate,
                                ExpenseDetails details) {
        if (details == null || details.getCategory() == null || details.getCategory().isBlank()) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST, "Expense category is required");
        }
        return expenseRepository.save(ExpenseEntity.record(accountId, budgetId, amount, expenseDate, details));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public ExpenseEntity lock(UUID expenseId) {
        return expenseRepository.findByIdForUpdate(expenseId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.EXPENSE_NOT_FOUND, "Expense", expenseId));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void remove(ExpenseEntity expense) {
        expenseRepository.delete(expense);
    }

    @Transactional(readOnly = true)
    public ExpenseEntity get(UUID expenseId) {
        return expenseRepository.findById(expenseId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.EXPENSE_NOT_FOUND, "Expense", expenseId));
    }

    @Transactional(readOnly = true)
    public List<ExpenseEntity> list(UUID accountId, UUID budgetId) {
        if (accountId != null) {
            return expenseRepository.findByAccountIdOrderByExpenseDateDescCreatedAtDesc(accountId);
        }
        if (budgetId != null) {
            return expenseRepository.findByBudgetIdOrderByExpenseDateDescCreatedAtDesc(budgetId);
        }
        return expenseRepository.findAllByOrderByExpenseDateDescCreatedAtDesc();
    }
}
