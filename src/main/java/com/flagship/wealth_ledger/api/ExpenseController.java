package com.flagship.wealth_ledger.api;

import com.flagship.wealth_ledger.api.dto.CategoryResponse;
import com.flagship.wealth_ledger.api.dto.ExpenseResponse;
import com.flagship.wealth_ledger.api.dto.RecordExpenseRequest;
import com.flagship.wealth_ledger.expense.ExpenseCategoryService;
import com.flagship.wealth_ledger.expense.ExpenseEntity;
import com.flagship.wealth_ledger.expense.ExpenseRecorder;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
@Slf4j
public class ExpenseController {

    private final TransactionOrchestrator orchestrator;
    private final ExpenseRecorder expenseRecorder;
    private final ExpenseCategoryService categoryService;

    /**
     * Records an expense, debiting the account and, when a budget is given,
     * counting it against that budget.
     */
    @PostMapping
    public ResponseEntity<ExpenseResponse> recordExpense(@Valid @RequestBody RecordExpenseRequest request) {
        log.info("Received expense request: accountId={}, budgetId={}, amount={}",
                request.getAccountId(), request.getBudgetId(), request.getAmount());
        ExpenseEntity expense = orchestrator.recordExpense(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(expense));
    }

    @GetMapping
    public List<ExpenseResponse> listExpenses(
            @RequestParam(name = "account_id", required = false) UUID accountId,
            @RequestParam(name = "budget_id", required = false) UUID budgetId) {
        return expenseRecorder.list(accountId, budgetId).stream()
                .map(ExpenseResponse::from)
                .toList();
    }

    @GetMapping("/categories")
    public List<CategoryResponse> listCategories() {
        return categoryService.listCategories().stream()
                .map(CategoryResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public ExpenseResponse getExpense(@PathVariable("id") UUID id) {
        return ExpenseResponse.from(expenseRecorder.get(id));
    }

    /**
     * Deletes an expense and restores the account and budget exactly.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteExpense(@PathVariable("id") UUID id) {
        orchestrator.deleteExpense(id);
        return ResponseEntity.noContent().build();
    }
}
