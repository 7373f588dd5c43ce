package com.flagship.wealth_ledger.api;

import com.flagship.wealth_ledger.api.dto.BudgetFundsResponse;
import com.flagship.wealth_ledger.api.dto.BudgetResponse;
import com.flagship.wealth_ledger.api.dto.CreateBudgetRequest;
import com.flagship.wealth_ledger.api.dto.ReallocateBudgetRequest;
import com.flagship.wealth_ledger.api.dto.UpdateBudgetRequest;
import com.flagship.wealth_ledger.budget.BudgetEntity;
import com.flagship.wealth_ledger.budget.BudgetStatus;
import com.flagship.wealth_ledger.budget.BudgetTracker;
import com.flagship.wealth_ledger.orchestrator.TransactionOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
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

@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
@Slf4j
public class BudgetController {

    private final BudgetTracker budgetTracker;
    private final TransactionOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<BudgetResponse> createBudget(@Valid @RequestBody CreateBudgetRequest request) {
        log.info("Received budget creation request: name={}, allocated={}", request.getName(), request.getAllocated());
        BudgetEntity budget = budgetTracker.create(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(BudgetResponse.from(budget));
    }

    @GetMapping
    public List<BudgetResponse> listBudgets(@RequestParam(name = "status", required = false) BudgetStatus status) {
        return budgetTracker.list(status).stream()
                .map(BudgetResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public BudgetResponse getBudget(@PathVariable("id") UUID id) {
        return BudgetResponse.from(budgetTracker.get(id));
    }

    @PutMapping("/{id}")
    public BudgetResponse updateBudget(@PathVariable("id") UUID id, @Valid @RequestBody UpdateBudgetRequest request) {
        return BudgetResponse.from(budgetTracker.updateDetails(id, request.toCommand()));
    }

    @PostMapping("/{id}/reallocate")
    public BudgetResponse reallocate(@PathVariable("id") UUID id, @Valid @RequestBody ReallocateBudgetRequest request) {
        return BudgetResponse.from(budgetTracker.reallocate(id, request.getAllocated()));
    }

    @PostMapping("/{id}/complete")
    public BudgetResponse completeBudget(@PathVariable("id") UUID id) {
        return BudgetResponse.from(orchestrator.completeBudget(id));
    }

    @PostMapping("/{id}/cancel")
    public BudgetResponse cancelBudget(@PathVariable("id") UUID id) {
        return BudgetResponse.from(orchestrator.cancelBudget(id));
    }

    /**
     * Cash available across the budget's eligible accounts.
     */
    @GetMapping("/{id}/funds")
    public BudgetFundsResponse availableFunds(@PathVariable("id") UUID id) {
        return BudgetFundsResponse.from(budgetTracker.availableFunds(id));
    }
}
