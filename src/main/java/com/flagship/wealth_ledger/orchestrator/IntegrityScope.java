package com.flagship.wealth_ledger.orchestrator;

import com.flagship.wealth_ledger.account.AccountEntity;
import com.flagship.wealth_ledger.budget.BudgetEntity;
import com.flagship.wealth_ledger.holding.HoldingEntity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * The aggregates a unit of work touched, checked before it commits.
 */
@Value
@Builder
public class IntegrityScope {
    @Singular
    List<AccountEntity> accounts;
    @Singular
    List<BudgetEntity> budgets;
    @Singular
    List<HoldingEntity> holdings;
}
