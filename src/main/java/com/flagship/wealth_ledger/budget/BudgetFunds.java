package com.flagship.wealth_ledger.budget;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Available cash across the accounts eligible to fund a budget.
 */
@Value
public class BudgetFunds {
    UUID budgetId;
    BigDecimal remaining;
    BigDecimal availableFunds;
    Map<UUID, BigDecimal> availableCashByAccount;

    /**
     * Whether the eligible accounts can cover what is left of the budget.
     */
    public boolean isCovered() {
        return availableFunds.compareTo(remaining) >= 0;
    }
}
