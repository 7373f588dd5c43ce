package com.flagship.wealth_ledger.budget;

/**
 * Budget lifecycle: ACTIVE → COMPLETED or ACTIVE → CANCELLED. Both targets are terminal.
 */
public enum BudgetStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
