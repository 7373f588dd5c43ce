package com.flagship.wealth_ledger.budget;

public enum BudgetKind {
    PERIODIC,
    PROJECT
}
