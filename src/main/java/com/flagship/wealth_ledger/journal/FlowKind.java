package com.flagship.wealth_ledger.journal;

/**
 * Kind of balance-affecting event recorded in the cash-flow journal.
 * Liability payments are expenses; their entries link the payment row.
 */
public enum FlowKind {
    INCOME,
    EXPENSE,
    TRANSFER,
    INVESTMENT
}
