package com.flagship.wealth_ledger.error;

/**
 * Machine-readable reason attached to every {@link LedgerException}.
 */
public enum LedgerErrorCode {
    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    INVALID_REQUEST(ErrorCategory.VALIDATION),

    ACCOUNT_NOT_FOUND(ErrorCategory.NOT_FOUND),
    BUDGET_NOT_FOUND(ErrorCategory.NOT_FOUND),
    HOLDING_NOT_FOUND(ErrorCategory.NOT_FOUND),
    LIABILITY_NOT_FOUND(ErrorCategory.NOT_FOUND),
    EXPENSE_NOT_FOUND(ErrorCategory.NOT_FOUND),
    TRANSACTION_NOT_FOUND(ErrorCategory.NOT_FOUND),
    TRANSFER_NOT_FOUND(ErrorCategory.NOT_FOUND),
    PAYMENT_NOT_FOUND(ErrorCategory.NOT_FOUND),

    INSUFFICIENT_FUNDS(ErrorCategory.STATE_CONFLICT),
    INSUFFICIENT_HOLDING_QUANTITY(ErrorCategory.STATE_CONFLICT),
    BUDGET_NOT_ACTIVE(ErrorCategory.STATE_CONFLICT),
    BUDGET_NOT_ELIGIBLE(ErrorCategory.STATE_CONFLICT),
    UNDERFUNDED_BUDGET(ErrorCategory.STATE_CONFLICT),
    INVALID_TRANSITION(ErrorCategory.STATE_CONFLICT),
    OVERPAYMENT_REJECTED(ErrorCategory.STATE_CONFLICT),
    ACCOUNT_HAS_ACTIVITY(ErrorCategory.STATE_CONFLICT),
    DUPLICATE_HOLDING(ErrorCategory.STATE_CONFLICT),

    PRICE_UNAVAILABLE(ErrorCategory.EXTERNAL_DEPENDENCY),

    INTEGRITY_VIOLATION(ErrorCategory.INTEGRITY);

    private final ErrorCategory category;

    LedgerErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
