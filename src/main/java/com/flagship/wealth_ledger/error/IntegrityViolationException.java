package com.flagship.wealth_ledger.error;

/**
 * An invariant check failed after a mutation. Indicates a bug, not user
 * error; the enclosing unit of work is rolled back.
 */
public class IntegrityViolationException extends LedgerException {

    public IntegrityViolationException(String message) {
        super(LedgerErrorCode.INTEGRITY_VIOLATION, message);
    }
}
