package com.flagship.wealth_ledger.error;

/**
 * The request is well formed but the current state forbids it: insufficient
 * funds or quantity, an inactive budget, an invalid status transition.
 */
public class StateConflictException extends LedgerException {

    public StateConflictException(LedgerErrorCode code, String message) {
        super(ValidationException.requireCategory(code, ErrorCategory.STATE_CONFLICT), message);
    }
}
