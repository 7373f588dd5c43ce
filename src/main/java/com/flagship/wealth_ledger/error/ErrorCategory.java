package com.flagship.wealth_ledger.error;

/**
 * Failure taxonomy of the ledger engine.
 *
 * VALIDATION, NOT_FOUND and STATE_CONFLICT are expected and returned to the
 * caller. EXTERNAL_DEPENDENCY is recovered per symbol during price sync.
 * INTEGRITY means an invariant broke after a mutation and always aborts the
 * enclosing unit of work.
 */
public enum ErrorCategory {
    VALIDATION,
    NOT_FOUND,
    STATE_CONFLICT,
    EXTERNAL_DEPENDENCY,
    INTEGRITY
}
