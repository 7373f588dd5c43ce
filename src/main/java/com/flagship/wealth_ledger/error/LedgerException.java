package com.flagship.wealth_ledger.error;

/**
 * Base class for every failure the ledger engine reports to its callers.
 */
public abstract class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    protected LedgerException(LedgerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected LedgerException(LedgerErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public LedgerErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.category();
    }
}
