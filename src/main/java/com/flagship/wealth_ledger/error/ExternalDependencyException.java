package com.flagship.wealth_ledger.error;

/**
 * The price oracle failed or timed out for a symbol.
 */
public class ExternalDependencyException extends LedgerException {

    public ExternalDependencyException(String message) {
        super(LedgerErrorCode.PRICE_UNAVAILABLE, message);
    }

    public ExternalDependencyException(String message, Throwable cause) {
        super(LedgerErrorCode.PRICE_UNAVAILABLE, message, cause);
    }
}
