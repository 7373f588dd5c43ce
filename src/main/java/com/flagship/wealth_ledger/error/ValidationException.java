package com.flagship.wealth_ledger.error;

/**
 * Bad input shape or value, e.g. a non-positive amount.
 */
public class ValidationException extends LedgerException {

    public ValidationException(LedgerErrorCode code, String message) {
        super(requireCategory(code, ErrorCategory.VALIDATION), message);
    }

    static LedgerErrorCode requireCategory(LedgerErrorCode code, ErrorCategory expected) {
        if (code.category() != expected) {
            throw new IllegalArgumentException(
                    String.format("Error code %s belongs to %s, not %s", code, code.category(), expected));
        }
        return code;
    }
}
