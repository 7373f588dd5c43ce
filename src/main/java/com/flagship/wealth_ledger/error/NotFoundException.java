package com.flagship.wealth_ledger.error;

import java.util.UUID;

/**
 * A referenced account, budget, holding, liability or record does not exist.
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(LedgerErrorCode code, String message) {
        super(ValidationException.requireCategory(code, ErrorCategory.NOT_FOUND), message);
    }

    public static NotFoundException of(LedgerErrorCode code, String entity, UUID id) {
        return new NotFoundException(code, entity + " not found: " + id);
    }
}
