package com.flagship.wealth_ledger.transfer;

import com.flagship.wealth_ledger.account.AccountKind;

public enum TransferKind {
    CASH_TO_CASH,
    CASH_TO_INVESTMENT,
    INVESTMENT_TO_CASH,
    INVESTMENT_TO_INVESTMENT;

    public static TransferKind classify(AccountKind source, AccountKind destination) {
        if (source == AccountKind.CASH) {
            return destination == AccountKind.CASH ? CASH_TO_CASH : CASH_TO_INVESTMENT;
        }
        return destination == AccountKind.CASH ? INVESTMENT_TO_CASH : INVESTMENT_TO_INVESTMENT;
    }
}
