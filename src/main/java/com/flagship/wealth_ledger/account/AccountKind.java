package com.flagship.wealth_ledger.account;

public enum AccountKind {
    CASH,
    INVESTMENT
}
