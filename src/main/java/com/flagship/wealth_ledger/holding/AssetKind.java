package com.flagship.wealth_ledger.holding;

public enum AssetKind {
    STOCK,
    FUND,
    BOND,
    MONEY_MARKET,
    CRYPTO,
    BANK_PRODUCT
}
