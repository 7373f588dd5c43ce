package com.flagship.wealth_ledger.holding;

public enum TradeKind {
    BUY,
    SELL,
    DIVIDEND,
    INTEREST;

    /**
     * Whether the trade changes the held quantity.
     */
    public boolean movesQuantity() {
        return this == BUY || this == SELL;
    }
}
