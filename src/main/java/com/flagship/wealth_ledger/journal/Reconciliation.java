package com.flagship.wealth_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Stored balance next to the balance obtained by replaying the journal from zero.
 */
@Value
public class Reconciliation {
    UUID accountId;
    BigDecimal storedBalance;
    BigDecimal replayedBalance;
    long entryCount;

    public boolean isBalanced() {
        return storedBalance.compareTo(replayedBalance) == 0;
    }
}
