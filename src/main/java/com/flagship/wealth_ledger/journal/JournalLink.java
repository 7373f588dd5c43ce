package com.flagship.wealth_ledger.journal;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * Optional reference from a journal entry to the record that caused it.
 * At most one of the ids is set.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JournalLink {

    private static final JournalLink NONE = new JournalLink(null, null, null, null);

    UUID expenseId;
    UUID transferId;
    UUID investmentTransactionId;
    UUID liabilityPaymentId;

    public static JournalLink none() {
        return NONE;
    }

    public static JournalLink expense(UUID expenseId) {
        return new JournalLink(expenseId, null, null, null);
    }

    public static JournalLink transfer(UUID transferId) {
        return new JournalLink(null, transferId, null, null);
    }

    public static JournalLink trade(UUID investmentTransactionId) {
        return new JournalLink(null, null, investmentTransactionId, null);
    }

    public static JournalLink payment(UUID liabilityPaymentId) {
        return new JournalLink(null, null, null, liabilityPaymentId);
    }
}
