package com.flagship.wealth_ledger.transfer;

import com.flagship.wealth_ledger.account.AccountKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TransferKindTest {

    @Test
    @DisplayName("Transfers are classified by the kinds of both accounts")
    void classify() {
        assertEquals(TransferKind.CASH_TO_CASH, TransferKind.classify(AccountKind.CASH, AccountKind.CASH));
        assertEquals(TransferKind.CASH_TO_INVESTMENT, TransferKind.classify(AccountKind.CASH, AccountKind.INVESTMENT));
        assertEquals(TransferKind.INVESTMENT_TO_CASH, TransferKind.classify(AccountKind.INVESTMENT, AccountKind.CASH));
        assertEquals(TransferKind.INVESTMENT_TO_INVESTMENT,
                TransferKind.classify(AccountKind.INVESTMENT, AccountKind.INVESTMENT));
    }
}
