package com.flagship.wealth_ledger.account;

import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.StateConflictException;
import com.flagship.wealth_ledger.holding.HoldingEntity;
import com.flagship.wealth_ledger.holding.HoldingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccountLedgerTest {

    private AccountLedger accountLedger;

    @BeforeEach
    void setUp() {
        accountLedger = new AccountLedger(mock(AccountRepository.class), mock(HoldingRepository.class));
    }

    private static HoldingEntity holding(String value, boolean liquid, boolean active) {
        HoldingEntity holding = mock(HoldingEntity.class);
        when(holding.getCurrentValue()).thenReturn(new BigDecimal(value));
        when(holding.isLiquid()).thenReturn(liquid);
        when(holding.isActive()).thenReturn(active);
        return holding;
    }

    @Test
    @DisplayName("Credits and debits move the balance and return the new balance")
    void creditAndDebit() {
        AccountEntity account = AccountEntity.open("Checking", AccountKind.CASH, "USD", null, null, null);

        assertEquals(0, accountLedger.credit(account, new BigDecimal("1000")).compareTo(new BigDecimal("1000")));
        assertEquals(0, accountLedger.debit(account, new BigDecimal("250.25")).compareTo(new BigDecimal("749.75")));
        assertEquals(0, accountLedger.apply(account, new BigDecimal("-49.75")).compareTo(new BigDecimal("700")));
        assertEquals(0, account.getBalance().compareTo(new BigDecimal("700")));
    }

    @Test
    @DisplayName("A debit past zero is rejected and leaves the balance unchanged")
    void debitBelowZeroRejected() {
        AccountEntity account = AccountEntity.open("Checking", AccountKind.CASH, "USD", null, null, null);
        accountLedger.credit(account, new BigDecimal("100"));

        StateConflictException e = assertThrows(StateConflictException.class,
                () -> accountLedger.debit(account, new BigDecimal("100.0001")));

        assertEquals(LedgerErrorCode.INSUFFICIENT_FUNDS, e.getCode());
        assertEquals(0, account.getBalance().compareTo(new BigDecimal("100")));
    }

    @Test
    @DisplayName("Projection splits active holdings into liquid and non-liquid value")
    void projection() {
        List<HoldingEntity> holdings = List.of(
                holding("300", true, true),
                holding("1200", false, true),
                holding("999", false, false));

        ProjectedValues values = AccountLedger.project(new BigDecimal("500"), holdings);

        assertEquals(0, values.getTotalValue().compareTo(new BigDecimal("2000")));
        assertEquals(0, values.getAvailableCash().compareTo(new BigDecimal("800")));
        assertEquals(0, values.getInvestmentValue().compareTo(new BigDecimal("1200")));
    }

    @Test
    @DisplayName("Projection without holdings is the balance alone")
    void projectionWithoutHoldings() {
        ProjectedValues values = AccountLedger.project(new BigDecimal("42.5"), List.of());

        assertEquals(0, values.getTotalValue().compareTo(new BigDecimal("42.5")));
        assertEquals(0, values.getAvailableCash().compareTo(new BigDecimal("42.5")));
        assertEquals(0, values.getInvestmentValue().signum());
    }
}
