package com.flagship.wealth_ledger.budget;

import com.flagship.wealth_ledger.config.LedgerProperties.OverspendPolicy;
import com.flagship.wealth_ledger.config.LedgerProperties.TerminalBudgetUnlink;
import com.flagship.wealth_ledger.error.IntegrityViolationException;
import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.StateConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Budget state machine and the remaining = allocated - spent invariant.
 */
class BudgetEntityTest {

    private static final Instant NOW = Instant.parse("2026-03-31T12:00:00Z");

    private BudgetEntity budget(String allocated) {
        return BudgetEntity.create("Groceries", BudgetKind.PERIODIC, new BigDecimal(allocated),
                LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 31), null, null);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, actual.compareTo(new BigDecimal(expected)), "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Linking and unlinking keep remaining equal to allocated minus spent")
    void linkAndUnlink() {
        BudgetEntity budget = budget("500");

        budget.link(new BigDecimal("200"), OverspendPolicy.ALLOW);
        assertAmount("200", budget.getSpent());
        assertAmount("300", budget.getRemaining());

        assertTrue(budget.unlink(new BigDecimal("200"), TerminalBudgetUnlink.ADJUST));
        assertAmount("0", budget.getSpent());
        assertAmount("500", budget.getRemaining());
    }

    @Test
    @DisplayName("Overspending is allowed by default and drives remaining negative")
    void overspendAllowed() {
        BudgetEntity budget = budget("100");
        budget.link(new BigDecimal("150"), OverspendPolicy.ALLOW);

        assertAmount("150", budget.getSpent());
        assertAmount("-50", budget.getRemaining());
    }

    @Test
    @DisplayName("Overspending is rejected under the REJECT policy")
    void overspendRejected() {
        BudgetEntity budget = budget("100");

        StateConflictException e = assertThrows(StateConflictException.class,
                () -> budget.link(new BigDecimal("100.01"), OverspendPolicy.REJECT));
        assertEquals(LedgerErrorCode.UNDERFUNDED_BUDGET, e.getCode());
        assertAmount("0", budget.getSpent());
    }

    @Test
    @DisplayName("Completing freezes the final snapshot")
    void completeSnapshotsFinalValues() {
        BudgetEntity budget = budget("500");
        budget.link(new BigDecimal("120"), OverspendPolicy.ALLOW);

        budget.complete(NOW);

        assertEquals(BudgetStatus.COMPLETED, budget.getStatus());
        assertEquals(NOW, budget.getClosedAt());
        assertAmount("120", budget.getFinalSpent());
        assertAmount("380", budget.getFinalRemaining());
    }

    @Test
    @DisplayName("Terminal budgets reject new expenses and further transitions")
    void terminalBudgetsAreClosed() {
        BudgetEntity budget = budget("500");
        budget.cancel(NOW);

        assertEquals(LedgerErrorCode.BUDGET_NOT_ACTIVE, assertThrows(StateConflictException.class,
                () -> budget.link(BigDecimal.ONE, OverspendPolicy.ALLOW)).getCode());
        assertEquals(LedgerErrorCode.INVALID_TRANSITION, assertThrows(StateConflictException.class,
                () -> budget.complete(NOW)).getCode());
        assertEquals(LedgerErrorCode.INVALID_TRANSITION, assertThrows(StateConflictException.class,
                () -> budget.cancel(NOW)).getCode());
        assertEquals(LedgerErrorCode.BUDGET_NOT_ACTIVE, assertThrows(StateConflictException.class,
                () -> budget.reallocate(BigDecimal.TEN)).getCode());
    }

    @Test
    @DisplayName("Unlinking from a completed budget adjusts spent but not the final snapshot")
    void unlinkAfterCompletionAdjusts() {
        BudgetEntity budget = budget("500");
        budget.link(new BigDecimal("200"), OverspendPolicy.ALLOW);
        budget.complete(NOW);

        assertTrue(budget.unlink(new BigDecimal("200"), TerminalBudgetUnlink.ADJUST));

        assertAmount("0", budget.getSpent());
        assertAmount("500", budget.getRemaining());
        assertAmount("200", budget.getFinalSpent());
        assertAmount("300", budget.getFinalRemaining());
    }

    @Test
    @DisplayName("Unlinking from a completed budget under FREEZE leaves it untouched")
    void unlinkAfterCompletionFrozen() {
        BudgetEntity budget = budget("500");
        budget.link(new BigDecimal("200"), OverspendPolicy.ALLOW);
        budget.complete(NOW);

        assertFalse(budget.unlink(new BigDecimal("200"), TerminalBudgetUnlink.FREEZE));
        assertAmount("200", budget.getSpent());
    }

    @Test
    @DisplayName("Unlinking more than was spent is an integrity violation")
    void unlinkBelowZero() {
        BudgetEntity budget = budget("500");
        budget.link(new BigDecimal("10"), OverspendPolicy.ALLOW);

        assertThrows(IntegrityViolationException.class,
                () -> budget.unlink(new BigDecimal("10.01"), TerminalBudgetUnlink.ADJUST));
    }

    @Test
    @DisplayName("Reallocating recomputes remaining")
    void reallocate() {
        BudgetEntity budget = budget("500");
        budget.link(new BigDecimal("100"), OverspendPolicy.ALLOW);
        budget.reallocate(new BigDecimal("800"));

        assertAmount("800", budget.getAllocated());
        assertAmount("700", budget.getRemaining());
    }

    @Test
    @DisplayName("An empty eligible set admits every account")
    void eligibility() {
        UUID allowed = UUID.randomUUID();
        BudgetEntity open = budget("100");
        BudgetEntity restricted = BudgetEntity.create("Trip", BudgetKind.PROJECT, new BigDecimal("100"),
                LocalDate.of(2026, 1, 1), LocalDate.of(2026, 12, 31), Set.of(allowed), null);

        assertTrue(open.isEligible(UUID.randomUUID()));
        assertTrue(restricted.isEligible(allowed));
        assertFalse(restricted.isEligible(UUID.randomUUID()));
    }
}
