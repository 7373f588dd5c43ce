package com.flagship.wealth_ledger.orchestrator;

import com.flagship.wealth_ledger.account.AccountEntity;
import com.flagship.wealth_ledger.account.AccountKind;
import com.flagship.wealth_ledger.account.AccountService;
import com.flagship.wealth_ledger.account.CreateAccountCommand;
import com.flagship.wealth_ledger.budget.BudgetEntity;
import com.flagship.wealth_ledger.budget.BudgetKind;
import com.flagship.wealth_ledger.budget.BudgetStatus;
import com.flagship.wealth_ledger.budget.BudgetTracker;
import com.flagship.wealth_ledger.budget.CreateBudgetCommand;
import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.LedgerException;
import com.flagship.wealth_ledger.error.StateConflictException;
import com.flagship.wealth_ledger.expense.ExpenseDetails;
import com.flagship.wealth_ledger.expense.ExpenseEntity;
import com.flagship.wealth_ledger.holding.AssetKind;
import com.flagship.wealth_ledger.holding.RegisterHoldingCommand;
import com.flagship.wealth_ledger.journal.CashFlowEntry;
import com.flagship.wealth_ledger.journal.CashFlowJournal;
import com.flagship.wealth_ledger.journal.FlowKind;
import com.flagship.wealth_ledger.journal.Reconciliation;
import com.flagship.wealth_ledger.liability.CreateLiabilityCommand;
import com.flagship.wealth_ledger.liability.LiabilityEntity;
import com.flagship.wealth_ledger.liability.LiabilityKind;
import com.flagship.wealth_ledger.liability.LiabilityPaymentEntity;
import com.flagship.wealth_ledger.liability.LiabilityTracker;
import com.flagship.wealth_ledger.report.NetWorthService;
import com.flagship.wealth_ledger.report.NetWorthSummary;
import com.flagship.wealth_ledger.transfer.TransferEntity;
import com.flagship.wealth_ledger.transfer.TransferKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end ledger scenarios against a real Postgres.
 *
 * Every scenario ends by replaying the journal of each touched account and
 * comparing it with the stored balance.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerScenarioTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("wealth_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private TransactionOrchestrator orchestrator;

    @Autowired
    private AccountService accountService;

    @Autowired
    private BudgetTracker budgetTracker;

    @Autowired
    private LiabilityTracker liabilityTracker;

    @Autowired
    private NetWorthService netWorthService;

    @Autowired
    private CashFlowJournal journal;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE TABLE cash_flow_entries, investment_transactions, holdings, "
                + "expense_tags, expense_participants, expenses, budget_accounts, budgets, transfers, "
                + "liability_payments, liabilities, market_sync_logs, manual_quotes, accounts CASCADE");
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("  INPUT  " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("  OUTPUT " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private AccountEntity openAccount(String name, AccountKind kind, String openingBalance) {
        return accountService.createAccount(CreateAccountCommand.builder()
                .name(name)
                .kind(kind)
                .currency("USD")
                .openingBalance(new BigDecimal(openingBalance))
                .build());
    }

    private BudgetEntity createBudget(String allocated, Set<UUID> eligibleAccounts) {
        return budgetTracker.create(CreateBudgetCommand.builder()
                .name("Household")
                .kind(BudgetKind.PERIODIC)
                .allocated(new BigDecimal(allocated))
                .periodStart(LocalDate.of(2026, 1, 1))
                .periodEnd(LocalDate.of(2026, 12, 31))
                .eligibleAccountIds(eligibleAccounts)
                .build());
    }

    private ExpenseEntity spend(UUID accountId, UUID budgetId, String amount) {
        return orchestrator.recordExpense(RecordExpenseCommand.builder()
                .accountId(accountId)
                .budgetId(budgetId)
                .amount(new BigDecimal(amount))
                .expenseDate(LocalDate.of(2026, 4, 12))
                .details(ExpenseDetails.builder().category("Dining").merchant("Corner Bistro").build())
                .build());
    }

    private BigDecimal balanceOf(UUID accountId) {
        return accountService.get(accountId).getBalance();
    }

    private void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, actual.compareTo(new BigDecimal(expected)), "expected " + expected + " but was " + actual);
    }

    private void assertJournalReplays(UUID accountId) {
        Reconciliation reconciliation = accountService.reconcile(accountId);
        printOutput("reconciliation", reconciliation);
        assertTrue(reconciliation.isBalanced(), "journal replay must match stored balance");
    }

    private int count(String table) {
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return rows != null ? rows : 0;
    }

    @Nested
    @DisplayName("Expenses and budgets")
    class Expenses {

        @Test
        @DisplayName("Recording then deleting a budgeted expense restores balance and spent")
        void expenseRoundTrip() {
            printTestHeader("Budgeted expense create and delete");
            AccountEntity account = openAccount("Checking", AccountKind.CASH, "1000");
            BudgetEntity budget = createBudget("500", null);
            printInput("expense", "200 against budget " + budget.getId());

            ExpenseEntity expense = spend(account.getId(), budget.getId(), "200");

            assertAmount("800", balanceOf(account.getId()));
            BudgetEntity afterExpense = budgetTracker.get(budget.getId());
            assertAmount("200", afterExpense.getSpent());
            assertAmount("300", afterExpense.getRemaining());
            assertJournalReplays(account.getId());

            orchestrator.deleteExpense(expense.getId());

            assertAmount("1000", balanceOf(account.getId()));
            BudgetEntity afterDelete = budgetTracker.get(budget.getId());
            assertAmount("0", afterDelete.getSpent());
            assertAmount("500", afterDelete.getRemaining());
            assertEquals(0, count("expenses"));
            // opening balance, expense and its reversal
            assertEquals(3, count("cash_flow_entries"));
            assertJournalReplays(account.getId());
            printSuccess("Delete reverted every effect of the expense");
        }

        @Test
        @DisplayName("An expense the account cannot cover leaves no trace")
        void insufficientFunds() {
            printTestHeader("Expense exceeding balance");
            AccountEntity account = openAccount("Checking", AccountKind.CASH, "100");
            BudgetEntity budget = createBudget("500", null);

            StateConflictException e = assertThrows(StateConflictException.class,
                    () -> spend(account.getId(), budget.getId(), "100.01"));

            assertEquals(LedgerErrorCode.INSUFFICIENT_FUNDS, e.getCode());
            assertAmount("100", balanceOf(account.getId()));
            assertAmount("0", budgetTracker.get(budget.getId()).getSpent());
            assertEquals(0, count("expenses"));
            assertEquals(1, count("cash_flow_entries"));
            printSuccess("Rolled back: " + e.getMessage());
        }

        @Test
        @DisplayName("A budget restricted to other accounts rejects the expense")
        void ineligibleAccount() {
            printTestHeader("Budget eligibility");
            AccountEntity funded = openAccount("Joint", AccountKind.CASH, "1000");
            AccountEntity other = openAccount("Personal", AccountKind.CASH, "1000");
            BudgetEntity budget = createBudget("500", Set.of(funded.getId()));

            StateConflictException e = assertThrows(StateConflictException.class,
                    () -> spend(other.getId(), budget.getId(), "50"));

            assertEquals(LedgerErrorCode.BUDGET_NOT_ELIGIBLE, e.getCode());
            assertAmount("1000", balanceOf(other.getId()));
            printSuccess("Ineligible account rejected");
        }

        @Test
        @DisplayName("Completed budgets reject new expenses but still release deleted ones")
        void completedBudget() {
            printTestHeader("Completed budget");
            AccountEntity account = openAccount("Checking", AccountKind.CASH, "1000");
            BudgetEntity budget = createBudget("500", null);
            ExpenseEntity expense = spend(account.getId(), budget.getId(), "120");

            BudgetEntity completed = orchestrator.completeBudget(budget.getId());
            assertEquals(BudgetStatus.COMPLETED, completed.getStatus());
            assertAmount("120", completed.getFinalSpent());

            StateConflictException e = assertThrows(StateConflictException.class,
                    () -> spend(account.getId(), budget.getId(), "10"));
            assertEquals(LedgerErrorCode.BUDGET_NOT_ACTIVE, e.getCode());

            orchestrator.deleteExpense(expense.getId());

            BudgetEntity after = budgetTracker.get(budget.getId());
            assertAmount("0", after.getSpent());
            assertAmount("120", after.getFinalSpent());
            assertAmount("1000", balanceOf(account.getId()));
            assertJournalReplays(account.getId());
            printSuccess("Final snapshot kept, spent adjusted");
        }

        @Test
        @DisplayName("Concurrent expenses never overdraw the account")
        void concurrentExpenses() throws InterruptedException {
            printTestHeader("Concurrent expenses on one account");
            AccountEntity account = openAccount("Checking", AccountKind.CASH, "1000");
            BudgetEntity budget = createBudget("5000", null);
            int threads = 10;
            printInput("threads", threads + " x 150 against a balance of 1000");

            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger succeeded = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        spend(account.getId(), budget.getId(), "150");
                        succeeded.incrementAndGet();
                    } catch (LedgerException e) {
                        if (e.getCode() == LedgerErrorCode.INSUFFICIENT_FUNDS) {
                            rejected.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(60, TimeUnit.SECONDS));
            executor.shutdown();

            printOutput("succeeded", succeeded.get());
            printOutput("rejected", rejected.get());
            assertEquals(6, succeeded.get());
            assertEquals(4, rejected.get());
            assertAmount("100", balanceOf(account.getId()));
            assertAmount("900", budgetTracker.get(budget.getId()).getSpent());
            assertJournalReplays(account.getId());
            printSuccess("Row lock serialized the debits");
        }
    }

    @Nested
    @DisplayName("Transfers and income")
    class Transfers {

        @Test
        @DisplayName("Transfers move cash atomically and can be reversed")
        void transferAndReverse() {
            printTestHeader("Transfer lifecycle");
            AccountEntity checking = openAccount("Checking", AccountKind.CASH, "1000");
            AccountEntity brokerage = openAccount("Brokerage", AccountKind.INVESTMENT, "0");

            TransferEntity transfer = orchestrator.createTransfer(CreateTransferCommand.builder()
                    .fromAccountId(checking.getId())
                    .toAccountId(brokerage.getId())
                    .amount(new BigDecimal("300"))
                    .build());

            assertEquals(TransferKind.CASH_TO_INVESTMENT, transfer.getKind());
            assertAmount("700", balanceOf(checking.getId()));
            assertAmount("300", balanceOf(brokerage.getId()));

            StateConflictException e = assertThrows(StateConflictException.class,
                    () -> orchestrator.createTransfer(CreateTransferCommand.builder()
                            .fromAccountId(checking.getId())
                            .toAccountId(brokerage.getId())
                            .amount(new BigDecimal("700.01"))
                            .build()));
            assertEquals(LedgerErrorCode.INSUFFICIENT_FUNDS, e.getCode());
            assertAmount("700", balanceOf(checking.getId()));
            assertAmount("300", balanceOf(brokerage.getId()));

            orchestrator.deleteTransfer(transfer.getId());

            assertAmount("1000", balanceOf(checking.getId()));
            assertAmount("0", balanceOf(brokerage.getId()));
            assertEquals(0, count("transfers"));
            assertJournalReplays(checking.getId());
            assertJournalReplays(brokerage.getId());
            printSuccess("Both sides restored");
        }

        @Test
        @DisplayName("Income credits the account and journals one entry")
        void income() {
            printTestHeader("Income");
            AccountEntity account = openAccount("Checking", AccountKind.CASH, "0");

            UUID entryId = orchestrator.recordIncome(account.getId(), new BigDecimal("2500.50"), "Salary");

            assertNotNull(entryId);
            assertAmount("2500.50", balanceOf(account.getId()));
            assertEquals(1, count("cash_flow_entries"));
            assertJournalReplays(account.getId());
            printSuccess("Income journaled");
        }

        @Test
        @DisplayName("Accounts with journal activity cannot be hard deleted")
        void deleteWithActivity() {
            printTestHeader("Account deletion");
            AccountEntity used = openAccount("Checking", AccountKind.CASH, "10");
            AccountEntity unused = openAccount("Spare", AccountKind.CASH, "0");

            StateConflictException e = assertThrows(StateConflictException.class,
                    () -> accountService.delete(used.getId()));
            assertEquals(LedgerErrorCode.ACCOUNT_HAS_ACTIVITY, e.getCode());

            accountService.delete(unused.getId());
            assertEquals(1, count("accounts"));
            printSuccess("Only the untouched account was deleted");
        }
    }

    @Nested
    @DisplayName("Liabilities and net worth")
    class Liabilities {

        private LiabilityEntity createLoan(String original, String outstanding) {
            return liabilityTracker.create(CreateLiabilityCommand.builder()
                    .name("Car loan")
                    .kind(LiabilityKind.CAR_LOAN)
                    .originalAmount(new BigDecimal(original))
                    .outstandingPrincipal(new BigDecimal(outstanding))
                    .build());
        }

        @Test
        @DisplayName("A payment splits into principal and interest and can be reversed")
        void paymentLifecycle() {
            printTestHeader("Liability payment");
            AccountEntity account = openAccount("Checking", AccountKind.CASH, "1000");
            LiabilityEntity loan = createLoan("5000", "5000");

            LiabilityPaymentEntity payment = orchestrator.recordPayment(RecordPaymentCommand.builder()
                    .liabilityId(loan.getId())
                    .sourceAccountId(account.getId())
                    .amount(new BigDecimal("300"))
                    .principal(new BigDecimal("250"))
                    .build());

            assertAmount("250", payment.getPrincipalApplied());
            assertAmount("50", payment.getInterest());
            assertAmount("700", balanceOf(account.getId()));
            assertAmount("4750", liabilityTracker.get(loan.getId()).getOutstandingPrincipal());

            orchestrator.deletePayment(payment.getId());

            assertAmount("1000", balanceOf(account.getId()));
            assertAmount("5000", liabilityTracker.get(loan.getId()).getOutstandingPrincipal());

            List<CashFlowEntry> entries = journal.entriesForAccount(account.getId());
            assertEquals(3, entries.size());
            CashFlowEntry paid = entries.get(1);
            CashFlowEntry reversed = entries.get(2);
            printOutput("payment entry", paid);
            assertEquals(FlowKind.EXPENSE, paid.getFlowKind());
            assertAmount("-300", paid.getAmount());
            assertEquals(payment.getId(), paid.getLink().getLiabilityPaymentId());
            assertFalse(paid.isReversal());
            assertEquals(FlowKind.EXPENSE, reversed.getFlowKind());
            assertAmount("300", reversed.getAmount());
            assertEquals(payment.getId(), reversed.getLink().getLiabilityPaymentId());
            assertTrue(reversed.isReversal());

            assertJournalReplays(account.getId());
            printSuccess("Payment reversed");
        }

        @Test
        @DisplayName("Paying more principal than is owed is rejected by default")
        void overpaymentRejected() {
            printTestHeader("Overpayment");
            AccountEntity account = openAccount("Checking", AccountKind.CASH, "1000");
            LiabilityEntity loan = createLoan("5000", "100");

            StateConflictException e = assertThrows(StateConflictException.class,
                    () -> orchestrator.recordPayment(RecordPaymentCommand.builder()
                            .liabilityId(loan.getId())
                            .sourceAccountId(account.getId())
                            .amount(new BigDecimal("150"))
                            .build()));

            assertEquals(LedgerErrorCode.OVERPAYMENT_REJECTED, e.getCode());
            assertAmount("1000", balanceOf(account.getId()));
            assertAmount("100", liabilityTracker.get(loan.getId()).getOutstandingPrincipal());
            printSuccess("Overpayment left both sides untouched");
        }

        @Test
        @DisplayName("Net worth sums cash, holdings and outstanding liabilities")
        void netWorth() {
            printTestHeader("Net worth");
            openAccount("Checking", AccountKind.CASH, "1000");
            AccountEntity brokerage = openAccount("Brokerage", AccountKind.INVESTMENT, "500");
            orchestrator.registerHolding(RegisterHoldingCommand.builder()
                    .accountId(brokerage.getId())
                    .symbol("vtsax")
                    .name("Total Market Index")
                    .assetKind(AssetKind.FUND)
                    .quantity(new BigDecimal("10"))
                    .averageCost(new BigDecimal("90"))
                    .currentPrice(new BigDecimal("100"))
                    .build());
            createLoan("5000", "300");

            NetWorthSummary summary = netWorthService.summarize();
            printOutput("summary", summary);

            assertAmount("1000", summary.getCashBalances());
            assertAmount("500", summary.getInvestmentCash());
            assertAmount("1000", summary.getInvestmentValue());
            assertAmount("2500", summary.getTotalAssets());
            assertAmount("300", summary.getTotalLiabilities());
            assertAmount("2200", summary.getNetWorth());
            assertEquals(2, summary.getActiveAccounts());
            assertAmount("1000", accountService.get(brokerage.getId()).getHoldingsValue());
            printSuccess("Net worth = 2200");
        }
    }
}
