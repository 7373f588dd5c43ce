package com.flagship.wealth_ledger.orchestrator;

import com.flagship.wealth_ledger.account.AccountEntity;
import com.flagship.wealth_ledger.account.AccountKind;
import com.flagship.wealth_ledger.account.AccountLedger;
import com.flagship.wealth_ledger.budget.BudgetEntity;
import com.flagship.wealth_ledger.budget.BudgetTracker;
import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.LedgerException;
import com.flagship.wealth_ledger.error.NotFoundException;
import com.flagship.wealth_ledger.error.StateConflictException;
import com.flagship.wealth_ledger.error.ValidationException;
import com.flagship.wealth_ledger.expense.ExpenseEntity;
import com.flagship.wealth_ledger.expense.ExpenseRecorder;
import com.flagship.wealth_ledger.holding.HoldingEntity;
import com.flagship.wealth_ledger.holding.HoldingStore;
import com.flagship.wealth_ledger.holding.InvestmentTransactionEntity;
import com.flagship.wealth_ledger.holding.RecordTradeCommand;
import com.flagship.wealth_ledger.holding.RegisterHoldingCommand;
import com.flagship.wealth_ledger.journal.CashFlowJournal;
import com.flagship.wealth_ledger.journal.FlowKind;
import com.flagship.wealth_ledger.journal.JournalLink;
import com.flagship.wealth_ledger.liability.LiabilityEntity;
import com.flagship.wealth_ledger.liability.LiabilityPaymentEntity;
import com.flagship.wealth_ledger.liability.LiabilityTracker;
import com.flagship.wealth_ledger.money.MoneyMath;
import com.flagship.wealth_ledger.observability.CorrelationContext;
import com.flagship.wealth_ledger.observability.LedgerMetrics;
import com.flagship.wealth_ledger.transfer.TransferEntity;
import com.flagship.wealth_ledger.transfer.TransferKind;
import com.flagship.wealth_ledger.transfer.TransferRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Coordinates every mutation that touches more than one aggregate.
 *
 * Each public operation runs as one {@link UnitOfWork}: the balance change,
 * the holding/budget/liability change, the record row and the journal entry
 * commit together or not at all. Rows are locked in a fixed order (accounts
 * by ascending id, then holding, then budget, then liability) so concurrent
 * operations on overlapping rows serialize without deadlocking, and
 * operations on disjoint rows run in parallel.
 *
 * Deletions run the same machinery with inverted deltas and append
 * compensating journal entries; nothing is ever removed from the journal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionOrchestrator {

    private final UnitOfWork unitOfWork;
    private final AccountLedger accountLedger;
    private final HoldingStore holdingStore;
    private final BudgetTracker budgetTracker;
    private final LiabilityTracker liabilityTracker;
    private final ExpenseRecorder expenseRecorder;
    private final TransferRepository transferRepository;
    private final CashFlowJournal journal;
    private final LedgerIntegrityVerifier integrityVerifier;
    private final LedgerMetrics metrics;
    private final Clock clock;

    // ==================== Expenses ====================

    /**
     * Records an expense.
     *
     * Validation order:
     * 1. amount > 0, else INVALID_AMOUNT
     * 2. account exists and is active, else ACCOUNT_NOT_FOUND
     * 3. budget (when given) exists, is active and eligible for the account
     * 4. the account covers the amount, else INSUFFICIENT_FUNDS
     *
     * Then: debit the account, add to the budget's spent, store the expense
     * and journal the debit with the post-debit balance.
     */
    public ExpenseEntity recordExpense(RecordExpenseCommand command) {
        BigDecimal amount = MoneyMath.requirePositive(command.getAmount(), "amount");
        requireId(command.getAccountId(), "account id");

        return execute("record_expense", command.getAccountId(), () -> {
            AccountEntity account = accountLedger.lock(command.getAccountId());

            BudgetEntity budget = null;
            if (command.getBudgetId() != null) {
                budget = budgetTracker.lock(command.getBudgetId());
                budgetTracker.requireLinkable(budget, account.getId());
            }

            requireFunds(account, amount);

            BigDecimal balanceAfter = accountLedger.debit(account, amount);
            if (budget != null) {
                budgetTracker.linkExpense(budget, amount);
            }

            LocalDate expenseDate = command.getExpenseDate() != null ? command.getExpenseDate() : LocalDate.now(clock);
            ExpenseEntity expense = expenseRecorder.record(account.getId(), command.getBudgetId(), amount,
                    expenseDate, command.getDetails());

            journal.append(account.getId(), FlowKind.EXPENSE, amount.negate(), balanceAfter,
                    describeExpense(expense), JournalLink.expense(expense.getId()), false);

            integrityVerifier.verify(scope(account, budget));

            log.info("Expense recorded: expenseId={}, amount={}, budgetId={}, balanceAfter={}",
                    expense.getId(), amount, command.getBudgetId(), balanceAfter);
            return expense;
        });
    }

    /**
     * Deletes an expense: credits the account back, removes the amount from
     * the budget (subject to the terminal-budget policy) and appends a
     * compensating journal entry. Create followed by delete leaves balance
     * and spent exactly as before.
     */
    public void deleteExpense(UUID expenseId) {
        requireId(expenseId, "expense id");

        execute("delete_expense", null, () -> {
            ExpenseEntity expense = expenseRecorder.lock(expenseId);
            MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, expense.getAccountId().toString());

            AccountEntity account = accountLedger.lockForReversal(expense.getAccountId());
            BudgetEntity budget = expense.getBudgetId() != null ? budgetTracker.lock(expense.getBudgetId()) : null;

            BigDecimal balanceAfter = accountLedger.credit(account, expense.getAmount());
            journal.append(account.getId(), FlowKind.EXPENSE, expense.getAmount(), balanceAfter,
                    "Reversal of " + describeExpense(expense), JournalLink.expense(expense.getId()), true);

            if (budget != null) {
                budgetTracker.unlinkExpense(budget, expense.getAmount());
            }
            expenseRecorder.remove(expense);

            integrityVerifier.verify(scope(account, budget));

            log.info("Expense deleted: expenseId={}, amount={}, balanceAfter={}",
                    expenseId, expense.getAmount(), balanceAfter);
            return null;
        });
    }

    // ==================== Income ====================

    /**
     * Credits income to an account.
     *
     * @return id of the journal entry
     */
    public UUID recordIncome(UUID accountId, BigDecimal amount, String description) {
        BigDecimal value = MoneyMath.requirePositive(amount, "amount");
        requireId(accountId, "account id");

        return execute("record_income", accountId, () -> {
            AccountEntity account = accountLedger.lock(accountId);
            BigDecimal balanceAfter = accountLedger.credit(account, value);
            UUID entryId = journal.append(accountId, FlowKind.INCOME, value, balanceAfter,
                    description != null && !description.isBlank() ? description : "Income",
                    JournalLink.none(), false);

            integrityVerifier.verify(scope(account, null));
            return entryId;
        });
    }

    // ==================== Transfers ====================

    /**
     * Moves cash between two accounts. Both rows are locked before either
     * balance changes, so no reader ever sees the source debited without the
     * destination credited.
     */
    public TransferEntity createTransfer(CreateTransferCommand command) {
        BigDecimal amount = MoneyMath.requirePositive(command.getAmount(), "amount");
        requireId(command.getFromAccountId(), "source account id");
        requireId(command.getToAccountId(), "destination account id");
        if (command.getFromAccountId().equals(command.getToAccountId())) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST,
                    "Source and destination accounts must differ");
        }

        return execute("create_transfer", command.getFromAccountId(), () -> {
            Map<UUID, AccountEntity> locked = accountLedger.lockInOrder(
                    List.of(command.getFromAccountId(), command.getToAccountId()), false);
            AccountEntity source = locked.get(command.getFromAccountId());
            AccountEntity destination = locked.get(command.getToAccountId());

            requireFunds(source, amount);

            TransferKind kind = TransferKind.classify(source.getKind(), destination.getKind());
            BigDecimal sourceAfter = accountLedger.debit(source, amount);
            BigDecimal destinationAfter = accountLedger.credit(destination, amount);

            LocalDate date = command.getTransferDate() != null ? command.getTransferDate() : LocalDate.now(clock);
            TransferEntity transfer = transferRepository.save(TransferEntity.record(
                    source.getId(), destination.getId(), amount, kind, date, command.getNotes()));

            JournalLink link = JournalLink.transfer(transfer.getId());
            journal.append(source.getId(), FlowKind.TRANSFER, amount.negate(), sourceAfter,
                    "Transfer to " + destination.getName(), link, false);
            journal.append(destination.getId(), FlowKind.TRANSFER, amount, destinationAfter,
                    "Transfer from " + source.getName(), link, false);

            integrityVerifier.verify(IntegrityScope.builder().account(source).account(destination).build());

            log.info("Transfer created: transferId={}, kind={}, amount={}, from={}, to={}",
                    transfer.getId(), kind, amount, source.getId(), destination.getId());
            return transfer;
        });
    }

    /**
     * Reverses a transfer. The destination must still hold the amount.
     */
    public void deleteTransfer(UUID transferId) {
        requireId(transferId, "transfer id");

        execute("delete_transfer", null, () -> {
            TransferEntity transfer = transferRepository.findByIdForUpdate(transferId)
                    .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.TRANSFER_NOT_FOUND, "Transfer", transferId));
            MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, transfer.getFromAccountId().toString());

            Map<UUID, AccountEntity> locked = accountLedger.lockInOrder(
                    List.of(transfer.getFromAccountId(), transfer.getToAccountId()), true);
            AccountEntity source = locked.get(transfer.getFromAccountId());
            AccountEntity destination = locked.get(transfer.getToAccountId());

            BigDecimal destinationAfter = accountLedger.debit(destination, transfer.getAmount());
            BigDecimal sourceAfter = accountLedger.credit(source, transfer.getAmount());

            JournalLink link = JournalLink.transfer(transfer.getId());
            journal.append(destination.getId(), FlowKind.TRANSFER, transfer.getAmount().negate(), destinationAfter,
                    "Reversal of transfer from " + source.getName(), link, true);
            journal.append(source.getId(), FlowKind.TRANSFER, transfer.getAmount(), sourceAfter,
                    "Reversal of transfer to " + destination.getName(), link, true);

            transferRepository.delete(transfer);

            integrityVerifier.verify(IntegrityScope.builder().account(source).account(destination).build());

            log.info("Transfer deleted: transferId={}, amount={}", transferId, transfer.getAmount());
            return null;
        });
    }

    // ==================== Investments ====================

    /**
     * Registers an opening position without moving cash.
     */
    public HoldingEntity registerHolding(RegisterHoldingCommand command) {
        requireId(command.getAccountId(), "account id");

        return execute("register_holding", command.getAccountId(), () -> {
            AccountEntity account = requireInvestmentAccount(accountLedger.lock(command.getAccountId()));
            HoldingEntity holding = holdingStore.register(command, account.getCurrency());
            accountLedger.refreshHoldingsValue(account);

            integrityVerifier.verify(IntegrityScope.builder().account(account).holding(holding).build());
            return holding;
        });
    }

    /**
     * Records a buy, sell, dividend or interest receipt: moves the holding,
     * applies the signed cash effect to the account, stores the transaction
     * with its pre-trade snapshot and journals the cash movement.
     */
    public InvestmentTransactionEntity recordTrade(RecordTradeCommand command) {
        HoldingStore.validate(command);
        requireId(command.getAccountId(), "account id");

        return execute("record_trade", command.getAccountId(), () -> {
            AccountEntity account = requireInvestmentAccount(accountLedger.lock(command.getAccountId()));

            BigDecimal cash = HoldingStore.cashEffect(command.getKind(), command.getQuantity(),
                    command.getPrice(), command.getFees(), command.getAmount());
            if (cash.signum() < 0) {
                requireFunds(account, cash.negate());
            }

            LocalDate tradeDate = command.getTradeDate() != null ? command.getTradeDate() : LocalDate.now(clock);
            InvestmentTransactionEntity trade = holdingStore.applyTrade(command, cash, account.getCurrency(), tradeDate);

            BigDecimal balanceAfter = accountLedger.apply(account, cash);
            journal.append(account.getId(), FlowKind.INVESTMENT, cash, balanceAfter,
                    describeTrade(trade), JournalLink.trade(trade.getId()), false);

            accountLedger.refreshHoldingsValue(account);

            IntegrityScope.IntegrityScopeBuilder scope = IntegrityScope.builder().account(account);
            if (trade.getHoldingId() != null) {
                scope.holding(holdingStore.get(trade.getHoldingId()));
            }
            integrityVerifier.verify(scope.build());

            log.info("Trade recorded: transactionId={}, kind={}, symbol={}, quantity={}, price={}, cash={}",
                    trade.getId(), trade.getKind(), trade.getSymbol(), trade.getQuantity(), trade.getPrice(), cash);
            return trade;
        });
    }

    /**
     * Deletes a trade, restoring the holding by replay from the trade's
     * snapshot and reversing its cash effect.
     */
    public void deleteTrade(UUID transactionId) {
        requireId(transactionId, "transaction id");
        // Account before trade row: a deletion rewrites later trades' snapshots.
        UUID accountId = holdingStore.getTransaction(transactionId).getAccountId();

        execute("delete_trade", accountId, () -> {
            AccountEntity account = accountLedger.lockForReversal(accountId);
            InvestmentTransactionEntity trade = holdingStore.lockTransaction(transactionId);

            Optional<HoldingEntity> holding = holdingStore.reverseTrade(trade);

            BigDecimal delta = trade.getAmount().negate();
            BigDecimal balanceAfter = accountLedger.apply(account, delta);
            journal.append(account.getId(), FlowKind.INVESTMENT, delta, balanceAfter,
                    "Reversal of " + describeTrade(trade), JournalLink.trade(trade.getId()), true);

            accountLedger.refreshHoldingsValue(account);

            IntegrityScope.IntegrityScopeBuilder scope = IntegrityScope.builder().account(account);
            holding.ifPresent(scope::holding);
            integrityVerifier.verify(scope.build());

            log.info("Trade deleted: transactionId={}, kind={}, cashReversed={}, balanceAfter={}",
                    transactionId, trade.getKind(), delta, balanceAfter);
            return null;
        });
    }

    // ==================== Budgets ====================

    public BudgetEntity completeBudget(UUID budgetId) {
        requireId(budgetId, "budget id");
        return execute("complete_budget", null, () -> {
            BudgetEntity budget = budgetTracker.complete(budgetId);
            integrityVerifier.verify(scope(null, budget));
            return budget;
        });
    }

    public BudgetEntity cancelBudget(UUID budgetId) {
        requireId(budgetId, "budget id");
        return execute("cancel_budget", null, () -> {
            BudgetEntity budget = budgetTracker.cancel(budgetId);
            integrityVerifier.verify(scope(null, budget));
            return budget;
        });
    }

    // ==================== Liabilities ====================

    /**
     * Pays a liability from a cash account: debits the whole amount, takes
     * the principal part off the outstanding principal and journals the debit.
     */
    public LiabilityPaymentEntity recordPayment(RecordPaymentCommand command) {
        BigDecimal amount = MoneyMath.requirePositive(command.getAmount(), "amount");
        BigDecimal principal = command.getPrincipal() != null
                ? MoneyMath.requireNonNegative(command.getPrincipal(), "principal")
                : amount;
        if (principal.compareTo(amount) > 0) {
            throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT,
                    String.format("Principal %s exceeds payment amount %s", principal, amount));
        }
        BigDecimal interest = MoneyMath.amount(amount.subtract(principal));
        requireId(command.getLiabilityId(), "liability id");
        requireId(command.getSourceAccountId(), "source account id");

        return execute("record_payment", command.getSourceAccountId(), () -> {
            AccountEntity account = accountLedger.lock(command.getSourceAccountId());
            LiabilityEntity liability = liabilityTracker.lock(command.getLiabilityId());

            requireFunds(account, amount);

            BigDecimal balanceAfter = accountLedger.debit(account, amount);
            LocalDate date = command.getPaymentDate() != null ? command.getPaymentDate() : LocalDate.now(clock);
            LiabilityPaymentEntity payment = liabilityTracker.applyPayment(liability, account.getId(),
                    principal, interest, date, command.getNotes());

            journal.append(account.getId(), FlowKind.EXPENSE, amount.negate(), balanceAfter,
                    "Payment to " + liability.getName(), JournalLink.payment(payment.getId()), false);

            integrityVerifier.verify(scope(account, null));

            log.info("Liability payment recorded: paymentId={}, liabilityId={}, amount={}, principalApplied={}, "
                            + "outstanding={}",
                    payment.getId(), liability.getId(), amount, payment.getPrincipalApplied(),
                    liability.getOutstandingPrincipal());
            return payment;
        });
    }

    /**
     * Reverses a liability payment: credits the account back and restores
     * the principal it applied.
     */
    public void deletePayment(UUID paymentId) {
        requireId(paymentId, "payment id");

        execute("delete_payment", null, () -> {
            LiabilityPaymentEntity payment = liabilityTracker.lockPayment(paymentId);
            MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, payment.getAccountId().toString());

            AccountEntity account = accountLedger.lockForReversal(payment.getAccountId());
            LiabilityEntity liability = liabilityTracker.reversePayment(payment);

            BigDecimal balanceAfter = accountLedger.credit(account, payment.getAmount());
            journal.append(account.getId(), FlowKind.EXPENSE, payment.getAmount(), balanceAfter,
                    "Reversal of payment to " + liability.getName(), JournalLink.payment(payment.getId()), true);

            integrityVerifier.verify(scope(account, null));

            log.info("Liability payment deleted: paymentId={}, amount={}, outstanding={}",
                    paymentId, payment.getAmount(), liability.getOutstandingPrincipal());
            return null;
        });
    }

    // ==================== Helpers ====================

    /**
     * Runs one operation as a unit of work with MDC context, logging and metrics.
     */
    private <T> T execute(String operation, UUID accountId, Supplier<T> work) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.OPERATION_MDC_KEY, operation);
        if (accountId != null) {
            MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId.toString());
        }

        try {
            T result = unitOfWork.inTransaction(operation, work);
            metrics.recordOperation(operation, "success");
            return result;

        } catch (LedgerException e) {
            metrics.recordOperation(operation, e.getCode().name());
            if (e.getCode() == LedgerErrorCode.INTEGRITY_VIOLATION) {
                log.error("Ledger operation aborted: code={}, error={}", e.getCode(), e.getMessage());
            } else {
                log.warn("Ledger operation rejected: code={}, error={}", e.getCode(), e.getMessage());
            }
            throw e;

        } catch (RuntimeException e) {
            metrics.recordOperation(operation, "error");
            log.error("Ledger operation failed: error={}", e.getMessage(), e);
            throw e;

        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.OPERATION_MDC_KEY);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private void requireFunds(AccountEntity account, BigDecimal amount) {
        if (account.isBalanceEnforced() && account.getBalance().compareTo(amount) < 0) {
            throw new StateConflictException(LedgerErrorCode.INSUFFICIENT_FUNDS,
                    String.format("Insufficient funds in account %s: balance=%s, requested=%s",
                            account.getId(), account.getBalance(), amount));
        }
    }

    private AccountEntity requireInvestmentAccount(AccountEntity account) {
        if (account.getKind() != AccountKind.INVESTMENT) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST,
                    "Account " + account.getId() + " is not an investment account");
        }
        return account;
    }

    private static void requireId(UUID id, String field) {
        if (id == null) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST, field + " is required");
        }
    }

    private static IntegrityScope scope(AccountEntity account, BudgetEntity budget) {
        IntegrityScope.IntegrityScopeBuilder builder = IntegrityScope.builder();
        if (account != null) {
            builder.account(account);
        }
        if (budget != null) {
            builder.budget(budget);
        }
        return builder.build();
    }

    private static String describeExpense(ExpenseEntity expense) {
        String label = expense.getSubcategory() != null
                ? expense.getCategory() + "/" + expense.getSubcategory()
                : expense.getCategory();
        return expense.getMerchant() != null ? label + " @ " + expense.getMerchant() : label;
    }

    private static String describeTrade(InvestmentTransactionEntity trade) {
        return String.format("%s %s", trade.getKind(), trade.getSymbol());
    }
}
