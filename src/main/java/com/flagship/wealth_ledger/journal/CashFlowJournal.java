package com.flagship.wealth_ledger.journal;

import com.flagship.wealth_ledger.money.MoneyMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Append-only audit log of every balance-affecting event.
 *
 * Entries are inserted with plain JDBC and are never updated or deleted.
 * A deleted expense, transfer, trade or payment is compensated by a new
 * reversal entry, so replaying every entry of an account from zero always
 * reproduces the account's current balance.
 *
 * {@link #append} must be called inside the unit of work that mutates the
 * balance: the entry commits or rolls back together with the mutation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashFlowJournal {

    private static final String SELECT_COLUMNS =
            "SELECT id, sequence_number, account_id, flow_kind, amount, balance_after, description, " +
            "expense_id, transfer_id, investment_transaction_id, liability_payment_id, reversal, created_at " +
            "FROM cash_flow_entries ";

    private final JdbcTemplate jdbcTemplate;

    /**
     * Appends one entry within the caller's transaction.
     *
     * @param accountId    account whose balance changed
     * @param flowKind     kind of event
     * @param amount       signed balance delta, already applied to the account
     * @param balanceAfter account balance after the delta
     * @param description  human-readable summary
     * @param link         originating record, or {@link JournalLink#none()}
     * @param reversal     true for compensating entries written on deletion
     * @return id of the new entry
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID append(UUID accountId, FlowKind flowKind, BigDecimal amount, BigDecimal balanceAfter,
                       String description, JournalLink link, boolean reversal) {
        UUID entryId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO cash_flow_entries (id, account_id, flow_kind, amount, balance_after, description, " +
            "expense_id, transfer_id, investment_transaction_id, liability_payment_id, reversal, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            entryId,
            accountId,
            flowKind.name(),
            MoneyMath.amount(amount),
            MoneyMath.amount(balanceAfter),
            description,
            link.getExpenseId(),
            link.getTransferId(),
            link.getInvestmentTransactionId(),
            link.getLiabilityPaymentId(),
            reversal
        );

        log.debug("Journal entry appended: accountId={}, kind={}, amount={}, balanceAfter={}, reversal={}",
                accountId, flowKind, amount, balanceAfter, reversal);

        return entryId;
    }

    /**
     * Sum of every delta ever recorded for the account. Equals the current
     * balance when the ledger is consistent.
     */
    public BigDecimal replayBalance(UUID accountId) {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM cash_flow_entries WHERE account_id = ?",
            BigDecimal.class,
            accountId
        );
        return MoneyMath.amount(sum);
    }

    public boolean hasEntries(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM (SELECT 1 FROM cash_flow_entries WHERE account_id = ? LIMIT 1) e",
            Integer.class,
            accountId
        );
        return count != null && count > 0;
    }

    public long countEntries(UUID accountId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM cash_flow_entries WHERE account_id = ?",
            Long.class,
            accountId
        );
        return count != null ? count : 0L;
    }

    /**
     * Entries of an account in the order they were written.
     */
    public List<CashFlowEntry> entriesForAccount(UUID accountId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE account_id = ? ORDER BY sequence_number",
            entryRowMapper(),
            accountId
        );
    }

    public List<CashFlowEntry> entriesForExpense(UUID expenseId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE expense_id = ? ORDER BY sequence_number",
            entryRowMapper(),
            expenseId
        );
    }

    public Reconciliation reconcile(UUID accountId, BigDecimal storedBalance) {
        return new Reconciliation(
            accountId,
            MoneyMath.amount(storedBalance),
            replayBalance(accountId),
            countEntries(accountId)
        );
    }

    private RowMapper<CashFlowEntry> entryRowMapper() {
        return (rs, rowNum) -> {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new CashFlowEntry(
                rs.getObject("id", UUID.class),
                rs.getLong("sequence_number"),
                rs.getObject("account_id", UUID.class),
                FlowKind.valueOf(rs.getString("flow_kind")),
                rs.getBigDecimal("amount"),
                rs.getBigDecimal("balance_after"),
                rs.getString("description"),
                readLink(rs),
                rs.getBoolean("reversal"),
                createdAt != null ? createdAt.toInstant() : null
            );
        };
    }

    private JournalLink readLink(ResultSet rs) throws SQLException {
        UUID expenseId = rs.getObject("expense_id", UUID.class);
        if (expenseId != null) {
            return JournalLink.expense(expenseId);
        }
        UUID transferId = rs.getObject("transfer_id", UUID.class);
        if (transferId != null) {
            return JournalLink.transfer(transferId);
        }
        UUID tradeId = rs.getObject("investment_transaction_id", UUID.class);
        if (tradeId != null) {
            return JournalLink.trade(tradeId);
        }
        UUID paymentId = rs.getObject("liability_payment_id", UUID.class);
        if (paymentId != null) {
            return JournalLink.payment(paymentId);
        }
        return JournalLink.none();
    }
}
