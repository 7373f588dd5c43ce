package com.flagship.wealth_ledger.account;

import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.StateConflictException;
import com.flagship.wealth_ledger.money.MoneyMath;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A cash or investment account.
 *
 * There are no setters. {@code balance} only moves through {@link #credit}
 * and {@link #debit}, which the account ledger calls while holding the row
 * lock; {@code holdingsValue} is a cache owned by the market sync.
 */
@Entity
@Table(
    name = "accounts",
    indexes = {
        @Index(name = "idx_accounts_kind", columnList = "kind"),
        @Index(name = "idx_accounts_active", columnList = "active")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private AccountKind kind;

    @Column
    private String institution;

    @Column(name = "account_number")
    private String accountNumber;

    @Column(nullable = false, precision = 20, scale = 4)
    private BigDecimal balance;

    /**
     * Market value of active non-liquid holdings as of the last refresh.
     */
    @Column(name = "holdings_value", nullable = false, precision = 20, scale = 4)
    private BigDecimal holdingsValue;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "balance_enforced", nullable = false)
    private boolean balanceEnforced;

    @Column(nullable = false)
    private boolean active;

    @Column
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Opens a new account with a zero balance. Opening balances are credited
     * afterwards so that they appear in the journal.
     */
    public static AccountEntity open(String name, AccountKind kind, String currency,
                                     String institution, String accountNumber, String notes) {
        AccountEntity entity = new AccountEntity();
        entity.id = UUID.randomUUID();
        entity.name = name;
        entity.kind = kind;
        entity.currency = currency;
        entity.institution = institution;
        entity.accountNumber = accountNumber;
        entity.notes = notes;
        entity.balance = MoneyMath.ZERO_AMOUNT;
        entity.holdingsValue = MoneyMath.ZERO_AMOUNT;
        entity.balanceEnforced = true;
        entity.active = true;
        return entity;
    }

    /**
     * @return the new balance
     */
    BigDecimal credit(BigDecimal amount) {
        this.balance = MoneyMath.amount(balance.add(amount));
        return balance;
    }

    /**
     * @return the new balance
     * @throws StateConflictException with INSUFFICIENT_FUNDS when the account
     *         is balance-enforced and the debit would take it below zero
     */
    BigDecimal debit(BigDecimal amount) {
        BigDecimal next = MoneyMath.amount(balance.subtract(amount));
        if (balanceEnforced && next.signum() < 0) {
            throw new StateConflictException(LedgerErrorCode.INSUFFICIENT_FUNDS,
                    String.format("Insufficient funds in account %s: balance=%s, requested=%s",
                            id, balance, MoneyMath.amount(amount)));
        }
        this.balance = next;
        return balance;
    }

    void refreshHoldingsValue(BigDecimal holdingsValue) {
        this.holdingsValue = MoneyMath.amount(holdingsValue);
    }

    void deactivate() {
        this.active = false;
    }

    void rename(String name, String institution, String accountNumber, String notes) {
        if (name != null && !name.isBlank()) {
            this.name = name;
        }
        this.institution = institution;
        this.accountNumber = accountNumber;
        this.notes = notes;
    }
}
