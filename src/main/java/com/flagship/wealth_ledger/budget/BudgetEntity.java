package com.flagship.wealth_ledger.budget;

import com.flagship.wealth_ledger.config.LedgerProperties.OverspendPolicy;
import com.flagship.wealth_ledger.config.LedgerProperties.TerminalBudgetUnlink;
import com.flagship.wealth_ledger.error.IntegrityViolationException;
import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.StateConflictException;
import com.flagship.wealth_ledger.money.MoneyMath;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A spending budget.
 *
 * {@code remaining} is stored for querying but is never set directly: every
 * change of {@code allocated} or {@code spent} recomputes it as
 * {@code allocated - spent}.
 */
@Entity
@Table(
    name = "budgets",
    indexes = {
        @Index(name = "idx_budgets_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BudgetEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private BudgetKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BudgetStatus status;

    @Column(nullable = false, precision = 20, scale = 4)
    private BigDecimal allocated;

    @Column(nullable = false, precision = 20, scale = 4)
    private BigDecimal spent;

    @Column(nullable = false, precision = 20, scale = 4)
    private BigDecimal remaining;

    @Column(name = "period_start", nullable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false)
    private LocalDate periodEnd;

    /**
     * Accounts allowed to fund this budget. Empty means every account.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "budget_accounts", joinColumns = @JoinColumn(name = "budget_id"))
    @Column(name = "account_id", nullable = false)
    private Set<UUID> eligibleAccountIds = new HashSet<>();

    @Column(name = "final_spent", precision = 20, scale = 4)
    private BigDecimal finalSpent;

    @Column(name = "final_remaining", precision = 20, scale = 4)
    private BigDecimal finalRemaining;

    @Column(name = "closed_at")
    private Instant closedAt;

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

    static BudgetEntity create(String name, BudgetKind kind, BigDecimal allocated, LocalDate periodStart,
                               LocalDate periodEnd, Set<UUID> eligibleAccountIds, String notes) {
        BudgetEntity entity = new BudgetEntity();
        entity.id = UUID.randomUUID();
        entity.name = name;
        entity.kind = kind;
        entity.status = BudgetStatus.ACTIVE;
        entity.allocated = MoneyMath.amount(allocated);
        entity.spent = MoneyMath.ZERO_AMOUNT;
        entity.periodStart = periodStart;
        entity.periodEnd = periodEnd;
        entity.notes = notes;
        if (eligibleAccountIds != null) {
            entity.eligibleAccountIds.addAll(eligibleAccountIds);
        }
        entity.recomputeRemaining();
        return entity;
    }

    public Set<UUID> getEligibleAccountIds() {
        return Collections.unmodifiableSet(eligibleAccountIds);
    }

    public boolean isEligible(UUID accountId) {
        return eligibleAccountIds.isEmpty() || eligibleAccountIds.contains(accountId);
    }

    /**
     * Adds an expense amount to {@code spent}.
     *
     * @throws StateConflictException BUDGET_NOT_ACTIVE when not active, or
     *         UNDERFUNDED_BUDGET when the policy rejects overspending and
     *         {@code amount > remaining}
     */
    void link(BigDecimal amount, OverspendPolicy policy) {
        requireActive();
        if (policy == OverspendPolicy.REJECT && amount.compareTo(remaining) > 0) {
            throw new StateConflictException(LedgerErrorCode.UNDERFUNDED_BUDGET,
                    String.format("Budget %s has %s remaining, expense needs %s", id, remaining, amount));
        }
        this.spent = MoneyMath.amount(spent.add(amount));
        recomputeRemaining();
    }

    /**
     * Removes an expense amount from {@code spent}.
     *
     * Active budgets are always adjusted. Completed and cancelled budgets are
     * adjusted under {@link TerminalBudgetUnlink#ADJUST} and left as they
     * are under {@link TerminalBudgetUnlink#FREEZE}. The final snapshot taken
     * at completion never changes.
     *
     * @return true when {@code spent} changed
     */
    boolean unlink(BigDecimal amount, TerminalBudgetUnlink policy) {
        if (status.isTerminal() && policy == TerminalBudgetUnlink.FREEZE) {
            return false;
        }
        BigDecimal next = MoneyMath.amount(spent.subtract(amount));
        if (next.signum() < 0) {
            throw new IntegrityViolationException(
                    String.format("Unlinking %s from budget %s would make spent negative (spent=%s)",
                            amount, id, spent));
        }
        this.spent = next;
        recomputeRemaining();
        return true;
    }

    void complete(Instant now) {
        transitionTo(BudgetStatus.COMPLETED, now);
        this.finalSpent = spent;
        this.finalRemaining = remaining;
    }

    void cancel(Instant now) {
        transitionTo(BudgetStatus.CANCELLED, now);
    }

    void reallocate(BigDecimal newAllocated) {
        requireActive();
        this.allocated = MoneyMath.amount(newAllocated);
        recomputeRemaining();
    }

    void updateDetails(String name, LocalDate periodStart, LocalDate periodEnd,
                       Set<UUID> eligibleAccountIds, String notes) {
        if (name != null && !name.isBlank()) {
            this.name = name;
        }
        if (periodStart != null) {
            this.periodStart = periodStart;
        }
        if (periodEnd != null) {
            this.periodEnd = periodEnd;
        }
        if (eligibleAccountIds != null) {
            this.eligibleAccountIds.clear();
            this.eligibleAccountIds.addAll(eligibleAccountIds);
        }
        if (notes != null) {
            this.notes = notes;
        }
    }

    private void transitionTo(BudgetStatus target, Instant now) {
        if (status != BudgetStatus.ACTIVE) {
            throw new StateConflictException(LedgerErrorCode.INVALID_TRANSITION,
                    String.format("Cannot move budget %s from %s to %s", id, status, target));
        }
        this.status = target;
        this.closedAt = now;
    }

    private void requireActive() {
        if (status != BudgetStatus.ACTIVE) {
            throw new StateConflictException(LedgerErrorCode.BUDGET_NOT_ACTIVE,
                    String.format("Budget %s is %s", id, status));
        }
    }

    private void recomputeRemaining() {
        this.remaining = MoneyMath.amount(allocated.subtract(spent));
    }
}
