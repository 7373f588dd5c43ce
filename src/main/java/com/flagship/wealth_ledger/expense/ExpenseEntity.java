package com.flagship.wealth_ledger.expense;

import com.flagship.wealth_ledger.money.MoneyMath;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A recorded expense. The amount, account and budget never change after
 * creation; a corrected amount is a delete followed by a new expense.
 */
@Entity
@Table(
    name = "expenses",
    indexes = {
        @Index(name = "idx_expenses_account", columnList = "account_id"),
        @Index(name = "idx_expenses_budget", columnList = "budget_id"),
        @Index(name = "idx_expenses_date", columnList = "expense_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExpenseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "budget_id", updatable = false)
    private UUID budgetId;

    @Column(nullable = false, updatable = false, precision = 20, scale = 4)
    private BigDecimal amount;

    @Column(name = "expense_date", nullable = false, updatable = false)
    private LocalDate expenseDate;

    @Column(nullable = false, updatable = false, length = 64)
    private String category;

    @Column(updatable = false, length = 64)
    private String subcategory;

    @Column(updatable = false)
    private String merchant;

    @Column(name = "payment_method", updatable = false, length = 64)
    private String paymentMethod;

    @Column(name = "is_shared", nullable = false, updatable = false)
    private boolean shared;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "expense_tags", joinColumns = @JoinColumn(name = "expense_id"))
    @OrderColumn(name = "position")
    @Column(name = "tag", nullable = false)
    private List<String> tags = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "expense_participants", joinColumns = @JoinColumn(name = "expense_id"))
    @OrderColumn(name = "position")
    @Column(name = "participant", nullable = false)
    private List<String> participants = new ArrayList<>();

    @Column(updatable = false)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static ExpenseEntity record(UUID accountId, UUID budgetId, BigDecimal amount, LocalDate expenseDate,
                                ExpenseDetails details) {
        ExpenseEntity entity = new ExpenseEntity();
        entity.id = UUID.randomUUID();
        entity.accountId = accountId;
        entity.budgetId = budgetId;
        entity.amount = MoneyMath.amount(amount);
        entity.expenseDate = expenseDate;
        entity.category = details.getCategory();
        entity.subcategory = details.getSubcategory();
        entity.merchant = details.getMerchant();
        entity.paymentMethod = details.getPaymentMethod();
        entity.shared = details.isShared();
        entity.notes = details.getNotes();
        if (details.getTags() != null) {
            entity.tags.addAll(details.getTags());
        }
        if (details.getParticipants() != null) {
            entity.participants.addAll(details.getParticipants());
        }
        return entity;
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public List<String> getParticipants() {
        return Collections.unmodifiableList(participants);
    }
}
