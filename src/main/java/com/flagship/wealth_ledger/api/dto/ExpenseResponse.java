package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.expense.ExpenseEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ExpenseResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("budget_id")
    UUID budgetId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("expense_date")
    LocalDate expenseDate;

    @JsonProperty("category")
    String category;

    @JsonProperty("subcategory")
    String subcategory;

    @JsonProperty("merchant")
    String merchant;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("shared")
    boolean shared;

    @JsonProperty("tags")
    List<String> tags;

    @JsonProperty("participants")
    List<String> participants;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ExpenseResponse from(ExpenseEntity expense) {
        return ExpenseResponse.builder()
            .id(expense.getId())
            .accountId(expense.getAccountId())
            .budgetId(expense.getBudgetId())
            .amount(expense.getAmount())
            .expenseDate(expense.getExpenseDate())
            .category(expense.getCategory())
            .subcategory(expense.getSubcategory())
            .merchant(expense.getMerchant())
            .paymentMethod(expense.getPaymentMethod())
            .shared(expense.isShared())
            .tags(List.copyOf(expense.getTags()))
            .participants(List.copyOf(expense.getParticipants()))
            .notes(expense.getNotes())
            .createdAt(expense.getCreatedAt())
            .build();
    }
}
