package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.expense.ExpenseDetails;
import com.flagship.wealth_ledger.orchestrator.RecordExpenseCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordExpenseRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    private UUID accountId;

    @JsonProperty("budget_id")
    private UUID budgetId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("expense_date")
    private LocalDate expenseDate;

    @NotBlank(message = "Category is required")
    @JsonProperty("category")
    private String category;

    @JsonProperty("subcategory")
    private String subcategory;

    @JsonProperty("merchant")
    private String merchant;

    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("shared")
    private boolean shared;

    @JsonProperty("tags")
    private List<String> tags;

    @JsonProperty("participants")
    private List<String> participants;

    @JsonProperty("notes")
    private String notes;

    public RecordExpenseCommand toCommand() {
        return RecordExpenseCommand.builder()
            .accountId(accountId)
            .budgetId(budgetId)
            .amount(amount)
            .expenseDate(expenseDate)
            .details(ExpenseDetails.builder()
                .category(category)
                .subcategory(subcategory)
                .merchant(merchant)
                .paymentMethod(paymentMethod)
                .shared(shared)
                .tags(tags)
                .participants(participants)
                .notes(notes)
                .build())
            .build();
    }
}
