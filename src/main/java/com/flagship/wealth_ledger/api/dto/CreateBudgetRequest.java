package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.budget.BudgetKind;
import com.flagship.wealth_ledger.budget.CreateBudgetCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateBudgetRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    private String name;

    @NotNull(message = "Budget kind is required")
    @JsonProperty("kind")
    private BudgetKind kind;

    @NotNull(message = "Allocated amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Allocated amount must be greater than 0")
    @JsonProperty("allocated")
    private BigDecimal allocated;

    @JsonProperty("period_start")
    private LocalDate periodStart;

    @JsonProperty("period_end")
    private LocalDate periodEnd;

    @JsonProperty("eligible_account_ids")
    private Set<UUID> eligibleAccountIds;

    @JsonProperty("notes")
    private String notes;

    public CreateBudgetCommand toCommand() {
        return CreateBudgetCommand.builder()
            .name(name)
            .kind(kind)
            .allocated(allocated)
            .periodStart(periodStart)
            .periodEnd(periodEnd)
            .eligibleAccountIds(eligibleAccountIds)
            .notes(notes)
            .build();
    }
}
