package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.budget.BudgetEntity;
import com.flagship.wealth_ledger.budget.BudgetKind;
import com.flagship.wealth_ledger.budget.BudgetStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class BudgetResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("kind")
    BudgetKind kind;

    @JsonProperty("status")
    BudgetStatus status;

    @JsonProperty("allocated")
    BigDecimal allocated;

    @JsonProperty("spent")
    BigDecimal spent;

    @JsonProperty("remaining")
    BigDecimal remaining;

    @JsonProperty("period_start")
    LocalDate periodStart;

    @JsonProperty("period_end")
    LocalDate periodEnd;

    @JsonProperty("final_spent")
    BigDecimal finalSpent;

    @JsonProperty("final_remaining")
    BigDecimal finalRemaining;

    @JsonProperty("closed_at")
    Instant closedAt;

    @JsonProperty("eligible_account_ids")
    List<UUID> eligibleAccountIds;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static BudgetResponse from(BudgetEntity budget) {
        return BudgetResponse.builder()
            .id(budget.getId())
            .name(budget.getName())
            .kind(budget.getKind())
            .status(budget.getStatus())
            .allocated(budget.getAllocated())
            .spent(budget.getSpent())
            .remaining(budget.getRemaining())
            .periodStart(budget.getPeriodStart())
            .periodEnd(budget.getPeriodEnd())
            .finalSpent(budget.getFinalSpent())
            .finalRemaining(budget.getFinalRemaining())
            .closedAt(budget.getClosedAt())
            .eligibleAccountIds(budget.getEligibleAccountIds().stream().sorted().toList())
            .notes(budget.getNotes())
            .createdAt(budget.getCreatedAt())
            .build();
    }
}
