package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.budget.UpdateBudgetCommand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

/**
 * Absent fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateBudgetRequest {

    @JsonProperty("name")
    private String name;

    @JsonProperty("period_start")
    private LocalDate periodStart;

    @JsonProperty("period_end")
    private LocalDate periodEnd;

    @JsonProperty("eligible_account_ids")
    private Set<UUID> eligibleAccountIds;

    @JsonProperty("notes")
    private String notes;

    public UpdateBudgetCommand toCommand() {
        return UpdateBudgetCommand.builder()
            .name(name)
            .periodStart(periodStart)
            .periodEnd(periodEnd)
            .eligibleAccountIds(eligibleAccountIds)
            .notes(notes)
            .build();
    }
}
