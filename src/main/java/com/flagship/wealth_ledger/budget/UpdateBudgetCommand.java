package com.flagship.wealth_ledger.budget;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

/**
 * Non-monetary budget edits. Null fields are left unchanged; allocation
 * changes go through reallocation.
 */
@Value
@Builder
public class UpdateBudgetCommand {
    String name;
    LocalDate periodStart;
    LocalDate periodEnd;
    Set<UUID> eligibleAccountIds;
    String notes;
}
