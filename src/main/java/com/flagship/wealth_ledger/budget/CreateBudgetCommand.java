package com.flagship.wealth_ledger.budget;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

@Value
@Builder
public class CreateBudgetCommand {
    String name;
    BudgetKind kind;
    BigDecimal allocated;
    LocalDate periodStart;
    LocalDate periodEnd;
    Set<UUID> eligibleAccountIds;
    String notes;
}
