package com.flagship.wealth_ledger.orchestrator;

import com.flagship.wealth_ledger.expense.ExpenseDetails;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class RecordExpenseCommand {
    UUID accountId;
    UUID budgetId;
    BigDecimal amount;
    LocalDate expenseDate;
    ExpenseDetails details;
}
