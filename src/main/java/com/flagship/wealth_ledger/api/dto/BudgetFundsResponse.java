package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.budget.BudgetFunds;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class BudgetFundsResponse {

    @JsonProperty("budget_id")
    UUID budgetId;

    @JsonProperty("remaining")
    BigDecimal remaining;

    @JsonProperty("available_funds")
    BigDecimal availableFunds;

    @JsonProperty("available_cash_by_account")
    Map<UUID, BigDecimal> availableCashByAccount;

    @JsonProperty("covered")
    boolean covered;

    public static BudgetFundsResponse from(BudgetFunds funds) {
        return BudgetFundsResponse.builder()
            .budgetId(funds.getBudgetId())
            .remaining(funds.getRemaining())
            .availableFunds(funds.getAvailableFunds())
            .availableCashByAccount(funds.getAvailableCashByAccount())
            .covered(funds.isCovered())
            .build();
    }
}
