package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.report.NetWorthSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class NetWorthResponse {

    @JsonProperty("cash_balances")
    BigDecimal cashBalances;

    @JsonProperty("investment_cash")
    BigDecimal investmentCash;

    @JsonProperty("liquid_holdings")
    BigDecimal liquidHoldings;

    @JsonProperty("investment_value")
    BigDecimal investmentValue;

    @JsonProperty("total_assets")
    BigDecimal totalAssets;

    @JsonProperty("total_liabilities")
    BigDecimal totalLiabilities;

    @JsonProperty("net_worth")
    BigDecimal netWorth;

    @JsonProperty("active_accounts")
    int activeAccounts;

    @JsonProperty("calculated_at")
    Instant calculatedAt;

    public static NetWorthResponse from(NetWorthSummary summary) {
        return NetWorthResponse.builder()
            .cashBalances(summary.getCashBalances())
            .investmentCash(summary.getInvestmentCash())
            .liquidHoldings(summary.getLiquidHoldings())
            .investmentValue(summary.getInvestmentValue())
            .totalAssets(summary.getTotalAssets())
            .totalLiabilities(summary.getTotalLiabilities())
            .netWorth(summary.getNetWorth())
            .activeAccounts(summary.getActiveAccounts())
            .calculatedAt(summary.getCalculatedAt())
            .build();
    }
}
