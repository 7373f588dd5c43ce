package com.flagship.wealth_ledger.report;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class NetWorthSummary {
    BigDecimal cashBalances;
    BigDecimal investmentCash;
    BigDecimal liquidHoldings;
    BigDecimal investmentValue;
    BigDecimal totalAssets;
    BigDecimal totalLiabilities;
    BigDecimal netWorth;
    int activeAccounts;
    Instant calculatedAt;
}
