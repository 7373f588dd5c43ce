package com.flagship.wealth_ledger.liability;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class CreateLiabilityCommand {
    String name;
    LiabilityKind kind;
    String institution;
    BigDecimal originalAmount;
    BigDecimal outstandingPrincipal;
    BigDecimal monthlyPayment;
    BigDecimal interestRate;
    String currency;
    String notes;
}
