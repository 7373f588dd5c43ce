package com.flagship.wealth_ledger.account;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class CreateAccountCommand {
    String name;
    AccountKind kind;
    String institution;
    String accountNumber;
    String currency;
    BigDecimal openingBalance;
    String notes;
}
