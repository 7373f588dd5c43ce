package com.flagship.wealth_ledger.orchestrator;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CreateTransferCommand {
    UUID fromAccountId;
    UUID toAccountId;
    BigDecimal amount;
    LocalDate transferDate;
    String notes;
}
