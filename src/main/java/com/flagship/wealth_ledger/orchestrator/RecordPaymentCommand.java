package com.flagship.wealth_ledger.orchestrator;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Payment against a liability. {@code principal} defaults to the whole
 * amount; the rest of the amount is interest.
 */
@Value
@Builder
public class RecordPaymentCommand {
    UUID liabilityId;
    UUID sourceAccountId;
    BigDecimal amount;
    BigDecimal principal;
    LocalDate paymentDate;
    String notes;
}
