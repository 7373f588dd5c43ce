package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.orchestrator.RecordPaymentCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Principal defaults to the full amount; the rest is interest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordPaymentRequest {

    @NotNull(message = "Source account ID is required")
    @JsonProperty("source_account_id")
    private UUID sourceAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    private BigDecimal amount;

    @DecimalMin(value = "0", message = "Principal must not be negative")
    @JsonProperty("principal")
    private BigDecimal principal;

    @JsonProperty("payment_date")
    private LocalDate paymentDate;

    @JsonProperty("notes")
    private String notes;

    public RecordPaymentCommand toCommand(UUID liabilityId) {
        return RecordPaymentCommand.builder()
            .liabilityId(liabilityId)
            .sourceAccountId(sourceAccountId)
            .amount(amount)
            .principal(principal)
            .paymentDate(paymentDate)
            .notes(notes)
            .build();
    }
}
