package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.orchestrator.CreateTransferCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTransferRequest {

    @NotNull(message = "From account ID is required")
    @JsonProperty("from_account_id")
    private UUID fromAccountId;

    @NotNull(message = "To account ID is required")
    @JsonProperty("to_account_id")
    private UUID toAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("transfer_date")
    private LocalDate transferDate;

    @JsonProperty("notes")
    private String notes;

    public CreateTransferCommand toCommand() {
        return CreateTransferCommand.builder()
            .fromAccountId(fromAccountId)
            .toAccountId(toAccountId)
            .amount(amount)
            .transferDate(transferDate)
            .notes(notes)
            .build();
    }
}
