package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.liability.CreateLiabilityCommand;
import com.flagship.wealth_ledger.liability.LiabilityKind;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateLiabilityRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    private String name;

    @NotNull(message = "Liability kind is required")
    @JsonProperty("kind")
    private LiabilityKind kind;

    @JsonProperty("institution")
    private String institution;

    @DecimalMin(value = "0", message = "Original amount must not be negative")
    @JsonProperty("original_amount")
    private BigDecimal originalAmount;

    @NotNull(message = "Outstanding principal is required")
    @DecimalMin(value = "0", message = "Outstanding principal must not be negative")
    @JsonProperty("outstanding_principal")
    private BigDecimal outstandingPrincipal;

    @DecimalMin(value = "0", message = "Monthly payment must not be negative")
    @JsonProperty("monthly_payment")
    private BigDecimal monthlyPayment;

    @DecimalMin(value = "0", message = "Interest rate must not be negative")
    @JsonProperty("interest_rate")
    private BigDecimal interestRate;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("notes")
    private String notes;

    public CreateLiabilityCommand toCommand() {
        return CreateLiabilityCommand.builder()
            .name(name)
            .kind(kind)
            .institution(institution)
            .originalAmount(originalAmount)
            .outstandingPrincipal(outstandingPrincipal)
            .monthlyPayment(monthlyPayment)
            .interestRate(interestRate)
            .currency(currency)
            .notes(notes)
            .build();
    }
}
