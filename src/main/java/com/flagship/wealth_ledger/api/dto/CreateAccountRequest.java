package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.account.AccountKind;
import com.flagship.wealth_ledger.account.CreateAccountCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAccountRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    private String name;

    @NotNull(message = "Account kind is required")
    @JsonProperty("kind")
    private AccountKind kind;

    @JsonProperty("institution")
    private String institution;

    @JsonProperty("account_number")
    private String accountNumber;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    private String currency;

    @DecimalMin(value = "0", message = "Opening balance must not be negative")
    @JsonProperty("opening_balance")
    private BigDecimal openingBalance;

    @JsonProperty("notes")
    private String notes;

    public CreateAccountCommand toCommand() {
        return CreateAccountCommand.builder()
            .name(name)
            .kind(kind)
            .institution(institution)
            .accountNumber(accountNumber)
            .currency(currency)
            .openingBalance(openingBalance)
            .notes(notes)
            .build();
    }
}
