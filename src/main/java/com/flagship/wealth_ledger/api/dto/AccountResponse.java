package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.account.AccountEntity;
import com.flagship.wealth_ledger.account.AccountKind;
import com.flagship.wealth_ledger.account.ProjectedValues;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Account with its projected values.
 */
@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("kind")
    AccountKind kind;

    @JsonProperty("institution")
    String institution;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("holdings_value")
    BigDecimal holdingsValue;

    @JsonProperty("total_value")
    BigDecimal totalValue;

    @JsonProperty("available_cash")
    BigDecimal availableCash;

    @JsonProperty("investment_value")
    BigDecimal investmentValue;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(AccountEntity account, ProjectedValues projected) {
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .kind(account.getKind())
            .institution(account.getInstitution())
            .accountNumber(account.getAccountNumber())
            .currency(account.getCurrency())
            .balance(account.getBalance())
            .holdingsValue(account.getHoldingsValue())
            .totalValue(projected.getTotalValue())
            .availableCash(projected.getAvailableCash())
            .investmentValue(projected.getInvestmentValue())
            .active(account.isActive())
            .notes(account.getNotes())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
