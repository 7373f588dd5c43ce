package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.liability.LiabilityEntity;
import com.flagship.wealth_ledger.liability.LiabilityKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LiabilityResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("kind")
    LiabilityKind kind;

    @JsonProperty("institution")
    String institution;

    @JsonProperty("original_amount")
    BigDecimal originalAmount;

    @JsonProperty("outstanding_principal")
    BigDecimal outstandingPrincipal;

    @JsonProperty("monthly_payment")
    BigDecimal monthlyPayment;

    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("paid_off")
    boolean paidOff;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LiabilityResponse from(LiabilityEntity liability) {
        return LiabilityResponse.builder()
            .id(liability.getId())
            .name(liability.getName())
            .kind(liability.getKind())
            .institution(liability.getInstitution())
            .originalAmount(liability.getOriginalAmount())
            .outstandingPrincipal(liability.getOutstandingPrincipal())
            .monthlyPayment(liability.getMonthlyPayment())
            .interestRate(liability.getInterestRate())
            .currency(liability.getCurrency())
            .paidOff(liability.isPaidOff())
            .active(liability.isActive())
            .notes(liability.getNotes())
            .createdAt(liability.getCreatedAt())
            .build();
    }
}
