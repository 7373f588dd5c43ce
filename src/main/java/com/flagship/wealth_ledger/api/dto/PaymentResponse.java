package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.liability.LiabilityPaymentEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("liability_id")
    UUID liabilityId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("principal")
    BigDecimal principal;

    @JsonProperty("interest")
    BigDecimal interest;

    @JsonProperty("principal_applied")
    BigDecimal principalApplied;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentResponse from(LiabilityPaymentEntity payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .liabilityId(payment.getLiabilityId())
            .accountId(payment.getAccountId())
            .amount(payment.getAmount())
            .principal(payment.getPrincipal())
            .interest(payment.getInterest())
            .principalApplied(payment.getPrincipalApplied())
            .paymentDate(payment.getPaymentDate())
            .notes(payment.getNotes())
            .createdAt(payment.getCreatedAt())
            .build();
    }
}
