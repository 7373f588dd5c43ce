package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.journal.CashFlowEntry;
import com.flagship.wealth_ledger.journal.FlowKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("sequence_number")
    long sequenceNumber;

    @JsonProperty("flow_kind")
    FlowKind flowKind;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("description")
    String description;

    @JsonProperty("expense_id")
    UUID expenseId;

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("investment_transaction_id")
    UUID investmentTransactionId;

    @JsonProperty("liability_payment_id")
    UUID liabilityPaymentId;

    @JsonProperty("reversal")
    boolean reversal;

    @JsonProperty("created_at")
    Instant createdAt;

    public static JournalEntryResponse from(CashFlowEntry entry) {
        return JournalEntryResponse.builder()
            .id(entry.getId())
            .sequenceNumber(entry.getSequenceNumber())
            .flowKind(entry.getFlowKind())
            .amount(entry.getAmount())
            .balanceAfter(entry.getBalanceAfter())
            .description(entry.getDescription())
            .expenseId(entry.getLink().getExpenseId())
            .transferId(entry.getLink().getTransferId())
            .investmentTransactionId(entry.getLink().getInvestmentTransactionId())
            .liabilityPaymentId(entry.getLink().getLiabilityPaymentId())
            .reversal(entry.isReversal())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
