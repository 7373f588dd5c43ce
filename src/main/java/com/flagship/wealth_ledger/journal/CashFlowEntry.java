package com.flagship.wealth_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One immutable journal row.
 *
 * {@code amount} is the signed balance delta; {@code balanceAfter} is the
 * account balance right after the delta was applied. Reversal entries carry
 * the negated delta of the entry they compensate and the same link.
 */
@Value
public class CashFlowEntry {
    UUID id;
    long sequenceNumber;
    UUID accountId;
    FlowKind flowKind;
    BigDecimal amount;
    BigDecimal balanceAfter;
    String description;
    JournalLink link;
    boolean reversal;
    Instant createdAt;
}
