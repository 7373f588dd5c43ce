package com.flagship.wealth_ledger.transfer;

import com.flagship.wealth_ledger.money.MoneyMath;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Cash moved from one account's balance to another's. Immutable.
 */
@Entity
@Table(
    name = "transfers",
    indexes = {
        @Index(name = "idx_transfers_from", columnList = "from_account_id"),
        @Index(name = "idx_transfers_to", columnList = "to_account_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransferEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "from_account_id", nullable = false, updatable = false)
    private UUID fromAccountId;

    @Column(name = "to_account_id", nullable = false, updatable = false)
    private UUID toAccountId;

    @Column(nullable = false, updatable = false, precision = 20, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private TransferKind kind;

    @Column(name = "transfer_date", nullable = false, updatable = false)
    private LocalDate transferDate;

    @Column(updatable = false)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public static TransferEntity record(UUID fromAccountId, UUID toAccountId, BigDecimal amount,
                                        TransferKind kind, LocalDate transferDate, String notes) {
        TransferEntity entity = new TransferEntity();
        entity.id = UUID.randomUUID();
        entity.fromAccountId = fromAccountId;
        entity.toAccountId = toAccountId;
        entity.amount = MoneyMath.amount(amount);
        entity.kind = kind;
        entity.transferDate = transferDate;
        entity.notes = notes;
        return entity;
    }
}
