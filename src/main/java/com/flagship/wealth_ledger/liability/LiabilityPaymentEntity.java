package com.flagship.wealth_ledger.liability;

import com.flagship.wealth_ledger.money.MoneyMath;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * One payment against a liability.
 *
 * {@code amount = principal + interest} leaves the source account;
 * {@code principalApplied} is what was taken off the outstanding principal
 * and is what a deletion gives back.
 */
@Entity
@Table(
    name = "liability_payments",
    indexes = {
        @Index(name = "idx_liability_payments_liability", columnList = "liability_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LiabilityPaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "liability_id", nullable = false, updatable = false)
    private UUID liabilityId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(nullable = false, updatable = false, precision = 20, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, precision = 20, scale = 4)
    private BigDecimal principal;

    @Column(nullable = false, updatable = false, precision = 20, scale = 4)
    private BigDecimal interest;

    @Column(name = "principal_applied", nullable = false, updatable = false, precision = 20, scale = 4)
    private BigDecimal principalApplied;

    @Column(name = "payment_date", nullable = false, updatable = false)
    private LocalDate paymentDate;

    @Column(updatable = false)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static LiabilityPaymentEntity record(UUID liabilityId, UUID accountId, BigDecimal principal,
                                         BigDecimal interest, BigDecimal principalApplied,
                                         LocalDate paymentDate, String notes) {
        LiabilityPaymentEntity entity = new LiabilityPaymentEntity();
        entity.id = UUID.randomUUID();
        entity.liabilityId = liabilityId;
        entity.accountId = accountId;
        entity.principal = MoneyMath.amount(principal);
        entity.interest = MoneyMath.amount(interest);
        entity.amount = MoneyMath.amount(entity.principal.add(entity.interest));
        entity.principalApplied = MoneyMath.amount(principalApplied);
        entity.paymentDate = paymentDate;
        entity.notes = notes;
        return entity;
    }
}
