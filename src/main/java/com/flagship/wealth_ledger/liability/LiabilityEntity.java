package com.flagship.wealth_ledger.liability;

import com.flagship.wealth_ledger.config.LedgerProperties.OverpaymentPolicy;
import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.StateConflictException;
import com.flagship.wealth_ledger.money.MoneyMath;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A debt. Outstanding principal only decreases through payments and only
 * increases back when a payment is deleted.
 */
@Entity
@Table(name = "liabilities")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LiabilityEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private LiabilityKind kind;

    @Column
    private String institution;

    @Column(name = "original_amount", nullable = false, updatable = false, precision = 20, scale = 4)
    private BigDecimal originalAmount;

    @Column(name = "outstanding_principal", nullable = false, precision = 20, scale = 4)
    private BigDecimal outstandingPrincipal;

    @Column(name = "monthly_payment", precision = 20, scale = 4)
    private BigDecimal monthlyPayment;

    /**
     * Annual rate as a fraction, e.g. 0.0425.
     */
    @Column(name = "interest_rate", precision = 9, scale = 6)
    private BigDecimal interestRate;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false)
    private boolean active;

    @Column
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static LiabilityEntity create(String name, LiabilityKind kind, String institution, BigDecimal originalAmount,
                                  BigDecimal outstandingPrincipal, BigDecimal monthlyPayment,
                                  BigDecimal interestRate, String currency, String notes) {
        LiabilityEntity entity = new LiabilityEntity();
        entity.id = UUID.randomUUID();
        entity.name = name;
        entity.kind = kind;
        entity.institution = institution;
        entity.originalAmount = MoneyMath.amount(originalAmount);
        entity.outstandingPrincipal = MoneyMath.amount(outstandingPrincipal);
        entity.monthlyPayment = monthlyPayment != null ? MoneyMath.amount(monthlyPayment) : null;
        entity.interestRate = interestRate;
        entity.currency = currency;
        entity.notes = notes;
        entity.active = true;
        return entity;
    }

    /**
     * Reduces the outstanding principal.
     *
     * @return the principal actually applied; lower than requested only under
     *         {@link OverpaymentPolicy#CLAMP}
     * @throws StateConflictException OVERPAYMENT_REJECTED under
     *         {@link OverpaymentPolicy#REJECT} when the principal exceeds what is owed
     */
    BigDecimal applyPrincipal(BigDecimal principal, OverpaymentPolicy policy) {
        BigDecimal applied = principal;
        if (principal.compareTo(outstandingPrincipal) > 0) {
            if (policy == OverpaymentPolicy.REJECT) {
                throw new StateConflictException(LedgerErrorCode.OVERPAYMENT_REJECTED,
                        String.format("Payment principal %s exceeds outstanding principal %s of liability %s",
                                principal, outstandingPrincipal, id));
            }
            applied = outstandingPrincipal;
        }
        this.outstandingPrincipal = MoneyMath.amount(outstandingPrincipal.subtract(applied));
        return MoneyMath.amount(applied);
    }

    void restorePrincipal(BigDecimal applied) {
        this.outstandingPrincipal = MoneyMath.amount(outstandingPrincipal.add(applied));
    }

    void deactivate() {
        this.active = false;
    }

    public boolean isPaidOff() {
        return outstandingPrincipal.signum() == 0;
    }
}
