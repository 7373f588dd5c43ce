package com.flagship.wealth_ledger.liability;

import com.flagship.wealth_ledger.config.LedgerProperties;
import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.NotFoundException;
import com.flagship.wealth_ledger.error.ValidationException;
import com.flagship.wealth_ledger.money.MoneyMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Owns outstanding principal and payment history of liabilities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LiabilityTracker {

    private static final String DEFAULT_CURRENCY = "CNY";

    private final LiabilityRepository liabilityRepository;
    private final LiabilityPaymentRepository paymentRepository;
    private final LedgerProperties properties;

    /**
     * Creates a liability. Outstanding principal defaults to the original
     * amount and may not exceed it.
     */
    @Transactional
    public LiabilityEntity create(CreateLiabilityCommand command) {
        if (command.getName() == null || command.getName().isBlank()) {
            throw new ValidationException(LedgerErrorCode.INVALID_REQUEST, "Liability name is required");
        }
        BigDecimal original = MoneyMath.requirePositive(command.getOriginalAmount(), "original amount");
        BigDecimal outstanding = command.getOutstandingPrincipal() != null
                ? MoneyMath.requireNonNegative(command.getOutstandingPrincipal(), "outstanding principal")
                : original;
        if (outstanding.compareTo(original) > 0) {
            throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT,
                    String.format("Outstanding principal %s exceeds original amount %s", outstanding, original));
        }
        if (command.getMonthlyPayment() != null) {
            MoneyMath.requireNonNegative(command.getMonthlyPayment(), "monthly payment");
        }

        LiabilityEntity liability = LiabilityEntity.create(command.getName(),
                command.getKind() != null ? command.getKind() : LiabilityKind.OTHER,
                command.getInstitution(), original, outstanding, command.getMonthlyPayment(),
                command.getInterestRate(),
                command.getCurrency() != null ? command.getCurrency().toUpperCase(Locale.ROOT) : DEFAULT_CURRENCY,
                command.getNotes());
        LiabilityEntity saved = liabilityRepository.save(liability);
        log.info("Liability created: liabilityId={}, kind={}, outstanding={}",
                saved.getId(), saved.getKind(), saved.getOutstandingPrincipal());
        return saved;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public LiabilityEntity lock(UUID liabilityId) {
        return liabilityRepository.findByIdForUpdate(liabilityId)
                .filter(LiabilityEntity::isActive)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.LIABILITY_NOT_FOUND, "Liability", liabilityId));
    }

    /**
     * Applies the principal part of a payment and stores the payment row.
     * The caller debits the source account by the full amount.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LiabilityPaymentEntity applyPayment(LiabilityEntity liability, UUID accountId, BigDecimal principal,
                                               BigDecimal interest, LocalDate paymentDate, String notes) {
        BigDecimal applied = liability.applyPrincipal(principal, properties.getOverpaymentPolicy());
        if (applied.compareTo(principal) < 0) {
            log.warn("Overpayment clamped: liabilityId={}, principal={}, applied={}",
                    liability.getId(), principal, applied);
        }
        LiabilityPaymentEntity payment = paymentRepository.save(LiabilityPaymentEntity.record(
                liability.getId(), accountId, principal, interest, applied, paymentDate, notes));
        log.debug("Liability payment applied: liabilityId={}, paymentId={}, outstanding={}",
                liability.getId(), payment.getId(), liability.getOutstandingPrincipal());
        return payment;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public LiabilityPaymentEntity lockPayment(UUID paymentId) {
        return paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.PAYMENT_NOT_FOUND, "Payment", paymentId));
    }

    /**
     * Gives back the principal a payment applied and deletes the payment row.
     * Inactive liabilities are still restored so that history stays faithful.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LiabilityEntity reversePayment(LiabilityPaymentEntity payment) {
        LiabilityEntity liability = liabilityRepository.findByIdForUpdate(payment.getLiabilityId())
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.LIABILITY_NOT_FOUND,
                        "Liability", payment.getLiabilityId()));
        liability.restorePrincipal(payment.getPrincipalApplied());
        paymentRepository.delete(payment);
        return liability;
    }

    @Transactional
    public void deactivate(UUID liabilityId) {
        lock(liabilityId).deactivate();
        log.info("Liability deactivated: liabilityId={}", liabilityId);
    }

    @Transactional(readOnly = true)
    public LiabilityEntity get(UUID liabilityId) {
        return liabilityRepository.findById(liabilityId)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.LIABILITY_NOT_FOUND, "Liability", liabilityId));
    }

    @Transactional(readOnly = true)
    public List<LiabilityEntity> list(boolean includeInactive) {
        return includeInactive
                ? liabilityRepository.findAllByOrderByCreatedAtAsc()
                : liabilityRepository.findByActiveTrueOrderByCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public List<LiabilityPaymentEntity> payments(UUID liabilityId) {
        get(liabilityId);
        return paymentRepository.findByLiabilityIdOrderByPaymentDateDescCreatedAtDesc(liabilityId);
    }

    @Transactional(readOnly = true)
    public BigDecimal totalOutstanding() {
        return MoneyMath.amount(liabilityRepository.sumActiveOutstandingPrincipal());
    }
}
