package com.flagship.wealth_ledger.api;

import com.flagship.wealth_ledger.api.dto.CreateLiabilityRequest;
import com.flagship.wealth_ledger.api.dto.LiabilityResponse;
import com.flagship.wealth_ledger.api.dto.PaymentResponse;
import com.flagship.wealth_ledger.api.dto.RecordPaymentRequest;
import com.flagship.wealth_ledger.liability.LiabilityEntity;
import com.flagship.wealth_ledger.liability.LiabilityPaymentEntity;
import com.flagship.wealth_ledger.liability.LiabilityTracker;
import com.flagship.wealth_ledger.orchestrator.TransactionOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/liabilities")
@RequiredArgsConstructor
@Slf4j
public class LiabilityController {

    private final LiabilityTracker liabilityTracker;
    private final TransactionOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<LiabilityResponse> createLiability(@Valid @RequestBody CreateLiabilityRequest request) {
        log.info("Received liability creation request: name={}, kind={}", request.getName(), request.getKind());
        LiabilityEntity liability = liabilityTracker.create(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(LiabilityResponse.from(liability));
    }

    @GetMapping
    public List<LiabilityResponse> listLiabilities(
            @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return liabilityTracker.list(includeInactive).stream()
                .map(LiabilityResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public LiabilityResponse getLiability(@PathVariable("id") UUID id) {
        return LiabilityResponse.from(liabilityTracker.get(id));
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<Void> deactivateLiability(@PathVariable("id") UUID id) {
        liabilityTracker.deactivate(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/payments")
    public List<PaymentResponse> listPayments(@PathVariable("id") UUID id) {
        liabilityTracker.get(id);
        return liabilityTracker.payments(id).stream()
                .map(PaymentResponse::from)
                .toList();
    }

    /**
     * Pays the liability from a cash account. Only the principal part
     * reduces the outstanding principal.
     */
    @PostMapping("/{id}/payments")
    public ResponseEntity<PaymentResponse> recordPayment(@PathVariable("id") UUID id,
                                                         @Valid @RequestBody RecordPaymentRequest request) {
        log.info("Received liability payment: liabilityId={}, sourceAccountId={}, amount={}",
                id, request.getSourceAccountId(), request.getAmount());
        LiabilityPaymentEntity payment = orchestrator.recordPayment(request.toCommand(id));
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    @DeleteMapping("/payments/{paymentId}")
    public ResponseEntity<Void> deletePayment(@PathVariable("paymentId") UUID paymentId) {
        orchestrator.deletePayment(paymentId);
        return ResponseEntity.noContent().build();
    }
}
