package com.flagship.wealth_ledger.api;

import com.flagship.wealth_ledger.api.dto.CreateTransferRequest;
import com.flagship.wealth_ledger.api.dto.TransferResponse;
import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.NotFoundException;
import com.flagship.wealth_ledger.orchestrator.TransactionOrchestrator;
import com.flagship.wealth_ledger.transfer.TransferEntity;
import com.flagship.wealth_ledger.transfer.TransferRepository;
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
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/transfers")
@RequiredArgsConstructor
@Slf4j
public class TransferController {

    private final TransactionOrchestrator orchestrator;
    private final TransferRepository transferRepository;

    @PostMapping
    public ResponseEntity<TransferResponse> createTransfer(@Valid @RequestBody CreateTransferRequest request) {
        log.info("Received transfer request: from={}, to={}, amount={}",
                request.getFromAccountId(), request.getToAccountId(), request.getAmount());
        TransferEntity transfer = orchestrator.createTransfer(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferResponse.from(transfer));
    }

    @GetMapping
    public List<TransferResponse> listTransfers() {
        return transferRepository.findAllByOrderByTransferDateDescCreatedAtDesc().stream()
                .map(TransferResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public TransferResponse getTransfer(@PathVariable("id") UUID id) {
        return transferRepository.findById(id)
                .map(TransferResponse::from)
                .orElseThrow(() -> NotFoundException.of(LedgerErrorCode.TRANSFER_NOT_FOUND, "Transfer", id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTransfer(@PathVariable("id") UUID id) {
        orchestrator.deleteTransfer(id);
        return ResponseEntity.noContent().build();
    }
}
