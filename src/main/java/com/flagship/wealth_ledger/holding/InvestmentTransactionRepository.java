package com.flagship.wealth_ledger.holding;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvestmentTransactionRepository extends JpaRepository<InvestmentTransactionEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM InvestmentTransactionEntity t WHERE t.id = :id")
    Optional<InvestmentTransactionEntity> findByIdForUpdate(@Param("id") UUID id);

    List<InvestmentTransactionEntity> findByHoldingIdOrderBySequenceNumberAsc(UUID holdingId);

    List<InvestmentTransactionEntity> findByAccountIdOrderBySequenceNumberAsc(UUID accountId);
}
