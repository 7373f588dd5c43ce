package com.flagship.wealth_ledger.transfer;

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
public interface TransferRepository extends JpaRepository<TransferEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TransferEntity t WHERE t.id = :id")
    Optional<TransferEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT t FROM TransferEntity t WHERE t.fromAccountId = :accountId OR t.toAccountId = :accountId " +
           "ORDER BY t.transferDate DESC, t.createdAt DESC")
    List<TransferEntity> findByAccount(@Param("accountId") UUID accountId);

    List<TransferEntity> findAllByOrderByTransferDateDescCreatedAtDesc();
}
