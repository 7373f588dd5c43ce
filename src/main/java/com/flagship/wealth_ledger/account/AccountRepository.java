package com.flagship.wealth_ledger.account;

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
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    /**
     * Loads the account with {@code SELECT ... FOR UPDATE}. Every balance
     * mutation goes through this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AccountEntity a WHERE a.id = :id")
    Optional<AccountEntity> findByIdForUpdate(@Param("id") UUID id);

    List<AccountEntity> findByActiveTrueOrderByCreatedAtAsc();

    List<AccountEntity> findAllByOrderByCreatedAtAsc();

    List<AccountEntity> findByKindAndActiveTrue(AccountKind kind);
}
