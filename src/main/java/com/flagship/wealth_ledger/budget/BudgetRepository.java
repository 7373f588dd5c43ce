package com.flagship.wealth_ledger.budget;

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
public interface BudgetRepository extends JpaRepository<BudgetEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BudgetEntity b WHERE b.id = :id")
    Optional<BudgetEntity> findByIdForUpdate(@Param("id") UUID id);

    List<BudgetEntity> findByStatusOrderByCreatedAtDesc(BudgetStatus status);

    List<BudgetEntity> findAllByOrderByCreatedAtDesc();
}
