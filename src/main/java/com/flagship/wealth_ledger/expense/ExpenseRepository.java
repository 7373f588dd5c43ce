package com.flagship.wealth_ledger.expense;

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
public interface ExpenseRepository extends JpaRepository<ExpenseEntity, UUID> {

    /**
     * Locks the expense row so that two concurrent deletions cannot both
     * reverse it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM ExpenseEntity e WHERE e.id = :id")
    Optional<ExpenseEntity> findByIdForUpdate(@Param("id") UUID id);

    List<ExpenseEntity> findByAccountIdOrderByExpenseDateDescCreatedAtDesc(UUID accountId);

    List<ExpenseEntity> findByBudgetIdOrderByExpenseDateDescCreatedAtDesc(UUID budgetId);

    List<ExpenseEntity> findAllByOrderByExpenseDateDescCreatedAtDesc();
}
