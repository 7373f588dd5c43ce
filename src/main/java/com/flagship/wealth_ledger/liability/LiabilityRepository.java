package com.flagship.wealth_ledger.liability;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LiabilityRepository extends JpaRepository<LiabilityEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LiabilityEntity l WHERE l.id = :id")
    Optional<LiabilityEntity> findByIdForUpdate(@Param("id") UUID id);

    List<LiabilityEntity> findByActiveTrueOrderByCreatedAtAsc();

    List<LiabilityEntity> findAllByOrderByCreatedAtAsc();

    @Query("SELECT COALESCE(SUM(l.outstandingPrincipal), 0) FROM LiabilityEntity l WHERE l.active = true")
    BigDecimal sumActiveOutstandingPrincipal();
}
