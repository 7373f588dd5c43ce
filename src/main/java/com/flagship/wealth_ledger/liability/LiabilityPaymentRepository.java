package com.flagship.wealth_ledger.liability;

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
public interface LiabilityPaymentRepository extends JpaRepository<LiabilityPaymentEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM LiabilityPaymentEntity p WHERE p.id = :id")
    Optional<LiabilityPaymentEntity> findByIdForUpdate(@Param("id") UUID id);

    List<LiabilityPaymentEntity> findByLiabilityIdOrderByPaymentDateDescCreatedAtDesc(UUID liabilityId);
}
