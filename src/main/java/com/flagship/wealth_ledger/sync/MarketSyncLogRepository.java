package com.flagship.wealth_ledger.sync;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MarketSyncLogRepository extends JpaRepository<MarketSyncLogEntity, UUID> {

    Optional<MarketSyncLogEntity> findFirstByOrderBySyncedAtDesc();

    List<MarketSyncLogEntity> findAllByOrderBySyncedAtDesc(Pageable pageable);
}
