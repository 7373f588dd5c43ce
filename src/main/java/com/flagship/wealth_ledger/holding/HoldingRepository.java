package com.flagship.wealth_ledger.holding;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface HoldingRepository extends JpaRepository<HoldingEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM HoldingEntity h WHERE h.id = :id")
    Optional<HoldingEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Locks the active holding for (account, symbol, kind, market), if any.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM HoldingEntity h WHERE h.accountId = :accountId AND h.symbol = :symbol " +
           "AND h.assetKind = :assetKind AND h.market = :market AND h.active = true")
    Optional<HoldingEntity> findActiveForUpdate(@Param("accountId") UUID accountId,
                                                @Param("symbol") String symbol,
                                                @Param("assetKind") AssetKind assetKind,
                                                @Param("market") String market);

    /**
     * Active holdings of an account matching a symbol, oldest first. Used to
     * attach dividends and interest.
     */
    List<HoldingEntity> findByAccountIdAndSymbolAndActiveTrueOrderByCreatedAtAsc(UUID accountId, String symbol);

    List<HoldingEntity> findByAccountIdAndActiveTrue(UUID accountId);

    List<HoldingEntity> findByAccountIdAndActiveTrueAndAssetKindNotIn(UUID accountId, Collection<AssetKind> excluded);

    List<HoldingEntity> findByActiveTrueAndAssetKindNotIn(Collection<AssetKind> excluded);

    List<HoldingEntity> findByAccountIdOrderByCreatedAtAsc(UUID accountId);

    boolean existsByAccountIdAndSymbolAndAssetKindAndMarketAndActiveTrue(UUID accountId, String symbol,
                                                                         AssetKind assetKind, String market);
}
