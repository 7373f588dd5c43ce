package com.flagship.wealth_ledger.holding;

import com.flagship.wealth_ledger.money.MoneyMath;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A position inside an investment account.
 *
 * Quantity and average cost change only through trades (or trade reversal);
 * current price and value change only through trades and the market sync.
 * Both paths lock the row first.
 */
@Entity
@Table(
    name = "holdings",
    indexes = {
        @Index(name = "idx_holdings_account", columnList = "account_id"),
        @Index(name = "idx_holdings_symbol", columnList = "symbol")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class HoldingEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(nullable = false, updatable = false, length = 32)
    private String symbol;

    @Column
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_kind", nullable = false, updatable = false, length = 20)
    private AssetKind assetKind;

    @Column(nullable = false, updatable = false, length = 20)
    private String market;

    @Column(nullable = false, precision = 20, scale = 8)
    private BigDecimal quantity;

    @Column(name = "average_cost", nullable = false, precision = 20, scale = 8)
    private BigDecimal averageCost;

    @Column(name = "current_price", nullable = false, precision = 20, scale = 8)
    private BigDecimal currentPrice;

    @Column(name = "current_value", nullable = false, precision = 20, scale = 4)
    private BigDecimal currentValue;

    @Column(name = "last_sync_at")
    private Instant lastSyncAt;

    @Column(nullable = false)
    private boolean liquid;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Creates an active holding. A missing current price falls back to the
     * average cost so that the holding has a defined market value.
     */
    static HoldingEntity open(UUID accountId, String symbol, String name, AssetKind assetKind, String market,
                              String currency, boolean liquid, Position position, BigDecimal currentPrice) {
        HoldingEntity entity = new HoldingEntity();
        entity.id = UUID.randomUUID();
        entity.accountId = accountId;
        entity.symbol = symbol;
        entity.name = name;
        entity.assetKind = assetKind;
        entity.market = market;
        entity.currency = currency;
        entity.liquid = liquid;
        entity.active = true;
        entity.quantity = position.getQuantity();
        entity.averageCost = position.getAverageCost();
        entity.currentPrice = currentPrice != null ? MoneyMath.price(currentPrice) : position.getAverageCost();
        entity.recomputeValue();
        return entity;
    }

    public Position position() {
        return Position.of(quantity, averageCost);
    }

    /**
     * Moves the holding to {@code position}. When the holding has never been
     * priced, the trade price becomes its current price.
     */
    void moveTo(Position position, BigDecimal tradePrice) {
        this.quantity = position.getQuantity();
        this.averageCost = position.getAverageCost();
        if (currentPrice.signum() == 0 && tradePrice != null && tradePrice.signum() > 0) {
            this.currentPrice = MoneyMath.price(tradePrice);
        }
        recomputeValue();
    }

    void updatePrice(BigDecimal price, Instant syncedAt) {
        this.currentPrice = MoneyMath.price(price);
        this.lastSyncAt = syncedAt;
        recomputeValue();
    }

    void deactivate() {
        this.active = false;
    }

    /**
     * quantity × average cost.
     */
    public BigDecimal totalCost() {
        return MoneyMath.valueOf(quantity, averageCost);
    }

    public BigDecimal unrealizedProfitLoss() {
        return MoneyMath.amount(currentValue.subtract(totalCost()));
    }

    private void recomputeValue() {
        this.currentValue = MoneyMath.valueOf(quantity, currentPrice);
    }
}
