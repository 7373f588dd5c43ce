package com.flagship.wealth_ledger.holding;

import com.flagship.wealth_ledger.money.MoneyMath;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Generated;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One trade, dividend or interest receipt.
 *
 * Besides the trade itself the row stores the holding position immediately
 * before the trade was applied. Deleting a trade replays the holding's later
 * trades from that snapshot, which restores the average cost exactly even
 * when the deleted trade is not the most recent one.
 */
@Entity
@Table(
    name = "investment_transactions",
    indexes = {
        @Index(name = "idx_investment_tx_account", columnList = "account_id"),
        @Index(name = "idx_investment_tx_holding", columnList = "holding_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InvestmentTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    /**
     * Insertion order, assigned by the database.
     */
    @Generated
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "holding_id", updatable = false)
    private UUID holdingId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private TradeKind kind;

    @Column(nullable = false, updatable = false, length = 32)
    private String symbol;

    @Column(name = "symbol_name", updatable = false)
    private String symbolName;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_kind", nullable = false, updatable = false, length = 20)
    private AssetKind assetKind;

    @Column(nullable = false, updatable = false, length = 20)
    private String market;

    @Column(nullable = false, updatable = false, precision = 20, scale = 8)
    private BigDecimal quantity;

    @Column(nullable = false, updatable = false, precision = 20, scale = 8)
    private BigDecimal price;

    @Column(nullable = false, updatable = false, precision = 20, scale = 4)
    private BigDecimal fees;

    /**
     * Signed cash effect on the account: negative for buys, positive for
     * sells, dividends and interest.
     */
    @Column(nullable = false, updatable = false, precision = 20, scale = 4)
    private BigDecimal amount;

    @Column(name = "prior_quantity", nullable = false, precision = 20, scale = 8)
    private BigDecimal priorQuantity;

    @Column(name = "prior_average_cost", nullable = false, precision = 20, scale = 8)
    private BigDecimal priorAverageCost;

    /**
     * True when this trade opened the holding.
     */
    @Column(name = "holding_created", nullable = false)
    private boolean holdingCreated;

    @Column(name = "trade_date", nullable = false, updatable = false)
    private LocalDate tradeDate;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(updatable = false)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static InvestmentTransactionEntity record(UUID accountId, HoldingEntity holding, TradeKind kind,
                                              String symbol, String symbolName, AssetKind assetKind,
                                              String market, BigDecimal quantity, BigDecimal price,
                                              BigDecimal fees, BigDecimal amount, Position prior,
                                              boolean holdingCreated, LocalDate tradeDate,
                                              String currency, String notes) {
        InvestmentTransactionEntity entity = new InvestmentTransactionEntity();
        entity.id = UUID.randomUUID();
        entity.accountId = accountId;
        entity.holdingId = holding != null ? holding.getId() : null;
        entity.kind = kind;
        entity.symbol = symbol;
        entity.symbolName = symbolName;
        entity.assetKind = assetKind;
        entity.market = market;
        entity.quantity = MoneyMath.quantity(quantity);
        entity.price = MoneyMath.price(price);
        entity.fees = MoneyMath.amount(fees);
        entity.amount = MoneyMath.amount(amount);
        entity.priorQuantity = prior.getQuantity();
        entity.priorAverageCost = prior.getAverageCost();
        entity.holdingCreated = holdingCreated;
        entity.tradeDate = tradeDate;
        entity.currency = currency;
        entity.notes = notes;
        return entity;
    }

    public Position priorPosition() {
        return Position.of(priorQuantity, priorAverageCost);
    }

    /**
     * Rewrites the snapshot while the holding's history is replayed after an
     * earlier trade was deleted.
     */
    void rebase(Position prior, boolean holdingCreated) {
        this.priorQuantity = prior.getQuantity();
        this.priorAverageCost = prior.getAverageCost();
        this.holdingCreated = holdingCreated;
    }
}
