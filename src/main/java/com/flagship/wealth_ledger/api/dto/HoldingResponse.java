package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.holding.AssetKind;
import com.flagship.wealth_ledger.holding.HoldingEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class HoldingResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("name")
    String name;

    @JsonProperty("asset_kind")
    AssetKind assetKind;

    @JsonProperty("market")
    String market;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("average_cost")
    BigDecimal averageCost;

    @JsonProperty("current_price")
    BigDecimal currentPrice;

    @JsonProperty("current_value")
    BigDecimal currentValue;

    @JsonProperty("total_cost")
    BigDecimal totalCost;

    @JsonProperty("unrealized_profit_loss")
    BigDecimal unrealizedProfitLoss;

    @JsonProperty("liquid")
    boolean liquid;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("last_sync_at")
    Instant lastSyncAt;

    public static HoldingResponse from(HoldingEntity holding) {
        return HoldingResponse.builder()
            .id(holding.getId())
            .accountId(holding.getAccountId())
            .symbol(holding.getSymbol())
            .name(holding.getName())
            .assetKind(holding.getAssetKind())
            .market(holding.getMarket())
            .quantity(holding.getQuantity())
            .averageCost(holding.getAverageCost())
            .currentPrice(holding.getCurrentPrice())
            .currentValue(holding.getCurrentValue())
            .totalCost(holding.totalCost())
            .unrealizedProfitLoss(holding.unrealizedProfitLoss())
            .liquid(holding.isLiquid())
            .currency(holding.getCurrency())
            .active(holding.isActive())
            .lastSyncAt(holding.getLastSyncAt())
            .build();
    }
}
