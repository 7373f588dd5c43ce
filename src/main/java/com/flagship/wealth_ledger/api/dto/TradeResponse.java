package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.holding.AssetKind;
import com.flagship.wealth_ledger.holding.InvestmentTransactionEntity;
import com.flagship.wealth_ledger.holding.TradeKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class TradeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("holding_id")
    UUID holdingId;

    @JsonProperty("kind")
    TradeKind kind;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("symbol_name")
    String symbolName;

    @JsonProperty("asset_kind")
    AssetKind assetKind;

    @JsonProperty("market")
    String market;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("fees")
    BigDecimal fees;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("trade_date")
    LocalDate tradeDate;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TradeResponse from(InvestmentTransactionEntity trade) {
        return TradeResponse.builder()
            .id(trade.getId())
            .accountId(trade.getAccountId())
            .holdingId(trade.getHoldingId())
            .kind(trade.getKind())
            .symbol(trade.getSymbol())
            .symbolName(trade.getSymbolName())
            .assetKind(trade.getAssetKind())
            .market(trade.getMarket())
            .quantity(trade.getQuantity())
            .price(trade.getPrice())
            .fees(trade.getFees())
            .amount(trade.getAmount())
            .tradeDate(trade.getTradeDate())
            .currency(trade.getCurrency())
            .notes(trade.getNotes())
            .createdAt(trade.getCreatedAt())
            .build();
    }
}
