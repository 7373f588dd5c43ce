package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.holding.AssetKind;
import com.flagship.wealth_ledger.holding.RecordTradeCommand;
import com.flagship.wealth_ledger.holding.TradeKind;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Buy, sell, dividend or interest. Quantity and price are required for buys
 * and sells; income kinds take either an amount or quantity and price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordTradeRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    private UUID accountId;

    @NotBlank(message = "Symbol is required")
    @JsonProperty("symbol")
    private String symbol;

    @JsonProperty("symbol_name")
    private String symbolName;

    @NotNull(message = "Asset kind is required")
    @JsonProperty("asset_kind")
    private AssetKind assetKind;

    @JsonProperty("market")
    private String market;

    @NotNull(message = "Trade kind is required")
    @JsonProperty("kind")
    private TradeKind kind;

    @DecimalMin(value = "0", message = "Quantity must not be negative")
    @JsonProperty("quantity")
    private BigDecimal quantity;

    @DecimalMin(value = "0", message = "Price must not be negative")
    @JsonProperty("price")
    private BigDecimal price;

    @DecimalMin(value = "0", message = "Fees must not be negative")
    @JsonProperty("fees")
    private BigDecimal fees;

    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("liquid")
    private boolean liquid;

    @JsonProperty("trade_date")
    private LocalDate tradeDate;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("notes")
    private String notes;

    public RecordTradeCommand toCommand() {
        return RecordTradeCommand.builder()
            .accountId(accountId)
            .symbol(symbol)
            .symbolName(symbolName)
            .assetKind(assetKind)
            .market(market)
            .kind(kind)
            .quantity(quantity)
            .price(price)
            .fees(fees)
            .amount(amount)
            .liquid(liquid)
            .tradeDate(tradeDate)
            .currency(currency)
            .notes(notes)
            .build();
    }
}
