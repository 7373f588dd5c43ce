package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.holding.AssetKind;
import com.flagship.wealth_ledger.holding.RegisterHoldingCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterHoldingRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    private UUID accountId;

    @NotBlank(message = "Symbol is required")
    @JsonProperty("symbol")
    private String symbol;

    @JsonProperty("name")
    private String name;

    @NotNull(message = "Asset kind is required")
    @JsonProperty("asset_kind")
    private AssetKind assetKind;

    @JsonProperty("market")
    private String market;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", message = "Quantity must not be negative")
    @JsonProperty("quantity")
    private BigDecimal quantity;

    @NotNull(message = "Average cost is required")
    @DecimalMin(value = "0", message = "Average cost must not be negative")
    @JsonProperty("average_cost")
    private BigDecimal averageCost;

    @DecimalMin(value = "0", message = "Current price must not be negative")
    @JsonProperty("current_price")
    private BigDecimal currentPrice;

    @JsonProperty("liquid")
    private boolean liquid;

    @JsonProperty("currency")
    private String currency;

    public RegisterHoldingCommand toCommand() {
        return RegisterHoldingCommand.builder()
            .accountId(accountId)
            .symbol(symbol)
            .name(name)
            .assetKind(assetKind)
            .market(market)
            .quantity(quantity)
            .averageCost(averageCost)
            .currentPrice(currentPrice)
            .liquid(liquid)
            .currency(currency)
            .build();
    }
}
