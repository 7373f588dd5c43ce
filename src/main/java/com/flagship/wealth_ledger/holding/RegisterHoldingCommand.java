package com.flagship.wealth_ledger.holding;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Opening position brought into the ledger without cash movement.
 */
@Value
@Builder
public class RegisterHoldingCommand {
    UUID accountId;
    String symbol;
    String name;
    AssetKind assetKind;
    String market;
    BigDecimal quantity;
    BigDecimal averageCost;
    BigDecimal currentPrice;
    boolean liquid;
    String currency;
}
