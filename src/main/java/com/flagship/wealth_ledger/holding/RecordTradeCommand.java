package com.flagship.wealth_ledger.holding;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Intent to record a buy, sell, dividend or interest receipt.
 *
 * For dividends and interest {@code amount} is the gross cash received; when
 * absent it is {@code quantity × price}.
 */
@Value
@Builder
public class RecordTradeCommand {
    UUID accountId;
    String symbol;
    String symbolName;
    AssetKind assetKind;
    String market;
    TradeKind kind;
    BigDecimal quantity;
    BigDecimal price;
    BigDecimal fees;
    BigDecimal amount;
    boolean liquid;
    LocalDate tradeDate;
    String currency;
    String notes;
}
