package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wealth_ledger.sync.ManualQuoteOracle;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class QuoteResponse {

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("quoted_at")
    Instant quotedAt;

    public static QuoteResponse from(ManualQuoteOracle.Quote quote) {
        return QuoteResponse.builder()
            .symbol(quote.getSymbol())
            .price(quote.getPrice())
            .quotedAt(quote.getQuotedAt())
            .build();
    }
}
