package com.flagship.wealth_ledger.sync;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Source of current market prices, passed explicitly into each sync run.
 *
 * An empty result or an exception is a per-symbol failure: the sync records
 * it and moves on to the next symbol.
 */
@FunctionalInterface
public interface PriceOracle {

    Optional<BigDecimal> lookup(String symbol);
}
