package com.flagship.wealth_ledger.account;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Values derived from an account's balance and its active holdings.
 *
 * totalValue      = balance + market value of all active holdings
 * availableCash   = balance + market value of active liquid holdings
 * investmentValue = market value of active non-liquid holdings
 */
@Value
public class ProjectedValues {
    BigDecimal totalValue;
    BigDecimal availableCash;
    BigDecimal investmentValue;
}
