package com.flagship.wealth_ledger.holding;

import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.StateConflictException;
import com.flagship.wealth_ledger.money.MoneyMath;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Quantity and average cost of a holding at one point in its trade history.
 *
 * Buys re-weight the average cost, fees included:
 * {@code (q0 * avg0 + q * price + fees) / (q0 + q)}.
 * Sells reduce quantity and leave the average cost unchanged.
 * Dividends and interest leave both unchanged.
 */
@Value
public class Position {

    public static final Position EMPTY = new Position(MoneyMath.ZERO_QUANTITY, MoneyMath.ZERO_QUANTITY);

    BigDecimal quantity;
    BigDecimal averageCost;

    public static Position of(BigDecimal quantity, BigDecimal averageCost) {
        return new Position(MoneyMath.quantity(quantity), MoneyMath.price(averageCost));
    }

    public Position apply(TradeKind kind, BigDecimal tradeQuantity, BigDecimal price, BigDecimal fees) {
        switch (kind) {
            case BUY:
                return buy(tradeQuantity, price, fees);
            case SELL:
                return sell(tradeQuantity);
            default:
                return this;
        }
    }

    private Position buy(BigDecimal tradeQuantity, BigDecimal price, BigDecimal fees) {
        BigDecimal newQuantity = quantity.add(tradeQuantity);
        BigDecimal cost = quantity.multiply(averageCost)
                .add(tradeQuantity.multiply(price))
                .add(fees != null ? fees : BigDecimal.ZERO);
        return Position.of(newQuantity, MoneyMath.divide(cost, newQuantity));
    }

    private Position sell(BigDecimal tradeQuantity) {
        if (tradeQuantity.compareTo(quantity) > 0) {
            throw new StateConflictException(LedgerErrorCode.INSUFFICIENT_HOLDING_QUANTITY,
                    String.format("Cannot sell %s units, only %s held", tradeQuantity, quantity));
        }
        return Position.of(quantity.subtract(tradeQuantity), averageCost);
    }
}
