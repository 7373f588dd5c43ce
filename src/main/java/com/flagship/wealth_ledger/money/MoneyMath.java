package com.flagship.wealth_ledger.money;

import com.flagship.wealth_ledger.error.LedgerErrorCode;
import com.flagship.wealth_ledger.error.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point arithmetic for every amount that enters the ledger.
 *
 * Cash amounts (balances, fees, budget figures, journal deltas) are held at
 * {@link #AMOUNT_SCALE} fractional digits; prices, quantities and average costs
 * at {@link #PRICE_SCALE}. Every rescale and every division uses
 * {@link #ROUNDING}, so the same inputs always produce the same decimal.
 *
 * Values from outside the ledger (request bodies, the price oracle) must pass
 * through {@link #amount(BigDecimal)}, {@link #price(BigDecimal)} or
 * {@link #quantity(BigDecimal)} before they are stored.
 */
public final class MoneyMath {

    public static final int AMOUNT_SCALE = 4;
    public static final int PRICE_SCALE = 8;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public static final BigDecimal ZERO_AMOUNT = BigDecimal.ZERO.setScale(AMOUNT_SCALE, ROUNDING);
    public static final BigDecimal ZERO_QUANTITY = BigDecimal.ZERO.setScale(PRICE_SCALE, ROUNDING);

    private MoneyMath() {
        // Utility class
    }

    /**
     * Canonicalizes a cash amount. {@code null} is treated as zero.
     */
    public static BigDecimal amount(BigDecimal value) {
        if (value == null) {
            return ZERO_AMOUNT;
        }
        return value.setScale(AMOUNT_SCALE, ROUNDING);
    }

    public static BigDecimal amount(String value) {
        return amount(new BigDecimal(value));
    }

    public static BigDecimal price(BigDecimal value) {
        if (value == null) {
            return ZERO_QUANTITY;
        }
        return value.setScale(PRICE_SCALE, ROUNDING);
    }

    public static BigDecimal quantity(BigDecimal value) {
        return price(value);
    }

    /**
     * Canonicalizes a price coming from an external source. Binary floating
     * point is converted through its decimal string form, never through
     * {@code new BigDecimal(double)}.
     */
    public static BigDecimal fromExternal(Number value) {
        if (value == null) {
            throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT, "Price is required");
        }
        if (value instanceof BigDecimal decimal) {
            return price(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT, "Price is not a finite number: " + value);
            }
            return price(new BigDecimal(Double.toString(d)));
        }
        return price(new BigDecimal(value.toString()));
    }

    /**
     * quantity × price, rounded to a cash amount.
     */
    public static BigDecimal valueOf(BigDecimal quantity, BigDecimal price) {
        if (quantity == null || price == null) {
            return ZERO_AMOUNT;
        }
        return amount(quantity.multiply(price));
    }

    /**
     * Division at price scale, used for average cost.
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, PRICE_SCALE, ROUNDING);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }

    /**
     * Returns the canonical amount, rejecting null, zero and negative values
     * with {@code INVALID_AMOUNT}.
     */
    public static BigDecimal requirePositive(BigDecimal value, String field) {
        if (!isPositive(value)) {
            throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT,
                    String.format("%s must be positive, got %s", field, value));
        }
        BigDecimal canonical = amount(value);
        if (canonical.signum() == 0) {
            throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT,
                    String.format("%s is below the smallest representable amount: %s", field, value));
        }
        return canonical;
    }

    public static BigDecimal requireNonNegative(BigDecimal value, String field) {
        if (value == null) {
            return ZERO_AMOUNT;
        }
        if (value.signum() < 0) {
            throw new ValidationException(LedgerErrorCode.INVALID_AMOUNT,
                    String.format("%s must not be negative, got %s", field, value));
        }
        return amount(value);
    }
}
