package com.lendora.lending.util;

import com.lendora.lending.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point arithmetic shared by the rate model, the ledger and the liquidation engine.
 *
 * Amounts are whole numbers of the smallest currency unit (scale 0). Every division truncates
 * toward zero unless the method name says otherwise.
 */
public final class BasisPoints {

    public static final int DENOMINATOR = 10_000;
    public static final BigDecimal DENOMINATOR_DECIMAL = BigDecimal.valueOf(DENOMINATOR);

    /**
     * Ratio reported when nothing is owed against the collateral.
     */
    public static final int UNBOUNDED_RATIO = Integer.MAX_VALUE;

    private BasisPoints() {
    }

    /**
     * Validates a strictly positive whole amount and returns it at scale 0.
     */
    public static BigDecimal requirePositiveWholeAmount(BigDecimal amount, String field) {
        if (amount == null) {
            throw new InvalidAmountException(field + " is required");
        }
        if (amount.signum() <= 0) {
            throw new InvalidAmountException(field + " must be greater than zero, was " + amount.toPlainString());
        }
        try {
            return amount.setScale(0, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(field + " must be a whole number of smallest units, was " + amount.toPlainString());
        }
    }

    /**
     * {@code floor(collateralAmount * price * 10000 / outstandingPrincipal)}, saturating at
     * {@link #UNBOUNDED_RATIO}.
     */
    public static int collateralRatio(BigDecimal collateralAmount, BigDecimal price, BigDecimal outstandingPrincipal) {
        if (outstandingPrincipal == null || outstandingPrincipal.signum() <= 0) {
            return UNBOUNDED_RATIO;
        }
        BigDecimal ratio = collateralAmount.multiply(price)
                .multiply(DENOMINATOR_DECIMAL)
                .divide(outstandingPrincipal, 0, RoundingMode.DOWN);
        if (ratio.compareTo(BigDecimal.valueOf(UNBOUNDED_RATIO)) >= 0) {
            return UNBOUNDED_RATIO;
        }
        return ratio.intValueExact();
    }

    /**
     * {@code floor(amount * bps / 10000)}.
     */
    public static BigDecimal portion(BigDecimal amount, int bps) {
        return amount.multiply(BigDecimal.valueOf(bps)).divide(DENOMINATOR_DECIMAL, 0, RoundingMode.DOWN);
    }

    public static BigDecimal ceilDivide(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, 0, RoundingMode.CEILING);
    }

    public static BigDecimal floorDivide(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, 0, RoundingMode.DOWN);
    }
}
