package com.lendora.lending.rate;

import com.lendora.lending.domain.ProtocolParameters;
import com.lendora.lending.exception.ValidationException;
import com.lendora.lending.service.ProtocolParameterService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Tiered interest rate model.
 *
 * <pre>
 * ratio >= 20000          base - 50
 * 15000 <= ratio < 20000  base
 * 12000 <= ratio < 15000  base + 100
 * ratio < 12000           base + 200
 * not credit eligible     + 150
 * </pre>
 *
 * The result is clamped to [{@value #MIN_RATE_BPS}, {@value #MAX_RATE_BPS}]. Both functions
 * are deterministic: identical inputs (and parameter version) give identical outputs.
 */
@Component
@RequiredArgsConstructor
public class InterestRateModel {

    public static final int MIN_RATE_BPS = 100;
    public static final int MAX_RATE_BPS = 5000;

    public static final int PRIME_RATIO_BPS = 20000;
    public static final int STANDARD_RATIO_BPS = 15000;
    public static final int ELEVATED_RATIO_BPS = 12000;

    static final int PRIME_DISCOUNT_BPS = 50;
    static final int ELEVATED_PREMIUM_BPS = 100;
    static final int HIGH_RISK_PREMIUM_BPS = 200;
    static final int NO_CREDIT_PREMIUM_BPS = 150;

    private static final BigDecimal INTEREST_DENOMINATOR = BigDecimal.valueOf(10_000L * 12L);

    private final ProtocolParameterService parameterService;

    /**
     * Rate for the current parameter version.
     */
    public int computeRate(int collateralRatioBps, boolean creditEligible) {
        return computeRate(parameterService.current(), collateralRatioBps, creditEligible);
    }

    public int computeRate(ProtocolParameters parameters, int collateralRatioBps, boolean creditEligible) {
        return computeRate(parameters.getBaseRateBps(), collateralRatioBps, creditEligible);
    }

    public static int computeRate(int baseRateBps, int collateralRatioBps, boolean creditEligible) {
        if (collateralRatioBps < 0) {
            throw new ValidationException("Collateral ratio must not be negative, was " + collateralRatioBps);
        }

        int rate;
        if (collateralRatioBps >= PRIME_RATIO_BPS) {
            rate = baseRateBps > PRIME_DISCOUNT_BPS ? baseRateBps - PRIME_DISCOUNT_BPS : baseRateBps;
        } else if (collateralRatioBps >= STANDARD_RATIO_BPS) {
            rate = baseRateBps;
        } else if (collateralRatioBps >= ELEVATED_RATIO_BPS) {
            rate = baseRateBps + ELEVATED_PREMIUM_BPS;
        } else {
            rate = baseRateBps + HIGH_RISK_PREMIUM_BPS;
        }

        if (!creditEligible) {
            rate += NO_CREDIT_PREMIUM_BPS;
        }

        return Math.max(MIN_RATE_BPS, Math.min(MAX_RATE_BPS, rate));
    }

    /**
     * Simple interest {@code principal * rate * termMonths / (10000 * 12)}, truncated toward zero.
     */
    public static BigDecimal computeTotalInterest(BigDecimal principal, int rateBps, int termMonths) {
        if (principal == null || principal.signum() < 0) {
            throw new ValidationException("Principal must not be negative");
        }
        if (rateBps < 0 || termMonths < 0) {
            throw new ValidationException("Rate and term must not be negative");
        }
        return principal.multiply(BigDecimal.valueOf(rateBps))
                .multiply(BigDecimal.valueOf(termMonths))
                .divide(INTEREST_DENOMINATOR, 0, RoundingMode.DOWN);
    }
}
