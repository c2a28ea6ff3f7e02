package com.lendora.lending.service;

import com.lendora.lending.domain.LiquidationReason;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a liquidation evaluation. Amounts are in collateral units except
 * {@code debt} and {@code debtCovered}, which are in principal units.
 */
@Value
@Builder
public class LiquidationDecision {

    public enum Outcome {
        NONE,
        ELIGIBLE
    }

    Outcome outcome;
    LiquidationReason reason;
    int ratioBps;
    int thresholdBps;
    int bonusBps;
    long parameterVersion;
    BigDecimal price;
    BigDecimal debt;
    BigDecimal collateralAmount;
    BigDecimal seizeAmount;
    BigDecimal bonusAmount;
    BigDecimal lenderProceeds;
    BigDecimal borrowerRemainder;
    BigDecimal debtCovered;

    public static LiquidationDecision none(int ratioBps, int thresholdBps, BigDecimal price, BigDecimal collateralAmount) {
        return LiquidationDecision.builder()
                .outcome(Outcome.NONE)
                .ratioBps(ratioBps)
                .thresholdBps(thresholdBps)
                .price(price)
                .collateralAmount(collateralAmount)
                .debt(BigDecimal.ZERO)
                .seizeAmount(BigDecimal.ZERO)
                .bonusAmount(BigDecimal.ZERO)
                .lenderProceeds(BigDecimal.ZERO)
                .borrowerRemainder(BigDecimal.ZERO)
                .debtCovered(BigDecimal.ZERO)
                .build();
    }

    public boolean isEligible() {
        return outcome == Outcome.ELIGIBLE;
    }
}
