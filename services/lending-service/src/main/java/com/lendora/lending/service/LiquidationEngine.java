package com.lendora.lending.service;

import com.lendora.lending.domain.LiquidationReason;
import com.lendora.lending.domain.Loan;
import com.lendora.lending.domain.ProtocolParameters;
import com.lendora.lending.util.BasisPoints;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Decides whether a loan can be liquidated and how the seized collateral is split.
 *
 * The engine is pure: it reads the loan and a collateral snapshot handed in by
 * {@link LoanManager} and never writes state or calls back into the manager.
 */
@Component
@RequiredArgsConstructor
public class LiquidationEngine {

    private final ProtocolParameterService parameterService;

    public LiquidationDecision evaluate(Loan loan, CollateralSnapshot snapshot) {
        return evaluate(parameterService.current(), loan, snapshot);
    }

    /**
     * A loan is eligible when its position ratio is strictly below the liquidation threshold.
     *
     * <p>The debt is the loan's outstanding principal plus outstanding interest. The seizure is
     * sized so that what is left after the liquidator's bonus still covers the debt, capped at
     * what the position holds:
     * <pre>
     * required  = ceil(debt * 10000 / ((10000 - bonusBps) * price))
     * seize     = min(collateral, required)
     * bonus     = floor(seize * bonusBps / 10000)
     * proceeds  = seize - bonus
     * remainder = collateral - seize, only once the debt is fully covered
     * </pre>
     */
    public LiquidationDecision evaluate(ProtocolParameters parameters, Loan loan, CollateralSnapshot snapshot) {
        int ratio = snapshot.getRatioBps();
        int threshold = parameters.getLiquidationThresholdBps();
        if (!loan.isActive() || ratio >= threshold) {
            return LiquidationDecision.none(ratio, threshold, snapshot.getPrice(), snapshot.getCollateralAmount());
        }

        int bonusBps = parameters.getLiquidationBonusBps();
        BigDecimal collateral = snapshot.getCollateralAmount();
        BigDecimal price = snapshot.getPrice();
        BigDecimal debt = loan.getOutstandingBalance();

        BigDecimal required = BasisPoints.ceilDivide(
                debt.multiply(BasisPoints.DENOMINATOR_DECIMAL),
                BigDecimal.valueOf(BasisPoints.DENOMINATOR - (long) bonusBps).multiply(price));
        BigDecimal seize = collateral.min(required);
        BigDecimal bonus = BasisPoints.portion(seize, bonusBps);
        BigDecimal proceeds = seize.subtract(bonus);
        BigDecimal debtCovered = valueOf(proceeds, price).min(debt);

        return LiquidationDecision.builder()
                .outcome(LiquidationDecision.Outcome.ELIGIBLE)
                .reason(LiquidationReason.HEALTH_BREACH)
                .ratioBps(ratio)
                .thresholdBps(threshold)
                .bonusBps(bonusBps)
                .parameterVersion(parameters.getVersion())
                .price(price)
                .debt(debt)
                .collateralAmount(collateral)
                .seizeAmount(seize)
                .bonusAmount(bonus)
                .lenderProceeds(proceeds)
                .borrowerRemainder(remainder(collateral, seize, debtCovered, debt))
                .debtCovered(debtCovered)
                .build();
    }

    /**
     * Settlement of a matured loan with a balance left. Collateral covering the debt goes to the
     * lender without a bonus; whatever exceeds it is the borrower's remainder.
     */
    public LiquidationDecision settleDefault(Loan loan, CollateralSnapshot snapshot) {
        return settleDefault(parameterService.current(), loan, snapshot);
    }

    public LiquidationDecision settleDefault(ProtocolParameters parameters, Loan loan, CollateralSnapshot snapshot) {
        BigDecimal collateral = snapshot.getCollateralAmount();
        BigDecimal price = snapshot.getPrice();
        BigDecimal debt = loan.getOutstandingBalance();

        BigDecimal coverage = collateral.min(BasisPoints.ceilDivide(debt, price));
        BigDecimal debtCovered = valueOf(coverage, price).min(debt);

        return LiquidationDecision.builder()
                .outcome(LiquidationDecision.Outcome.ELIGIBLE)
                .reason(LiquidationReason.TERM_EXPIRY)
                .ratioBps(snapshot.getRatioBps())
                .thresholdBps(parameters.getLiquidationThresholdBps())
                .bonusBps(0)
                .parameterVersion(parameters.getVersion())
                .price(price)
                .debt(debt)
                .collateralAmount(collateral)
                .seizeAmount(coverage)
                .bonusAmount(BigDecimal.ZERO)
                .lenderProceeds(coverage)
                .borrowerRemainder(remainder(collateral, coverage, debtCovered, debt))
                .debtCovered(debtCovered)
                .build();
    }

    // A borrower only gets collateral back once the lender is made whole.
    private static BigDecimal remainder(BigDecimal collateral, BigDecimal seized, BigDecimal debtCovered, BigDecimal debt) {
        return debtCovered.compareTo(debt) < 0 ? BigDecimal.ZERO : collateral.subtract(seized);
    }

    private static BigDecimal valueOf(BigDecimal collateral, BigDecimal price) {
        return BasisPoints.floorDivide(collateral.multiply(price), BigDecimal.ONE);
    }
}
