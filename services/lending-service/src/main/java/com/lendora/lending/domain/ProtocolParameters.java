package com.lendora.lending.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of the protocol parameters at one version. Readers take a snapshot once
 * per operation so a concurrent administrative change never mixes two versions.
 */
@Value
@Builder(toBuilder = true)
public class ProtocolParameters {
    long version;
    int baseRateBps;
    int riskPremiumMultiplier;
    int minCollateralRatioBps;
    int liquidationThresholdBps;
    int liquidationBonusBps;

    public int valueOf(ProtocolParameter parameter) {
        return switch (parameter) {
            case BASE_RATE -> baseRateBps;
            case RISK_PREMIUM_MULTIPLIER -> riskPremiumMultiplier;
            case MIN_COLLATERAL_RATIO -> minCollateralRatioBps;
            case LIQUIDATION_THRESHOLD -> liquidationThresholdBps;
            case LIQUIDATION_BONUS -> liquidationBonusBps;
        };
    }

    public ProtocolParameters with(ProtocolParameter parameter, int value) {
        ProtocolParametersBuilder builder = toBuilder();
        switch (parameter) {
            case BASE_RATE -> builder.baseRateBps(value);
            case RISK_PREMIUM_MULTIPLIER -> builder.riskPremiumMultiplier(value);
            case MIN_COLLATERAL_RATIO -> builder.minCollateralRatioBps(value);
            case LIQUIDATION_THRESHOLD -> builder.liquidationThresholdBps(value);
            case LIQUIDATION_BONUS -> builder.liquidationBonusBps(value);
        }
        return builder.build();
    }
}
