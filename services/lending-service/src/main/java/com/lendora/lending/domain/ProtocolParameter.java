package com.lendora.lending.domain;

/**
 * Administrable protocol parameters with their accepted ranges (inclusive).
 */
public enum ProtocolParameter {
    BASE_RATE(100, 5000),
    RISK_PREMIUM_MULTIPLIER(0, 10000),
    MIN_COLLATERAL_RATIO(10000, 100000),
    LIQUIDATION_THRESHOLD(10000, 100000),
    LIQUIDATION_BONUS(0, 5000);

    private final int min;
    private final int max;

    ProtocolParameter(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public boolean accepts(int value) {
        return value >= min && value <= max;
    }
}
