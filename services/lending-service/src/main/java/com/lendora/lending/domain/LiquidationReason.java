package com.lendora.lending.domain;

public enum LiquidationReason {
    /** Collateral ratio fell under the liquidation threshold. */
    HEALTH_BREACH,
    /** Term elapsed with a balance outstanding. */
    TERM_EXPIRY
}
