package com.lendora.lending.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Loan lifecycle: PENDING -> ACTIVE -> exactly one of REPAID, DEFAULTED, LIQUIDATED.
 */
public enum LoanStatus {
    PENDING,
    ACTIVE,
    REPAID,
    DEFAULTED,
    LIQUIDATED;

    public boolean isTerminal() {
        return this == REPAID || this == DEFAULTED || this == LIQUIDATED;
    }

    public Set<LoanStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(ACTIVE);
            case ACTIVE -> EnumSet.of(REPAID, DEFAULTED, LIQUIDATED);
            case REPAID, DEFAULTED, LIQUIDATED -> EnumSet.noneOf(LoanStatus.class);
        };
    }

    public boolean canTransitionTo(LoanStatus target) {
        return allowedTransitions().contains(target);
    }
}
