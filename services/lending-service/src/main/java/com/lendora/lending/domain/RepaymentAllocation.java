package com.lendora.lending.domain;

import lombok.Value;

import java.math.BigDecimal;

/**
 * How a repayment was split between scheduled interest and principal.
 */
@Value
public class RepaymentAllocation {
    BigDecimal interestPaid;
    BigDecimal principalPaid;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;

    public boolean isSettled() {
        return balanceAfter.signum() == 0;
    }
}
