package com.lendora.lending.domain;

public enum LoanActivityType {
    ORIGINATED,
    REPAYMENT,
    LIQUIDATED,
    DEFAULTED
}
