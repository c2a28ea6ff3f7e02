package com.lendora.lending.dto;

import com.lendora.lending.domain.Loan;
import com.lendora.lending.domain.LoanStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class LoanResponse {
    Long id;
    String loanNumber;
    String borrowerId;
    String lenderId;
    BigDecimal principal;
    int interestRateBps;
    int termMonths;
    BigDecimal totalInterest;
    BigDecimal outstandingPrincipal;
    BigDecimal outstandingInterest;
    BigDecimal outstandingBalance;
    String collateralAsset;
    BigDecimal collateralAmount;
    int originationRatioBps;
    boolean creditEligible;
    long parameterVersion;
    LoanStatus status;
    Instant originatedAt;
    Instant maturityAt;
    Instant closedAt;

    public static LoanResponse from(Loan loan) {
        return LoanResponse.builder()
                .id(loan.getId())
                .loanNumber(loan.getLoanNumber())
                .borrowerId(loan.getBorrowerId())
                .lenderId(loan.getLenderId())
                .principal(loan.getPrincipal())
                .interestRateBps(loan.getInterestRateBps())
                .termMonths(loan.getTermMonths())
                .totalInterest(loan.getTotalInterest())
                .outstandingPrincipal(loan.getOutstandingPrincipal())
                .outstandingInterest(loan.getOutstandingInterest())
                .outstandingBalance(loan.getOutstandingBalance())
                .collateralAsset(loan.getCollateralAsset())
                .collateralAmount(loan.getCollateralAmount())
                .originationRatioBps(loan.getOriginationRatioBps())
                .creditEligible(Boolean.TRUE.equals(loan.getCreditEligible()))
                .parameterVersion(loan.getParameterVersion())
                .status(loan.getStatus())
                .originatedAt(loan.getOriginatedAt())
                .maturityAt(loan.getMaturityAt())
                .closedAt(loan.getClosedAt())
                .build();
    }
}
