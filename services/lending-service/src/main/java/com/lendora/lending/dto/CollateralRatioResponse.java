package com.lendora.lending.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Health of the position securing a loan. {@code ratioBps} is {@link Integer#MAX_VALUE} when
 * nothing is owed against the position.
 */
@Value
@Builder
public class CollateralRatioResponse {
    Long loanId;
    String borrowerId;
    String assetId;
    BigDecimal collateralAmount;
    BigDecimal securedPrincipal;
    BigDecimal price;
    Instant priceObservedAt;
    int ratioBps;
    int liquidationThresholdBps;
    boolean liquidatable;
}
