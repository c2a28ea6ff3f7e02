package com.lendora.lending.service;

import com.lendora.lending.util.BasisPoints;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time view of a collateral position against the principal it secures.
 */
@Value
@Builder
public class CollateralSnapshot {
    String borrowerId;
    String assetId;
    BigDecimal collateralAmount;
    BigDecimal price;
    Instant priceObservedAt;
    BigDecimal securedPrincipal;

    public int getRatioBps() {
        return BasisPoints.collateralRatio(collateralAmount, price, securedPrincipal);
    }

    /**
     * Whether a later snapshot saw a different collateral amount or price.
     */
    public boolean differsFrom(CollateralSnapshot other) {
        return collateralAmount.compareTo(other.collateralAmount) != 0
                || price.compareTo(other.price) != 0;
    }
}
