package com.lendora.lending.client;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Price of one smallest unit of collateral, quoted in smallest units of the loan currency.
 */
public record PriceQuote(String assetId, BigDecimal price, Instant observedAt) {

    public boolean isFresh(Instant now, Duration freshness) {
        return !observedAt.plus(freshness).isBefore(now);
    }

    public boolean isNewerThan(PriceQuote other) {
        return other == null || observedAt.isAfter(other.observedAt());
    }
}
