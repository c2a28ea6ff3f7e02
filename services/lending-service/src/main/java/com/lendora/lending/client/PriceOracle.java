package com.lendora.lending.client;

/**
 * External price feed. Answers are untrusted: the collateral ledger validates and ages them.
 */
public interface PriceOracle {

    PriceQuote getPrice(String assetId);
}
