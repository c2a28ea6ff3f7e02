package com.lendora.lending.client;

import com.lendora.lending.config.LendingProperties;
import com.lendora.lending.exception.StalePriceException;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Price feed reached over HTTP: {@code GET {base-url}/v1/prices/{asset}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RestPriceOracle implements PriceOracle {

    private final RestTemplate restTemplate;
    private final LendingProperties properties;

    @Override
    public PriceQuote getPrice(String assetId) {
        String url = properties.getOracle().getBaseUrl() + "/v1/prices/{asset}";
        try {
            PriceFeedResponse response = restTemplate.getForObject(url, PriceFeedResponse.class, assetId);
            if (response == null || response.getPrice() == null || response.getObservedAt() == null) {
                throw new StalePriceException("Price feed returned no usable price for " + assetId);
            }
            log.debug("Price feed answered {} = {} observed at {}", assetId, response.getPrice(), response.getObservedAt());
            return new PriceQuote(assetId, response.getPrice(), response.getObservedAt());
        } catch (RestClientException e) {
            log.error("Price feed request failed for asset {}", assetId, e);
            throw new StalePriceException("Price feed unavailable for " + assetId, e);
        }
    }

    @Data
    static class PriceFeedResponse {
        private BigDecimal price;
        private Instant observedAt;
    }
}
