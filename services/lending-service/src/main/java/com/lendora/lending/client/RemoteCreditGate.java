package com.lendora.lending.client;

import com.lendora.lending.config.LendingProperties;
import com.lendora.lending.exception.VerificationUnavailableException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Credit gate backed by the attestation verifier service:
 * {@code POST {base-url}/v1/attestations/verify}. Only the boolean outcome crosses this boundary.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RemoteCreditGate implements CreditGate {

    private final RestTemplate restTemplate;
    private final LendingProperties properties;

    @Override
    public boolean verify(String borrowerId, String attestation) {
        String url = properties.getCreditGate().getBaseUrl() + "/v1/attestations/verify";
        try {
            VerificationResponse response = restTemplate.postForObject(url,
                    new VerificationRequest(borrowerId, attestation), VerificationResponse.class);
            if (response == null || response.getEligible() == null) {
                throw new VerificationUnavailableException("Verifier returned no outcome for borrower " + borrowerId);
            }
            return response.getEligible();
        } catch (RestClientException e) {
            log.error("Attestation verification failed for borrower {}", borrowerId, e);
            throw new VerificationUnavailableException("Attestation verifier unavailable", e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class VerificationRequest {
        private String borrowerId;
        private String attestation;
    }

    @Data
    static class VerificationResponse {
        private Boolean eligible;
    }
}
