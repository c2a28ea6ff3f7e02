package com.lendora.lending.client;

import com.lendora.lending.exception.VerificationUnavailableException;

/**
 * Opaque credit eligibility check.
 *
 * Given the attestation a borrower obtained from the attestation service, answers whether the
 * borrower is eligible without revealing the underlying score. Calls are idempotent and free of
 * side effects, so the proof backend can be swapped without touching loan origination.
 */
public interface CreditGate {

    /**
     * @throws VerificationUnavailableException if the attestation cannot be checked
     */
    boolean verify(String borrowerId, String attestation);
}
