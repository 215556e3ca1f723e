package com.z254.sentinel.guardian.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a ground-truth verifier.
 */
@Value
@Builder
public class VerificationResult {

    boolean verified;

    /** Confidence (0-100) */
    int confidence;

    @Singular("evidenceLine")
    List<String> evidence;

    String recommendedFix;

    /** Agent responsible for the offending change, when the verifier can tell */
    String responsibleAgent;

    /**
     * A fail-closed result for claims that could not be checked.
     */
    public static VerificationResult unverified(String reason) {
        return VerificationResult.builder()
                .verified(false)
                .confidence(0)
                .evidenceLine(reason)
                .recommendedFix("Manual investigation required")
                .build();
    }
}
