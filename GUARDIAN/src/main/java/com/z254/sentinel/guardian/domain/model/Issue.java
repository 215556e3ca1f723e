package com.z254.sentinel.guardian.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An issue detected by the health checker.
 * <p>
 * Issues are created per snapshot and never mutated; {@link #toBuilder()} produces
 * modified copies.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Issue {

    String component;

    @Builder.Default
    Severity severity = Severity.MEDIUM;

    String description;

    /** Optional root-cause hint from the detector */
    String rootCause;

    /** Optional detector confidence (0-100) */
    Integer confidence;

    boolean autoFixAvailable;

    String recommendation;

    public String componentOrEmpty() {
        return component != null ? component : "";
    }

    public String descriptionOrEmpty() {
        return description != null ? description : "";
    }
}
