package com.z254.sentinel.guardian.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Health of one platform component within a snapshot.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ComponentHealth {

    /** Score (0-100) */
    double score;

    /** Free-form status reported by the health checker */
    String status;

    /** Numeric metrics keyed by metric name */
    @Singular
    Map<String, Double> metrics;
}
