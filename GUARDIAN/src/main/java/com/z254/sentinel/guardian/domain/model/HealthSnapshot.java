package com.z254.sentinel.guardian.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable record of one monitoring cycle.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class HealthSnapshot {

    /** Overall score (0-100) */
    double overallHealth;

    @Singular
    Map<String, ComponentHealth> components;

    @Singular
    List<Issue> issues;

    Instant timestamp;

    @JsonIgnore
    public Status getStatus() {
        if (overallHealth >= 90) {
            return Status.HEALTHY;
        }
        if (overallHealth >= 70) {
            return Status.DEGRADED;
        }
        return Status.CRITICAL;
    }

    public enum Status {
        HEALTHY,
        DEGRADED,
        CRITICAL
    }
}
