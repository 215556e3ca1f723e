package com.z254.sentinel.guardian.telemetry;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the telemetry event log.
 */
@Value
@Builder
@Jacksonized
public class TelemetryEvent {

    Instant timestamp;

    Type type;

    @Builder.Default
    Map<String, Object> payload = Map.of();

    public enum Type {
        REMEDIATION,
        PREDICTIVE_ALERT,
        VERIFICATION,
        ENHANCEMENT
    }
}
