package com.z254.sentinel.guardian.telemetry;

import com.z254.sentinel.guardian.domain.model.Severity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Running totals over all telemetry events.
 * <p>
 * Immutable; each {@code with*} method returns the aggregate after one more event.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TelemetryAggregate {

    @Builder.Default
    Map<TelemetryEvent.Type, Long> eventCounts = Map.of();

    long remediations;

    long successfulRemediations;

    /** Percentage of successful remediations (0-100) */
    double remediationSuccessRate;

    /** Exponential moving average of remediation duration */
    double avgRemediationDurationMs;

    @Builder.Default
    Map<Severity, Long> alertsBySeverity = Map.of();

    Instant lastUpdated;

    public static TelemetryAggregate empty() {
        return TelemetryAggregate.builder().build();
    }

    public TelemetryAggregate withEvent(TelemetryEvent.Type type, Instant at) {
        Map<TelemetryEvent.Type, Long> counts = new EnumMap<>(TelemetryEvent.Type.class);
        counts.putAll(eventCounts);
        counts.merge(type, 1L, Long::sum);
        return toBuilder().eventCounts(counts).lastUpdated(at).build();
    }

    public TelemetryAggregate withRemediation(boolean success, long durationMs, double alpha) {
        long total = remediations + 1;
        long succeeded = successfulRemediations + (success ? 1 : 0);
        double average = remediations == 0
                ? durationMs
                : alpha * durationMs + (1 - alpha) * avgRemediationDurationMs;
        return toBuilder()
                .remediations(total)
                .successfulRemediations(succeeded)
                .remediationSuccessRate(Math.round(succeeded * 1000.0 / total) / 10.0)
                .avgRemediationDurationMs(Math.round(average * 10) / 10.0)
                .build();
    }

    public TelemetryAggregate withAlert(Severity severity) {
        Map<Severity, Long> alerts = new HashMap<>(alertsBySeverity);
        alerts.merge(severity, 1L, Long::sum);
        return toBuilder().alertsBySeverity(alerts).build();
    }
}
