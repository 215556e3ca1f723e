package com.z254.sentinel.guardian.learning;

import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A recurring (component, fingerprint) issue group mined from the snapshot history.
 */
@Value
@Builder(toBuilder = true)
public class RootCausePattern {

    String id;

    String fingerprint;

    /** Description of the first occurrence */
    String description;

    String component;

    Layer layer;

    String primaryCause;

    @Builder.Default
    List<String> secondaryCauses = List.of();

    int occurrences;

    Instant firstSeen;

    Instant lastSeen;

    /** Root-cause confidence (0-100) */
    int confidence;

    Severity severity;

    /** Enhancement priority */
    Severity priority;

    /** Known manual fix from historical learnings */
    String manualFix;

    /** Success rate of the manual fix (0-100) */
    Double manualFixSuccessRate;

    Long avgDurationMs;

    boolean enhancementCandidate;

    public String key() {
        return keyOf(component, fingerprint);
    }

    public static String keyOf(String component, String fingerprint) {
        return (component == null ? "" : component) + "|" + fingerprint;
    }

    /**
     * Hours between first and last occurrence.
     */
    public double spanHours() {
        if (firstSeen == null || lastSeen == null) {
            return 0.0;
        }
        return Math.max(0, lastSeen.toEpochMilli() - firstSeen.toEpochMilli()) / 3_600_000.0;
    }
}
