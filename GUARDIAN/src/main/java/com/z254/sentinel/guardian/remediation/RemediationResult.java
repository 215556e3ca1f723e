package com.z254.sentinel.guardian.remediation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one remediation attempt. Misses and failures are values, not exceptions.
 */
@Value
@Builder(toBuilder = true)
public class RemediationResult {

    public static final String NO_MATCH_ACTION = "No matching remediation scenario";
    public static final String MANUAL_INVESTIGATION = "Manual investigation required";

    boolean success;

    String issueId;

    String actionTaken;

    int confidence;

    long durationMs;

    String beforeState;

    String afterState;

    /** True when the attempt produced a lesson */
    boolean learned;

    String lesson;

    @Singular
    List<String> nextSteps;

    /** Matched scenario; null when nothing matched */
    String scenarioId;

    Instant timestamp;
}
