package com.z254.sentinel.guardian.learning;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A past fix recorded in the shared learnings store.
 */
@Value
@Builder
@Jacksonized
public class HistoricalLearning {

    String pattern;

    String category;

    /** Fix success rate (0-100) */
    double successRate;

    String manualFix;

    Long avgDurationMs;

    /** Implementation effort of a comparable enhancement, when recorded */
    Double effortHours;
}
