package com.z254.sentinel.guardian.correlation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of correlating a snapshot history.
 */
@Value
@Builder
public class CorrelationAnalysis {

    @Builder.Default
    List<MetricCorrelation> correlations = List.of();

    @Builder.Default
    List<DegradationTrend> degradationTrends = List.of();

    @Builder.Default
    List<PredictiveAlert> predictiveAlerts = List.of();

    int healthChecksAnalyzed;

    /** Span between the oldest and newest snapshot, one decimal */
    double analysisWindowHours;

    /**
     * Result for a history too short to analyze.
     */
    public static CorrelationAnalysis insufficient(int analyzed) {
        return CorrelationAnalysis.builder().healthChecksAnalyzed(analyzed).build();
    }
}
