package com.z254.sentinel.guardian.correlation;

import lombok.Builder;
import lombok.Value;

/**
 * A strong correlation between two metric series.
 */
@Value
@Builder
public class MetricCorrelation {

    String metric1;

    String metric2;

    /** Pearson r, two decimals */
    double coefficient;

    /** round(|r| * 100) */
    int confidence;

    int sampleSize;

    Relationship relationship;

    String description;

    public enum Relationship {
        POSITIVE,
        NEGATIVE
    }
}
