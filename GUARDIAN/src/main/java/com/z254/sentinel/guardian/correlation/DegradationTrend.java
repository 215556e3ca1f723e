package com.z254.sentinel.guardian.correlation;

import com.z254.sentinel.guardian.domain.model.Severity;
import lombok.Builder;
import lombok.Value;

/**
 * A non-stable linear trend in one metric series.
 */
@Value
@Builder
public class DegradationTrend {

    /** Source series key */
    String seriesName;

    String component;

    String metric;

    Direction direction;

    /** Percent change per hour, two decimals */
    double rateOfChangePerHour;

    double currentValue;

    double predicted1h;

    double predicted24h;

    /** Hours until the breach threshold is crossed; null when not applicable */
    Double hoursUntilBreach;

    Severity severity;

    /** round(R-squared * 100) */
    int confidence;

    double rSquared;

    public enum Direction {
        INCREASING,
        DECREASING
    }
}
