package com.z254.sentinel.guardian.correlation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Time series of one metric across the snapshot history.
 */
@Value
@Builder(toBuilder = true)
public class MetricSeries {

    public static final String OVERALL_HEALTH = "overall_health";

    /** Series key, e.g. {@code overall_health}, {@code rag_score}, {@code rag_latency_ms} */
    String name;

    String component;

    String metric;

    @Singular
    List<Sample> samples;

    public int size() {
        return samples.size();
    }

    public double[] values() {
        return samples.stream().mapToDouble(Sample::value).toArray();
    }

    public record Sample(Instant timestamp, double value) {
    }
}
