package com.z254.sentinel.guardian.correlation;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.correlation.DegradationTrend.Direction;
import com.z254.sentinel.guardian.correlation.MetricCorrelation.Relationship;
import com.z254.sentinel.guardian.correlation.PredictiveAlert.AlertType;
import com.z254.sentinel.guardian.domain.model.ComponentHealth;
import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import com.z254.sentinel.guardian.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Statistical analysis of the snapshot history.
 * <p>
 * Finds strongly correlated metric pairs, fits a linear trend to every metric and raises
 * predictive alerts for imminent threshold breaches, correlation cascades and sustained
 * degradation.
 */
@Slf4j
@Component
public class PatternCorrelator {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final GuardianProperties.Correlation config;
    private final Clock clock;

    public PatternCorrelator(GuardianProperties properties, Clock clock) {
        this.config = properties.getCorrelation();
        this.clock = clock;
    }

    public CorrelationAnalysis analyze(List<HealthSnapshot> history) {
        if (history.size() < config.getMinSnapshots()) {
            log.debug("Skipping correlation, {} snapshots is below the minimum of {}",
                    history.size(), config.getMinSnapshots());
            return CorrelationAnalysis.insufficient(history.size());
        }

        List<HealthSnapshot> ordered = new ArrayList<>(history);
        ordered.sort(Comparator.comparing(HealthSnapshot::getTimestamp));

        List<MetricSeries> series = extractSeries(ordered);
        List<MetricCorrelation> correlations = correlate(series);
        List<DegradationTrend> trends = detectTrends(series);
        List<PredictiveAlert> alerts = generateAlerts(trends, correlations);

        Instant first = ordered.get(0).getTimestamp();
        Instant last = ordered.get(ordered.size() - 1).getTimestamp();
        double windowHours = Statistics.round(Duration.between(first, last).toMillis() / MILLIS_PER_HOUR, 1);

        log.debug("Correlation complete: correlations={}, trends={}, alerts={}, windowHours={}",
                correlations.size(), trends.size(), alerts.size(), windowHours);
        return CorrelationAnalysis.builder()
                .correlations(correlations)
                .degradationTrends(trends)
                .predictiveAlerts(alerts)
                .healthChecksAnalyzed(history.size())
                .analysisWindowHours(windowHours)
                .build();
    }

    /**
     * One series for overall health, one per component score and one per component metric.
     */
    public List<MetricSeries> extractSeries(List<HealthSnapshot> snapshots) {
        Map<String, MetricSeries.MetricSeriesBuilder> builders = new LinkedHashMap<>();
        for (HealthSnapshot snapshot : snapshots) {
            Instant timestamp = snapshot.getTimestamp();
            append(builders, MetricSeries.OVERALL_HEALTH, "overall", "health", timestamp, snapshot.getOverallHealth());
            for (Map.Entry<String, ComponentHealth> entry : snapshot.getComponents().entrySet()) {
                String component = entry.getKey();
                ComponentHealth health = entry.getValue();
                append(builders, component + "_score", component, "score", timestamp, health.getScore());
                for (Map.Entry<String, Double> metric : health.getMetrics().entrySet()) {
                    if (metric.getValue() != null) {
                        append(builders, component + "_" + metric.getKey(), component, metric.getKey(),
                                timestamp, metric.getValue());
                    }
                }
            }
        }
        return builders.values().stream().map(MetricSeries.MetricSeriesBuilder::build).toList();
    }

    /**
     * Pairwise Pearson correlation over equal-length series, strongest first.
     */
    public List<MetricCorrelation> correlate(List<MetricSeries> series) {
        List<MetricCorrelation> correlations = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            for (int j = i + 1; j < series.size(); j++) {
                MetricSeries a = series.get(i);
                MetricSeries b = series.get(j);
                if (a.size() != b.size()) {
                    continue;
                }
                double r = Statistics.pearson(a.values(), b.values());
                if (Math.abs(r) < config.getMinCoefficient()) {
                    continue;
                }
                Relationship relationship = r > 0 ? Relationship.POSITIVE : Relationship.NEGATIVE;
                correlations.add(MetricCorrelation.builder()
                        .metric1(a.getName())
                        .metric2(b.getName())
                        .coefficient(Statistics.round(r, 2))
                        .confidence((int) Math.round(Math.abs(r) * 100))
                        .sampleSize(a.size())
                        .relationship(relationship)
                        .description(a.getName() + " increases, " + b.getName()
                                + (relationship == Relationship.POSITIVE ? " increases" : " decreases"))
                        .build());
            }
        }
        correlations.sort(Comparator.comparingDouble((MetricCorrelation c) -> Math.abs(c.getCoefficient())).reversed());
        return correlations;
    }

    /**
     * Linear trend per series; stable series are dropped.
     */
    public List<DegradationTrend> detectTrends(List<MetricSeries> series) {
        List<DegradationTrend> trends = new ArrayList<>();
        for (MetricSeries s : series) {
            if (s.size() < config.getMinSnapshots()) {
                continue;
            }
            trendOf(s).ifPresent(trends::add);
        }
        trends.sort(Comparator.comparingInt((DegradationTrend t) -> t.getSeverity().rank())
                .thenComparing(Comparator.comparingDouble((DegradationTrend t) -> Math.abs(t.getRateOfChangePerHour())).reversed()));
        return trends;
    }

    // ========== Private Methods ==========

    private Optional<DegradationTrend> trendOf(MetricSeries series) {
        List<MetricSeries.Sample> samples = series.getSamples();
        Instant origin = samples.get(0).timestamp();
        double[] hours = samples.stream()
                .mapToDouble(sample -> Duration.between(origin, sample.timestamp()).toMillis() / MILLIS_PER_HOUR)
                .toArray();
        double[] values = series.values();
        Statistics.Regression regression = Statistics.regression(hours, values);

        Direction direction;
        if (regression.slope() > config.getSlopeEpsilon()) {
            direction = Direction.INCREASING;
        } else if (regression.slope() < -config.getSlopeEpsilon()) {
            direction = Direction.DECREASING;
        } else {
            return Optional.empty();
        }

        double current = values[values.length - 1];
        double spanHours = hours[hours.length - 1];
        double rate = percentRatePerHour(values, spanHours);

        Double eta = null;
        if (isThresholdMetric(series.getMetric()) && direction == Direction.DECREASING
                && current > config.getBreachThreshold() && rate != 0.0) {
            eta = Statistics.round((current - config.getBreachThreshold()) / Math.abs(rate), 1);
        }

        return Optional.of(DegradationTrend.builder()
                .seriesName(series.getName())
                .component(series.getComponent())
                .metric(series.getMetric())
                .direction(direction)
                .rateOfChangePerHour(Statistics.round(rate, 2))
                .currentValue(Statistics.round(current, 1))
                .predicted1h(Statistics.round(current + regression.slope(), 1))
                .predicted24h(Statistics.round(current + regression.slope() * 24, 1))
                .hoursUntilBreach(eta)
                .severity(severityOf(eta, rate))
                .confidence((int) Math.round(regression.rSquared() * 100))
                .rSquared(regression.rSquared())
                .build());
    }

    /**
     * Change from first to last sample as a percentage per hour. The base is the first value,
     * or the mean magnitude of the series when the first value is 0.
     */
    static double percentRatePerHour(double[] values, double spanHours) {
        double first = values[0];
        double base = Math.abs(first);
        if (base == 0.0) {
            double[] magnitudes = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                magnitudes[i] = Math.abs(values[i]);
            }
            base = Statistics.mean(magnitudes);
        }
        if (base == 0.0 || spanHours <= 0.0) {
            return 0.0;
        }
        return ((values[values.length - 1] - first) / base) * 100.0 / spanHours;
    }

    /**
     * Health and score metrics degrade by falling; every other metric (memory, errors,
     * latency) degrades by rising.
     */
    static boolean isDegrading(DegradationTrend trend) {
        return isThresholdMetric(trend.getMetric())
                ? trend.getDirection() == Direction.DECREASING
                : trend.getDirection() == Direction.INCREASING;
    }

    private static boolean isThresholdMetric(String metric) {
        String name = metric.toLowerCase(Locale.ROOT);
        return name.contains("health") || name.contains("score");
    }

    static Severity severityOf(Double eta, double rate) {
        double magnitude = Math.abs(rate);
        if (eta != null && eta < 1.0) {
            return Severity.CRITICAL;
        }
        if ((eta != null && eta < 6.0) || magnitude > 10.0) {
            return Severity.HIGH;
        }
        if (magnitude > 5.0) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private List<PredictiveAlert> generateAlerts(List<DegradationTrend> trends, List<MetricCorrelation> correlations) {
        List<PredictiveAlert> alerts = new ArrayList<>();

        for (DegradationTrend trend : trends) {
            Double eta = trend.getHoursUntilBreach();
            if (eta != null && eta < config.getAlertHorizonHours()) {
                alerts.add(PredictiveAlert.builder()
                        .id(alertId(AlertType.THRESHOLD_BREACH))
                        .type(AlertType.THRESHOLD_BREACH)
                        .title(trend.getComponent() + " " + trend.getMetric() + " threshold breach imminent")
                        .description(String.format(Locale.ROOT,
                                "%s %s is degrading at %.2f%%/h, critical threshold breach in %.1fh",
                                trend.getComponent(), trend.getMetric(),
                                Math.abs(trend.getRateOfChangePerHour()), eta))
                        .severity(trend.getSeverity())
                        .etaHours(eta)
                        .confidence(trend.getConfidence())
                        .evidence(trendEvidence(trend))
                        .recommendedAction(recommendedAction(trend))
                        .autoRemediable(trend.getSeverity() != Severity.CRITICAL)
                        .build());
            } else if (eta == null && isDegrading(trend)
                    && trend.getSeverity().isAtLeast(Severity.MEDIUM) && trend.getRSquared() >= 0.8) {
                alerts.add(PredictiveAlert.builder()
                        .id(alertId(AlertType.DEGRADATION_PATTERN))
                        .type(AlertType.DEGRADATION_PATTERN)
                        .title(trend.getComponent() + " " + trend.getMetric() + " degrading steadily")
                        .description(String.format(Locale.ROOT,
                                "%s %s is %s at %.2f%%/h with a consistent linear fit (R2 %.2f)",
                                trend.getComponent(), trend.getMetric(),
                                trend.getDirection() == Direction.DECREASING ? "falling" : "rising",
                                Math.abs(trend.getRateOfChangePerHour()), trend.getRSquared()))
                        .severity(trend.getSeverity())
                        .confidence(trend.getConfidence())
                        .evidence(trendEvidence(trend))
                        .recommendedAction(recommendedAction(trend))
                        .autoRemediable(false)
                        .build());
            }
        }

        for (MetricCorrelation correlation : correlations) {
            if (correlation.getRelationship() != Relationship.POSITIVE) {
                continue;
            }
            DegradationTrend leading = findTrend(trends, correlation.getMetric1());
            DegradationTrend following = findTrend(trends, correlation.getMetric2());
            if (leading == null || following != null) {
                continue;
            }
            alerts.add(PredictiveAlert.builder()
                    .id(alertId(AlertType.CORRELATION_CASCADE))
                    .type(AlertType.CORRELATION_CASCADE)
                    .title(correlation.getMetric2() + " degradation predicted")
                    .description(String.format(Locale.ROOT,
                            "%s degradation (%.2f%%/h) will likely cascade to %s, correlation %.2f",
                            correlation.getMetric1(), leading.getRateOfChangePerHour(),
                            correlation.getMetric2(), correlation.getCoefficient()))
                    .severity(Severity.HIGH)
                    .etaHours(1.0)
                    .confidence(correlation.getConfidence())
                    .evidenceLine(correlation.getMetric1() + " degrading: " + leading.getRateOfChangePerHour() + "%/h")
                    .evidenceLine("Correlation: " + correlation.getDescription())
                    .evidenceLine("Confidence: " + correlation.getConfidence() + "%")
                    .recommendedAction("Address " + correlation.getMetric1() + " degradation to prevent cascade")
                    .autoRemediable(false)
                    .build());
        }

        alerts.sort(Comparator.comparingInt((PredictiveAlert a) -> a.getSeverity().rank())
                .thenComparingDouble(a -> a.getEtaHours() != null ? a.getEtaHours() : Double.POSITIVE_INFINITY));
        return alerts;
    }

    private static DegradationTrend findTrend(List<DegradationTrend> trends, String seriesName) {
        return trends.stream().filter(t -> t.getSeriesName().equals(seriesName)).findFirst().orElse(null);
    }

    private static List<String> trendEvidence(DegradationTrend trend) {
        return List.of(
                "Current value: " + trend.getCurrentValue(),
                "Rate of change: " + trend.getRateOfChangePerHour() + "%/h",
                "Predicted 1h: " + trend.getPredicted1h(),
                "Predicted 24h: " + trend.getPredicted24h());
    }

    static String recommendedAction(DegradationTrend trend) {
        String component = trend.getComponent().toLowerCase(Locale.ROOT);
        String metric = trend.getMetric().toLowerCase(Locale.ROOT);
        if (metric.contains("memory")) {
            return "Investigate memory growth and restart the affected service";
        }
        if (component.equals("build")) {
            return "Clean build output and rebuild, check for circular dependencies";
        }
        if (component.equals("tests")) {
            return "Investigate failing tests and check for flaky tests";
        }
        return "Investigate " + trend.getComponent() + " " + trend.getMetric() + " degradation";
    }

    private String alertId(AlertType type) {
        return type.name().toLowerCase(Locale.ROOT).replace('_', '-') + "-" + clock.millis()
                + "-" + Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36 * 36), 36);
    }

    private static void append(Map<String, MetricSeries.MetricSeriesBuilder> builders, String name,
                               String component, String metric, Instant timestamp, double value) {
        builders.computeIfAbsent(name, key -> MetricSeries.builder().name(key).component(component).metric(metric))
                .sample(new MetricSeries.Sample(timestamp, value));
    }
}
