package com.z254.sentinel.guardian.enhancement;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.learning.HistoricalLearning;
import com.z254.sentinel.guardian.learning.HistoricalLearningsClient;
import com.z254.sentinel.guardian.learning.RootCausePattern;
import com.z254.sentinel.guardian.observability.GuardianMetrics;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger.EnhancementEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Turns recurring root-cause patterns into enhancement suggestions.
 * <p>
 * Each candidate pattern gets a category, templated title and steps, an effort estimate
 * (blended with historical effort when the learnings store knows similar fixes), an agent,
 * an ROI estimate and an approval tier.
 */
@Slf4j
@Service
public class EnhancementDetector {

    static final double HOURS_PER_STEP = 1.0;
    static final double HISTORICAL_WEIGHT = 0.7;
    static final double CRITICAL_EFFORT_FACTOR = 1.2;
    static final double COMPLEX_EFFORT_FACTOR = 1.15;
    static final double DEFAULT_FIX_HOURS = 0.25;
    static final int DEFAULT_SUCCESS_RATE = 95;
    static final int AUTO_REMEDIATION_SUCCESS_RATE = 80;

    private final HistoricalLearningsClient learningsClient;
    private final ApprovalTierPolicy tierPolicy;
    private final GuardianProperties.Enhancement config;
    private final int searchLimit;
    private final GuardianMetrics metrics;
    private final GuardianStructuredLogger logger;
    private final Clock clock;

    public EnhancementDetector(HistoricalLearningsClient learningsClient,
                               ApprovalTierPolicy tierPolicy,
                               GuardianProperties properties,
                               GuardianMetrics metrics,
                               GuardianStructuredLogger logger,
                               Clock clock) {
        this.learningsClient = learningsClient;
        this.tierPolicy = tierPolicy;
        this.config = properties.getEnhancement();
        this.searchLimit = properties.getHistoricalLearnings().getSearchLimit();
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    /**
     * Suggest enhancements for the candidate patterns, highest priority first.
     */
    public Mono<EnhancementDetectionResult> detect(List<RootCausePattern> patterns) {
        List<RootCausePattern> candidates = patterns.stream()
                .filter(this::isCandidate)
                .toList();

        return Flux.fromIterable(candidates)
                .concatMap(this::suggest)
                .collectList()
                .map(suggestions -> summarize(patterns.size(), suggestions));
    }

    public boolean isCandidate(RootCausePattern pattern) {
        return pattern.isEnhancementCandidate()
                && pattern.getConfidence() >= config.getMinConfidence()
                && pattern.getOccurrences() >= config.getMinOccurrences();
    }

    // ========== Suggestion ==========

    private Mono<EnhancementSuggestion> suggest(RootCausePattern pattern) {
        return learningsClient.search(pattern.getDescription(), searchLimit)
                .onErrorResume(error -> {
                    log.warn("Learnings lookup failed for pattern {}: {}", pattern.getId(), error.getMessage());
                    return Mono.just(List.of());
                })
                .map(learnings -> build(pattern, learnings));
    }

    EnhancementSuggestion build(RootCausePattern pattern, List<HistoricalLearning> learnings) {
        EnhancementCategory category = categorize(pattern);
        String[] template = titleAndDescription(pattern, category);
        List<String> steps = implementationSteps(pattern, category);
        double effort = estimateEffort(pattern, steps, learnings);
        int successRate = successRate(pattern, learnings);
        Severity priority = pattern.getPriority() != null ? pattern.getPriority() : pattern.getSeverity();

        ApprovalTierPolicy.TierDecision tier = tierPolicy.decide(pattern.getConfidence(), successRate,
                pattern.getSeverity(), pattern.getSecondaryCauses().size(), effort);

        EnhancementSuggestion suggestion = EnhancementSuggestion.builder()
                .id("enhancement-" + pattern.getId())
                .title(template[0])
                .description(template[1])
                .category(category)
                .priority(priority)
                .confidence(pattern.getConfidence())
                .rootCausePatternId(pattern.getId())
                .component(pattern.getComponent())
                .issueDescription(pattern.getDescription())
                .issueSeverity(pattern.getSeverity())
                .layer(pattern.getLayer())
                .implementationSteps(steps)
                .effortHours(effort)
                .assignedAgent(assignAgent(pattern, category))
                .roi(roi(pattern, effort))
                .evidence(EnhancementSuggestion.Evidence.builder()
                        .occurrences(pattern.getOccurrences())
                        .successRate(successRate)
                        .similarFixes(learnings.stream()
                                .map(l -> truncate(l.getPattern(), 80) + " (" + Math.round(l.getSuccessRate()) + "% success)")
                                .toList())
                        .build())
                .approvalTier(tier.tier())
                .approvalRequired(tier.tier() != 1)
                .approvalReason(tier.reason())
                .autoApplicable(tier.tier() == 1)
                .requiresManualReview(tier.tier() == 3)
                .createdAt(clock.instant())
                .build();

        metrics.recordEnhancementSuggested(tier.tier());
        logger.logEnhancementEvent(suggestion.getId(), EnhancementEventType.SUGGESTED, suggestion.getTitle(),
                Map.of("pattern", pattern.getId(),
                        "category", category.name(),
                        "tier", tier.tier(),
                        "effortHours", effort,
                        "agent", suggestion.getAssignedAgent()));
        return suggestion;
    }

    static EnhancementCategory categorize(RootCausePattern pattern) {
        String desc = lower(pattern.getDescription());
        if (pattern.getManualFix() != null && pattern.getManualFixSuccessRate() != null
                && pattern.getManualFixSuccessRate() >= AUTO_REMEDIATION_SUCCESS_RATE) {
            return EnhancementCategory.AUTO_REMEDIATION;
        }
        if (desc.contains("vulnerability") || desc.contains("security")) {
            return EnhancementCategory.SECURITY;
        }
        if (desc.contains("timeout") || desc.contains("latency") || desc.contains("memory") || desc.contains("slow")) {
            return EnhancementCategory.PERFORMANCE;
        }
        if (desc.contains("exhaustion") || desc.contains("threshold")) {
            return EnhancementCategory.MONITORING;
        }
        return EnhancementCategory.RELIABILITY;
    }

    private static String[] titleAndDescription(RootCausePattern pattern, EnhancementCategory category) {
        String desc = lower(pattern.getDescription());
        String rate = pattern.getOccurrences() + " times per " + formatHours(pattern.spanHours());
        switch (category) {
            case AUTO_REMEDIATION -> {
                if (desc.contains("build")) {
                    return new String[]{"Auto-rebuild on build failure detection",
                            "Trigger a rebuild automatically when build failures are detected. The issue currently needs a manual rebuild " + rate + "."};
                }
                if (desc.contains("dependenc") || desc.contains("module")) {
                    return new String[]{"Auto-install dependencies on missing module detection",
                            "Reinstall dependencies automatically when modules are missing. The issue currently needs manual intervention " + rate + "."};
                }
                return new String[]{"Automate the known fix for " + pattern.getComponent(),
                        "Apply the proven manual fix automatically: " + pattern.getManualFix() + ". The issue recurs " + rate + "."};
            }
            case MONITORING -> {
                return new String[]{"Add threshold monitoring for " + pattern.getComponent(),
                        "Alert before the " + pattern.getComponent() + " threshold is exhausted. Prevents " + rate + " failures."};
            }
            case PERFORMANCE -> {
                if (desc.contains("build")) {
                    return new String[]{"Optimize build process with incremental compilation",
                            "Speed up builds with incremental compilation. Reduces slow builds occurring " + rate + "."};
                }
                if (desc.contains("memory")) {
                    return new String[]{"Add memory threshold monitoring and alerts",
                            "Monitor memory usage and alert at 85% before failures. Prevents failures occurring " + rate + "."};
                }
                return new String[]{"Optimize " + pattern.getComponent() + " performance",
                        "Improve " + pattern.getComponent() + " latency with caching and profiling. Reduces slow operations occurring " + rate + "."};
            }
            case SECURITY -> {
                return new String[]{"Auto-fix security vulnerabilities",
                        "Run dependency audit fixes on a schedule for known vulnerabilities. Prevents security issues occurring " + rate + "."};
            }
            case RELIABILITY -> {
                return new String[]{"Improve " + pattern.getComponent() + " reliability",
                        "Address recurring " + pattern.getComponent() + " issues (" + pattern.getPrimaryCause()
                                + "). The issue occurs " + rate + " and needs manual intervention."};
            }
        }
        throw new IllegalStateException("Unhandled category " + category);
    }

    static List<String> implementationSteps(RootCausePattern pattern, EnhancementCategory category) {
        List<String> steps = new ArrayList<>();
        String desc = lower(pattern.getDescription());
        switch (category) {
            case AUTO_REMEDIATION -> {
                if (desc.contains("build")) {
                    steps.add("Add build failure detection to the health check");
                    steps.add("Run a clean rebuild when a build failure is detected");
                    steps.add("Retry the rebuild at most 3 times");
                } else {
                    steps.add("Identify the auto-remediation trigger condition");
                    steps.add("Run the fix command automatically");
                    steps.add("Verify the issue is resolved after the fix");
                }
            }
            case MONITORING -> {
                steps.add("Collect the metric behind the threshold");
                steps.add("Alert at 85% (warning) and 95% (critical)");
                steps.add("Wire alerts into the notification channel");
            }
            case PERFORMANCE -> {
                steps.add("Profile the current bottleneck");
                steps.add("Optimize the hot path (caching, indexes, incremental work)");
                steps.add("Verify the improvement with a benchmark");
            }
            case SECURITY -> {
                steps.add("Audit dependencies for known vulnerabilities");
                steps.add("Schedule automated audit fixes");
                steps.add("Detect breaking changes and roll back");
            }
            case RELIABILITY -> {
                steps.add("Investigate the " + lower(pattern.getPrimaryCause()) + " behind recurring "
                        + pattern.getComponent() + " failures");
                steps.add("Add a guard or retry around the failing operation");
            }
        }
        steps.add("Add regression tests covering the recurring issue");
        steps.add("Update the monitoring runbook");
        return steps;
    }

    static double estimateEffort(RootCausePattern pattern, List<String> steps, List<HistoricalLearning> learnings) {
        double effort = steps.size() * HOURS_PER_STEP;
        OptionalDouble historical = learnings.stream()
                .map(EnhancementDetector::historicalHours)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        if (historical.isPresent()) {
            effort = HISTORICAL_WEIGHT * historical.getAsDouble() + (1 - HISTORICAL_WEIGHT) * effort;
        }
        if (pattern.getSeverity() == Severity.CRITICAL) {
            effort *= CRITICAL_EFFORT_FACTOR;
        }
        if (pattern.getSecondaryCauses().size() > 2) {
            effort *= COMPLEX_EFFORT_FACTOR;
        }
        return Math.round(effort * 2) / 2.0;
    }

    /**
     * Recorded effort, else the fix duration; null when the learning has neither.
     */
    private static Double historicalHours(HistoricalLearning learning) {
        if (learning.getEffortHours() != null) {
            return learning.getEffortHours();
        }
        return learning.getAvgDurationMs() != null ? learning.getAvgDurationMs() / 3_600_000.0 : null;
    }

    static int successRate(RootCausePattern pattern, List<HistoricalLearning> learnings) {
        if (!learnings.isEmpty()) {
            return (int) Math.round(learnings.stream().mapToDouble(HistoricalLearning::getSuccessRate).average().orElse(0));
        }
        if (pattern.getManualFixSuccessRate() != null) {
            return (int) Math.round(pattern.getManualFixSuccessRate());
        }
        return DEFAULT_SUCCESS_RATE;
    }

    static String assignAgent(RootCausePattern pattern, EnhancementCategory category) {
        String component = lower(pattern.getComponent());
        if (pattern.getLayer() == Layer.FRAMEWORK) {
            if (component.contains("rag")) {
                return "Dr.AI-ML";
            }
            if (component.contains("build") || component.contains("test")) {
                return "Maria-QA";
            }
            if (component.contains("agent") || component.contains("guardian")) {
                return "Sarah-PM";
            }
        }
        if (pattern.getLayer() == Layer.PROJECT) {
            if (category == EnhancementCategory.SECURITY || category == EnhancementCategory.PERFORMANCE) {
                return "Marcus-Backend";
            }
            if (component.contains("frontend") || component.contains("ui")) {
                return "James-Frontend";
            }
            if (component.contains("database") || component.contains("migration")) {
                return "Dana-Database";
            }
        }
        return "Marcus-Backend";
    }

    static EnhancementSuggestion.Roi roi(RootCausePattern pattern, double effortHours) {
        double span = pattern.spanHours();
        double occurrencesPerWeek = pattern.getOccurrences() / Math.max(span, 1.0) * 168;
        double fixHours = pattern.getAvgDurationMs() != null
                ? pattern.getAvgDurationMs() / 3_600_000.0
                : DEFAULT_FIX_HOURS;
        double hoursSaved = round1(occurrencesPerWeek * fixHours);
        double reliability = span > 0
                ? Math.min(100.0, pattern.getOccurrences() / span * 100)
                : 100.0;
        return EnhancementSuggestion.Roi.builder()
                .hoursSavedPerWeek(hoursSaved)
                .interventionsEliminated((int) Math.round(occurrencesPerWeek))
                .reliabilityImprovement(round1(reliability))
                .roiRatio(round1(hoursSaved / Math.max(effortHours / 52, 0.01)))
                .build();
    }

    private EnhancementDetectionResult summarize(int analyzed, List<EnhancementSuggestion> suggestions) {
        List<EnhancementSuggestion> sorted = suggestions.stream()
                .sorted(Comparator.comparingInt((EnhancementSuggestion s) -> s.getPriority().rank())
                        .thenComparing(Comparator.comparingInt(EnhancementSuggestion::getConfidence).reversed()))
                .toList();
        int highPriority = (int) sorted.stream()
                .filter(s -> s.getPriority().isAtLeast(Severity.HIGH))
                .count();
        double hoursSaved = sorted.stream().mapToDouble(s -> s.getRoi().getHoursSavedPerWeek()).sum();
        int avgConfidence = (int) Math.round(sorted.stream()
                .mapToInt(EnhancementSuggestion::getConfidence).average().orElse(0));

        if (!sorted.isEmpty()) {
            log.info("Detected {} enhancement suggestions from {} patterns ({} high priority)",
                    sorted.size(), analyzed, highPriority);
        }
        return EnhancementDetectionResult.builder()
                .patternsAnalyzed(analyzed)
                .suggestions(sorted)
                .highPriorityCount(highPriority)
                .totalHoursSavedPerWeek(round1(hoursSaved))
                .avgConfidence(avgConfidence)
                .build();
    }

    private static String formatHours(double hours) {
        return round1(Math.max(hours, 1.0)) + "h";
    }

    private static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static String truncate(String value, int length) {
        if (value == null) {
            return "";
        }
        return value.length() <= length ? value : value.substring(0, length);
    }
}
