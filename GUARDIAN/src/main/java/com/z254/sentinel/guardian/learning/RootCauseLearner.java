package com.z254.sentinel.guardian.learning;

import com.z254.sentinel.guardian.classify.LayerClassifier;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger.EnhancementEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Mines the snapshot history for recurring issues and hypothesizes their root causes.
 * <p>
 * Issues are grouped by component and a normalized description fingerprint. A group that
 * recurs often enough within the recurrence window becomes a {@link RootCausePattern}; known
 * patterns gain confidence each time they recur.
 */
@Slf4j
@Service
public class RootCauseLearner {

    static final int BASE_CONFIDENCE = 60;
    static final int NEW_PATTERN_CAP = 95;
    static final int CONFIDENCE_BOOST = 5;
    static final int CANDIDATE_MIN_OCCURRENCES = 3;
    static final int CANDIDATE_MIN_CONFIDENCE = 70;

    private static final Pattern DURATION = Pattern.compile("\\d+(?:\\.\\d+)?\\s*ms\\b");
    private static final Pattern PERCENTAGE = Pattern.compile("\\d+(?:\\.\\d+)?\\s*%");
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");

    private final RootCausePatternRepository repository;
    private final HistoricalLearningsClient learningsClient;
    private final LayerClassifier classifier;
    private final GuardianProperties properties;
    private final GuardianStructuredLogger logger;
    private final Clock clock;

    public RootCauseLearner(RootCausePatternRepository repository,
                            HistoricalLearningsClient learningsClient,
                            LayerClassifier classifier,
                            GuardianProperties properties,
                            GuardianStructuredLogger logger,
                            Clock clock) {
        this.repository = repository;
        this.learningsClient = learningsClient;
        this.classifier = classifier;
        this.properties = properties;
        this.logger = logger;
        this.clock = clock;
    }

    /**
     * Analyze a snapshot history, newest last.
     */
    public Mono<LearningResult> learn(List<HealthSnapshot> history) {
        if (history.isEmpty()) {
            return Mono.just(LearningResult.empty());
        }
        List<Occurrence> occurrences = occurrencesInWindow(history);
        Map<String, List<Occurrence>> groups = new LinkedHashMap<>();
        for (Occurrence occurrence : occurrences) {
            groups.computeIfAbsent(RootCausePattern.keyOf(occurrence.issue().getComponent(), occurrence.fingerprint()),
                    key -> new ArrayList<>()).add(occurrence);
        }

        int minOccurrences = properties.getLearning().getMinOccurrences();
        List<List<Occurrence>> recurring = groups.values().stream()
                .filter(group -> group.size() >= minOccurrences)
                .toList();

        return Flux.fromIterable(recurring)
                .concatMap(group -> learnGroup(group, occurrences))
                .collectList()
                .map(this::summarize);
    }

    /**
     * Lower-case, collapse whitespace, and replace durations, percentages and numbers with
     * placeholders so repeated occurrences of one problem share a fingerprint.
     */
    public static String fingerprint(String description) {
        if (description == null) {
            return "";
        }
        String normalized = description.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        normalized = DURATION.matcher(normalized).replaceAll("Xms");
        normalized = PERCENTAGE.matcher(normalized).replaceAll("X%");
        normalized = NUMBER.matcher(normalized).replaceAll("N");
        return normalized.length() <= 100 ? normalized : normalized.substring(0, 100);
    }

    static Severity priorityOf(Severity severity, int occurrences, int confidence) {
        if (severity == Severity.CRITICAL || occurrences >= 10 || confidence >= 90) {
            return Severity.CRITICAL;
        }
        if (severity == Severity.HIGH || occurrences >= 5 || confidence >= 80) {
            return Severity.HIGH;
        }
        if (severity == Severity.MEDIUM || occurrences >= 3) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    static String inferPrimaryCause(Issue issue) {
        if (issue.getRootCause() != null && !issue.getRootCause().isBlank()) {
            return issue.getRootCause();
        }
        String text = issue.descriptionOrEmpty().toLowerCase(Locale.ROOT);
        if (text.contains("cannot find module") || text.contains("dependenc") || text.contains("outdated")) {
            return "Dependency problem";
        }
        if (text.contains("config") || text.contains("missing") || text.contains("not initialized")) {
            return "Configuration problem";
        }
        if (text.contains("memory") || text.contains("exhaust") || text.contains("disk")) {
            return "Resource exhaustion";
        }
        if (text.contains("connection") || text.contains("network") || text.contains("unreachable")) {
            return "Network problem";
        }
        if (text.contains("timeout") || text.contains("latency") || text.contains("slow")) {
            return "Timing problem";
        }
        if (text.contains("error") || text.contains("fail") || text.contains("exception")) {
            return "Code defect";
        }
        return issue.componentOrEmpty() + " component issue requiring investigation";
    }

    // ========== Private Methods ==========

    private List<Occurrence> occurrencesInWindow(List<HealthSnapshot> history) {
        Instant newest = history.stream()
                .map(HealthSnapshot::getTimestamp)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(clock.instant());
        Instant cutoff = newest.minus(properties.getLearning().getRecurrenceWindow());

        List<Occurrence> occurrences = new ArrayList<>();
        for (int index = 0; index < history.size(); index++) {
            HealthSnapshot snapshot = history.get(index);
            Instant timestamp = snapshot.getTimestamp() != null ? snapshot.getTimestamp() : newest;
            if (timestamp.isBefore(cutoff)) {
                continue;
            }
            for (Issue issue : snapshot.getIssues()) {
                occurrences.add(new Occurrence(issue, fingerprint(issue.getDescription()), timestamp, index));
            }
        }
        return occurrences;
    }

    private Mono<Learned> learnGroup(List<Occurrence> group, List<Occurrence> all) {
        Occurrence first = group.get(0);
        return repository.findByKey(first.issue().getComponent(), first.fingerprint())
                .map(existing -> Mono.just(new Learned(repository.save(update(existing, group)), false)))
                .orElseGet(() -> learningsClient
                        .search(first.issue().descriptionOrEmpty(), properties.getHistoricalLearnings().getSearchLimit())
                        .onErrorResume(error -> {
                            log.warn("Learnings search failed for {}: {}", first.issue().getComponent(), error.getMessage());
                            return Mono.just(List.of());
                        })
                        .map(learnings -> new Learned(repository.save(create(group, all, learnings)), true)));
    }

    private RootCausePattern update(RootCausePattern existing, List<Occurrence> group) {
        int occurrences = existing.getOccurrences() + group.size();
        int confidence = Math.min(100, existing.getConfidence() + CONFIDENCE_BOOST);
        RootCausePattern updated = existing.toBuilder()
                .occurrences(occurrences)
                .lastSeen(group.get(group.size() - 1).timestamp())
                .confidence(confidence)
                .priority(priorityOf(existing.getSeverity(), occurrences, confidence))
                .enhancementCandidate(isCandidate(occurrences, confidence))
                .build();
        logger.logEnhancementEvent(updated.getId(), EnhancementEventType.PATTERN_LEARNED,
                "Recurring pattern updated",
                Map.of("component", updated.getComponent(), "occurrences", occurrences, "confidence", confidence));
        return updated;
    }

    private RootCausePattern create(List<Occurrence> group, List<Occurrence> all, List<HistoricalLearning> learnings) {
        Occurrence first = group.get(0);
        Issue issue = first.issue();
        int occurrences = group.size();

        double confidence = BASE_CONFIDENCE + Math.min(20, occurrences * 5);
        OptionalDouble avgSuccess = learnings.stream().mapToDouble(HistoricalLearning::getSuccessRate).average();
        if (avgSuccess.isPresent()) {
            confidence += Math.min(15, avgSuccess.getAsDouble() / 10);
        }
        if (properties.getLearning().getKnownComponents().contains(issue.componentOrEmpty().toLowerCase(Locale.ROOT))) {
            confidence += 10;
        }
        int rounded = (int) Math.round(Math.min(NEW_PATTERN_CAP, confidence));

        Severity severity = group.stream()
                .map(occurrence -> occurrence.issue().getSeverity())
                .min(Comparator.comparingInt(Severity::rank))
                .orElse(Severity.MEDIUM);

        RootCausePattern pattern = RootCausePattern.builder()
                .id("root-cause-" + clock.millis() + "-"
                        + Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36 * 36), 36))
                .fingerprint(first.fingerprint())
                .description(issue.getDescription())
                .component(issue.getComponent())
                .layer(classifier.classify(issue).getLayer())
                .primaryCause(inferPrimaryCause(issue))
                .secondaryCauses(secondaryCauses(group, all))
                .occurrences(occurrences)
                .firstSeen(first.timestamp())
                .lastSeen(group.get(group.size() - 1).timestamp())
                .confidence(rounded)
                .severity(severity)
                .priority(priorityOf(severity, occurrences, rounded))
                .manualFix(learnings.stream()
                        .map(HistoricalLearning::getManualFix)
                        .filter(fix -> fix != null && !fix.isBlank())
                        .findFirst()
                        .orElse(null))
                .manualFixSuccessRate(avgSuccess.isPresent() ? avgSuccess.getAsDouble() : null)
                .avgDurationMs(averageDuration(learnings))
                .enhancementCandidate(isCandidate(occurrences, rounded))
                .build();

        logger.logEnhancementEvent(pattern.getId(), EnhancementEventType.PATTERN_LEARNED,
                "New recurring pattern learned",
                Map.of("component", issue.componentOrEmpty(),
                        "occurrences", occurrences,
                        "confidence", rounded,
                        "primaryCause", pattern.getPrimaryCause()));
        return pattern;
    }

    /**
     * Components of other issues reported in the same snapshots, most frequent first.
     */
    private List<String> secondaryCauses(List<Occurrence> group, List<Occurrence> all) {
        String component = group.get(0).issue().componentOrEmpty();
        List<Integer> snapshots = group.stream().map(Occurrence::snapshotIndex).distinct().toList();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Occurrence other : all) {
            String otherComponent = other.issue().componentOrEmpty();
            if (!otherComponent.equals(component) && snapshots.contains(other.snapshotIndex())) {
                counts.merge(otherComponent + ": " + truncate(other.issue().descriptionOrEmpty(), 80), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .map(Map.Entry::getKey)
                .limit(properties.getLearning().getMaxSecondaryCauses())
                .toList();
    }

    private LearningResult summarize(List<Learned> learned) {
        List<RootCausePattern> patterns = learned.stream().map(Learned::pattern).toList();
        int created = (int) learned.stream().filter(Learned::isNew).count();
        int candidates = (int) patterns.stream().filter(RootCausePattern::isEnhancementCandidate).count();
        double avg = patterns.stream().mapToInt(RootCausePattern::getConfidence).average().orElse(0.0);
        return LearningResult.builder()
                .patterns(patterns)
                .newPatterns(created)
                .updatedPatterns(learned.size() - created)
                .enhancementCandidates(candidates)
                .avgConfidence(Math.round(avg * 10.0) / 10.0)
                .build();
    }

    private static boolean isCandidate(int occurrences, int confidence) {
        return occurrences >= CANDIDATE_MIN_OCCURRENCES && confidence >= CANDIDATE_MIN_CONFIDENCE;
    }

    private static Long averageDuration(List<HistoricalLearning> learnings) {
        OptionalDouble avg = learnings.stream()
                .map(HistoricalLearning::getAvgDurationMs)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average();
        return avg.isPresent() ? Math.round(avg.getAsDouble()) : null;
    }

    private static String truncate(String value, int length) {
        return value.length() <= length ? value : value.substring(0, length);
    }

    private record Occurrence(Issue issue, String fingerprint, Instant timestamp, int snapshotIndex) {
    }

    private record Learned(RootCausePattern pattern, boolean isNew) {
    }
}
