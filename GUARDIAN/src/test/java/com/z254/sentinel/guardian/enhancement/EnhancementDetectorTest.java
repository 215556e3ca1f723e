package com.z254.sentinel.guardian.enhancement;

import com.z254.sentinel.guardian.MutableClock;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.learning.HistoricalLearning;
import com.z254.sentinel.guardian.learning.HistoricalLearningsClient;
import com.z254.sentinel.guardian.learning.RootCausePattern;
import com.z254.sentinel.guardian.observability.GuardianMetrics;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnhancementDetectorTest {

    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");

    @Mock
    private HistoricalLearningsClient learningsClient;

    private SimpleMeterRegistry registry;
    private EnhancementDetector detector;

    @BeforeEach
    void setUp() {
        GuardianProperties properties = new GuardianProperties();
        registry = new SimpleMeterRegistry();
        detector = new EnhancementDetector(learningsClient, new ApprovalTierPolicy(properties), properties,
                new GuardianMetrics(registry), new GuardianStructuredLogger(), new MutableClock(START));
    }

    @Test
    void provenQuickFixIsTier1() {
        when(learningsClient.search(eq("Agents directory listing flaked"), anyInt())).thenReturn(Mono.just(List.of(
                HistoricalLearning.builder().pattern("listing flake fix").successRate(98).effortHours(0.05).build())));

        StepVerifier.create(detector.detect(List.of(pattern("root-cause-1", "agents",
                        "Agents directory listing flaked", 97, Severity.HIGH))))
                .assertNext(result -> {
                    assertThat(result.getPatternsAnalyzed()).isEqualTo(1);
                    EnhancementSuggestion suggestion = result.getSuggestions().get(0);
                    assertThat(suggestion.getId()).isEqualTo("enhancement-root-cause-1");
                    assertThat(suggestion.getCategory()).isEqualTo(EnhancementCategory.RELIABILITY);
                    assertThat(suggestion.getTitle()).isEqualTo("Improve agents reliability");
                    assertThat(suggestion.getImplementationSteps()).hasSize(4);
                    assertThat(suggestion.getEffortHours()).isEqualTo(1.0);
                    assertThat(suggestion.getApprovalTier()).isEqualTo(1);
                    assertThat(suggestion.isAutoApplicable()).isTrue();
                    assertThat(suggestion.isApprovalRequired()).isFalse();
                    assertThat(suggestion.getAssignedAgent()).isEqualTo("Sarah-PM");
                    assertThat(suggestion.getEvidence().getSuccessRate()).isEqualTo(98);
                    assertThat(suggestion.getEvidence().getSimilarFixes()).containsExactly("listing flake fix (98% success)");
                })
                .verifyComplete();
        assertThat(registry.get("guardian.enhancements").tag("tier", "1").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unavailableLearningsFallBackToStepEstimate() {
        when(learningsClient.search(anyString(), anyInt())).thenReturn(Mono.error(new IllegalStateException("down")));

        EnhancementSuggestion suggestion = detector.detect(List.of(pattern("root-cause-2", "agents",
                        "Agents directory listing flaked", 97, Severity.HIGH)))
                .block().getSuggestions().get(0);

        assertThat(suggestion.getEffortHours()).isEqualTo(4.0);
        assertThat(suggestion.getEvidence().getSuccessRate()).isEqualTo(EnhancementDetector.DEFAULT_SUCCESS_RATE);
        assertThat(suggestion.getEvidence().getSimilarFixes()).isEmpty();
        assertThat(suggestion.getApprovalTier()).isEqualTo(2);
    }

    @Test
    void nonCandidatesAreSkipped() {
        RootCausePattern lowConfidence = pattern("root-cause-3", "rag", "Memory pressure", 75, Severity.MEDIUM);

        StepVerifier.create(detector.detect(List.of(lowConfidence)))
                .assertNext(result -> {
                    assertThat(result.getPatternsAnalyzed()).isEqualTo(1);
                    assertThat(result.getSuggestions()).isEmpty();
                    assertThat(result.getAvgConfidence()).isZero();
                })
                .verifyComplete();
    }

    @Test
    void suggestionsAreSortedByPriority() {
        when(learningsClient.search(anyString(), anyInt())).thenReturn(Mono.just(List.of()));

        EnhancementDetectionResult result = detector.detect(List.of(
                pattern("root-cause-4", "tests", "Flaky test suite", 85, Severity.MEDIUM),
                pattern("root-cause-5", "build", "Build fails on clean checkout", 88, Severity.CRITICAL))).block();

        assertThat(result.getSuggestions()).extracting(EnhancementSuggestion::getRootCausePatternId)
                .containsExactly("root-cause-5", "root-cause-4");
        assertThat(result.getHighPriorityCount()).isEqualTo(1);
        assertThat(result.getAvgConfidence()).isEqualTo(87);
    }

    @Test
    void categoryFollowsManualFixAndKeywords() {
        RootCausePattern proven = pattern("p", "build", "Build failed", 90, Severity.HIGH).toBuilder()
                .manualFix("npm run build").manualFixSuccessRate(85.0).build();

        assertThat(EnhancementDetector.categorize(proven)).isEqualTo(EnhancementCategory.AUTO_REMEDIATION);
        assertThat(EnhancementDetector.categorize(pattern("p", "deps", "Security vulnerability in lodash", 90, Severity.HIGH)))
                .isEqualTo(EnhancementCategory.SECURITY);
        assertThat(EnhancementDetector.categorize(pattern("p", "rag", "Memory usage at 92%", 90, Severity.HIGH)))
                .isEqualTo(EnhancementCategory.PERFORMANCE);
        assertThat(EnhancementDetector.categorize(pattern("p", "disk", "Disk threshold reached", 90, Severity.HIGH)))
                .isEqualTo(EnhancementCategory.MONITORING);
    }

    @Test
    void effortAddsBuffersForCriticalAndComplexPatterns() {
        RootCausePattern complex = pattern("p", "build", "Build failed", 90, Severity.CRITICAL).toBuilder()
                .secondaryCauses(List.of("a", "b", "c"))
                .build();
        List<String> steps = List.of("1", "2", "3", "4");

        // 4h * 1.2 * 1.15 = 5.52h, rounded to the nearest half hour
        assertThat(EnhancementDetector.estimateEffort(complex, steps, List.of())).isEqualTo(5.5);
    }

    @Test
    void roiScalesOccurrencesToAWeek() {
        EnhancementSuggestion.Roi roi = EnhancementDetector.roi(
                pattern("p", "agents", "Listing flaked", 97, Severity.HIGH), 1.0);

        // 6 occurrences over 12h is 84 per week at a quarter hour each
        assertThat(roi.getInterventionsEliminated()).isEqualTo(84);
        assertThat(roi.getHoursSavedPerWeek()).isEqualTo(21.0);
        assertThat(roi.getReliabilityImprovement()).isEqualTo(50.0);
        assertThat(roi.getRoiRatio()).isCloseTo(1092.0, within(0.1));
    }

    @Test
    void agentFollowsLayerAndCategory() {
        RootCausePattern rag = pattern("p", "rag", "Slow recall", 90, Severity.HIGH);
        RootCausePattern ui = pattern("p", "frontend", "Broken layout", 90, Severity.HIGH).toBuilder()
                .layer(Layer.PROJECT).build();

        assertThat(EnhancementDetector.assignAgent(rag, EnhancementCategory.PERFORMANCE)).isEqualTo("Dr.AI-ML");
        assertThat(EnhancementDetector.assignAgent(ui, EnhancementCategory.RELIABILITY)).isEqualTo("James-Frontend");
        assertThat(EnhancementDetector.assignAgent(ui, EnhancementCategory.SECURITY)).isEqualTo("Marcus-Backend");
    }

    private static RootCausePattern pattern(String id, String component, String description,
                                            int confidence, Severity severity) {
        return RootCausePattern.builder()
                .id(id)
                .fingerprint(description.toLowerCase())
                .description(description)
                .component(component)
                .layer(Layer.FRAMEWORK)
                .primaryCause("Code defect")
                .occurrences(6)
                .firstSeen(START)
                .lastSeen(START.plus(Duration.ofHours(12)))
                .confidence(confidence)
                .severity(severity)
                .priority(severity)
                .enhancementCandidate(true)
                .build();
    }
}
