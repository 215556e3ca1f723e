package com.z254.sentinel.guardian.learning;

import com.z254.sentinel.guardian.MutableClock;
import com.z254.sentinel.guardian.classify.LayerClassifier;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger;
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
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RootCauseLearnerTest {

    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");

    @Mock
    private HistoricalLearningsClient learningsClient;

    private InMemoryRootCausePatternRepository repository;
    private RootCauseLearner learner;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRootCausePatternRepository();
        learner = new RootCauseLearner(repository, learningsClient, new LayerClassifier(), new GuardianProperties(),
                new GuardianStructuredLogger(), new MutableClock(START.plus(Duration.ofHours(4))));
    }

    @Test
    void fingerprintMasksVaryingNumbers() {
        assertThat(RootCauseLearner.fingerprint("Latency 250ms at 95% for 3   requests"))
                .isEqualTo("latency Xms at X% for N requests");
        assertThat(RootCauseLearner.fingerprint("Build took 4200ms"))
                .isEqualTo(RootCauseLearner.fingerprint("build took 3900 ms"));
        assertThat(RootCauseLearner.fingerprint(null)).isEmpty();
    }

    @Test
    void recurringIssueBecomesPattern() {
        when(learningsClient.search(anyString(), anyInt())).thenReturn(Mono.just(List.of()));

        StepVerifier.create(learner.learn(history()))
                .assertNext(result -> {
                    assertThat(result.getNewPatterns()).isEqualTo(1);
                    assertThat(result.getUpdatedPatterns()).isZero();
                    assertThat(result.getEnhancementCandidates()).isEqualTo(1);

                    RootCausePattern pattern = result.getPatterns().get(0);
                    assertThat(pattern.getComponent()).isEqualTo("build");
                    assertThat(pattern.getFingerprint()).isEqualTo("build took Xms and failed");
                    assertThat(pattern.getOccurrences()).isEqualTo(4);
                    assertThat(pattern.getLayer()).isEqualTo(Layer.FRAMEWORK);
                    assertThat(pattern.getPrimaryCause()).isEqualTo("Code defect");
                    assertThat(pattern.getSecondaryCauses()).containsExactly("rag: Vector store connection lost");
                    // 60 base + 20 for occurrences + 10 for a known component
                    assertThat(pattern.getConfidence()).isEqualTo(90);
                    assertThat(pattern.getSeverity()).isEqualTo(Severity.HIGH);
                    assertThat(pattern.getPriority()).isEqualTo(Severity.CRITICAL);
                    assertThat(pattern.spanHours()).isEqualTo(3.0);
                })
                .verifyComplete();
        assertThat(repository.findAll()).hasSize(1);
    }

    @Test
    void historicalLearningsRaiseConfidence() {
        when(learningsClient.search(anyString(), anyInt())).thenReturn(Mono.just(List.of(
                HistoricalLearning.builder().pattern("rebuild").successRate(90).manualFix("npm run build")
                        .avgDurationMs(60_000L).build(),
                HistoricalLearning.builder().pattern("clean").successRate(70).avgDurationMs(120_000L).build())));

        RootCausePattern pattern = learner.learn(history()).block().getPatterns().get(0);

        assertThat(pattern.getConfidence()).isEqualTo(RootCauseLearner.NEW_PATTERN_CAP);
        assertThat(pattern.getManualFix()).isEqualTo("npm run build");
        assertThat(pattern.getManualFixSuccessRate()).isEqualTo(80.0);
        assertThat(pattern.getAvgDurationMs()).isEqualTo(90_000L);
    }

    @Test
    void knownPatternGainsConfidence() {
        when(learningsClient.search(anyString(), anyInt())).thenReturn(Mono.just(List.of()));
        learner.learn(history()).block();

        LearningResult second = learner.learn(history()).block();

        assertThat(second.getNewPatterns()).isZero();
        assertThat(second.getUpdatedPatterns()).isEqualTo(1);
        RootCausePattern pattern = second.getPatterns().get(0);
        assertThat(pattern.getOccurrences()).isEqualTo(8);
        assertThat(pattern.getConfidence()).isEqualTo(90 + RootCauseLearner.CONFIDENCE_BOOST);
        verify(learningsClient, times(1)).search(anyString(), anyInt());
    }

    @Test
    void failingLearningsSearchFallsBack() {
        when(learningsClient.search(anyString(), anyInt())).thenReturn(Mono.error(new IllegalStateException("down")));

        StepVerifier.create(learner.learn(history()))
                .assertNext(result -> assertThat(result.getPatterns()).singleElement()
                        .extracting(RootCausePattern::getConfidence).isEqualTo(90))
                .verifyComplete();
    }

    @Test
    void occurrencesOutsideWindowAreIgnored() {
        List<HealthSnapshot> history = List.of(
                snapshot(-30, buildFailure(4100)),
                snapshot(0, buildFailure(4200)),
                snapshot(1, buildFailure(4300)));

        StepVerifier.create(learner.learn(history))
                .assertNext(result -> assertThat(result.getPatterns()).isEmpty())
                .verifyComplete();
        verify(learningsClient, never()).search(anyString(), anyInt());
    }

    @Test
    void emptyHistoryLearnsNothing() {
        StepVerifier.create(learner.learn(List.of()))
                .assertNext(result -> assertThat(result.getPatterns()).isEmpty())
                .verifyComplete();
    }

    @Test
    void priorityEscalatesWithOccurrences() {
        assertThat(RootCauseLearner.priorityOf(Severity.LOW, 10, 50)).isEqualTo(Severity.CRITICAL);
        assertThat(RootCauseLearner.priorityOf(Severity.LOW, 5, 50)).isEqualTo(Severity.HIGH);
        assertThat(RootCauseLearner.priorityOf(Severity.LOW, 3, 50)).isEqualTo(Severity.MEDIUM);
        assertThat(RootCauseLearner.priorityOf(Severity.LOW, 1, 50)).isEqualTo(Severity.LOW);
    }

    @Test
    void primaryCausePrefersDetectorHint() {
        assertThat(RootCauseLearner.inferPrimaryCause(Issue.builder().description("Cannot find module 'x'").build()))
                .isEqualTo("Dependency problem");
        assertThat(RootCauseLearner.inferPrimaryCause(Issue.builder().description("boom").rootCause("Stale cache").build()))
                .isEqualTo("Stale cache");
        assertThat(RootCauseLearner.inferPrimaryCause(Issue.builder().component("ui").description("odd").build()))
                .isEqualTo("ui component issue requiring investigation");
    }

    private static List<HealthSnapshot> history() {
        return List.of(
                snapshot(0, buildFailure(4200), Issue.builder().component("rag")
                        .description("Vector store connection lost").build()),
                snapshot(1, buildFailure(3900)),
                snapshot(2, buildFailure(4450)),
                snapshot(3, buildFailure(5100)));
    }

    private static Issue buildFailure(int millis) {
        return Issue.builder()
                .component("build")
                .severity(Severity.HIGH)
                .description("Build took " + millis + "ms and failed")
                .build();
    }

    private static HealthSnapshot snapshot(int hours, Issue... issues) {
        return HealthSnapshot.builder()
                .overallHealth(80)
                .issues(List.of(issues))
                .timestamp(START.plus(Duration.ofHours(hours)))
                .build();
    }
}
