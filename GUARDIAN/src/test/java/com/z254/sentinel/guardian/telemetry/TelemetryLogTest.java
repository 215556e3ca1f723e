package com.z254.sentinel.guardian.telemetry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.guardian.MutableClock;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.correlation.PredictiveAlert;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.enhancement.ApprovalResult;
import com.z254.sentinel.guardian.pipeline.PipelineResult;
import com.z254.sentinel.guardian.remediation.RemediationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TelemetryLogTest {

    @TempDir
    Path directory;

    private MutableClock clock;
    private TelemetryLog telemetry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        telemetry = new TelemetryLog(directory, new GuardianProperties().getTelemetry(),
                new ObjectMapper().findAndRegisterModules(), clock);
    }

    @Test
    void emptyLogHasEmptyAggregate() {
        assertThat(telemetry.readEvents(10)).isEmpty();
        assertThat(telemetry.getAggregate().getRemediations()).isZero();
    }

    @Test
    void remediationsFoldIntoAggregate() {
        telemetry.recordRemediation(remediation(true, 100));
        clock.advance(Duration.ofMinutes(5));
        telemetry.recordRemediation(remediation(false, 300));

        TelemetryAggregate aggregate = telemetry.getAggregate();
        assertThat(aggregate.getRemediations()).isEqualTo(2);
        assertThat(aggregate.getSuccessfulRemediations()).isEqualTo(1);
        assertThat(aggregate.getRemediationSuccessRate()).isEqualTo(50.0);
        // First sample seeds the average, then 0.2 * 300 + 0.8 * 100
        assertThat(aggregate.getAvgRemediationDurationMs()).isEqualTo(140.0);
        assertThat(aggregate.getEventCounts()).containsEntry(TelemetryEvent.Type.REMEDIATION, 2L);
        assertThat(aggregate.getLastUpdated()).isEqualTo(clock.instant());
    }

    @Test
    void eventsAreAppendedInOrder() {
        telemetry.recordVerification(PipelineResult.builder().sessionId("s-1").totalIssues(3).build());
        telemetry.recordAlert(PredictiveAlert.builder()
                .id("threshold-breach-1")
                .type(PredictiveAlert.AlertType.THRESHOLD_BREACH)
                .severity(Severity.HIGH)
                .title("overall health threshold breach imminent")
                .etaHours(2.5)
                .confidence(90)
                .build());
        telemetry.recordEnhancements(2, ApprovalResult.builder().autoApplied(1).ticketsCreated(1).build());

        List<TelemetryEvent> events = telemetry.readEvents(10);

        assertThat(events).extracting(TelemetryEvent::getType).containsExactly(
                TelemetryEvent.Type.VERIFICATION, TelemetryEvent.Type.PREDICTIVE_ALERT, TelemetryEvent.Type.ENHANCEMENT);
        assertThat(events.get(0).getPayload()).containsEntry("sessionId", "s-1");
        assertThat(events.get(2).getPayload()).containsEntry("suggested", 2);
        assertThat(telemetry.getAggregate().getAlertsBySeverity()).containsEntry(Severity.HIGH, 1L);
        assertThat(telemetry.readEvents(1)).extracting(TelemetryEvent::getType)
                .containsExactly(TelemetryEvent.Type.ENHANCEMENT);
    }

    @Test
    void malformedLinesAreSkipped() throws IOException {
        telemetry.recordRemediation(remediation(true, 50));
        Files.writeString(directory.resolve("events.jsonl"), "{not json\n", StandardOpenOption.APPEND);
        telemetry.recordRemediation(remediation(true, 50));

        assertThat(telemetry.readEvents(10)).hasSize(2);
    }

    @Test
    void concurrentWritersLoseNoUpdates() throws InterruptedException {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < writers; i++) {
            pool.submit(() -> {
                start.await();
                for (int j = 0; j < 5; j++) {
                    telemetry.recordRemediation(remediation(true, 10));
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(telemetry.getAggregate().getRemediations()).isEqualTo(40);
        assertThat(telemetry.readEvents(100)).hasSize(40);
    }

    private static RemediationResult remediation(boolean success, long durationMs) {
        return RemediationResult.builder()
                .issueId("issue-1")
                .scenarioId("framework-missing-dependencies")
                .success(success)
                .actionTaken("Installed dependencies")
                .confidence(95)
                .durationMs(durationMs)
                .build();
    }
}
