package com.z254.sentinel.guardian.orchestration;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.correlation.CorrelationAnalysis;
import com.z254.sentinel.guardian.correlation.PatternCorrelator;
import com.z254.sentinel.guardian.correlation.PredictiveAlert;
import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.domain.model.VerifiedIssue;
import com.z254.sentinel.guardian.domain.model.WorkingContext;
import com.z254.sentinel.guardian.enhancement.ApprovalResult;
import com.z254.sentinel.guardian.enhancement.EnhancementApprovalService;
import com.z254.sentinel.guardian.enhancement.EnhancementDetectionResult;
import com.z254.sentinel.guardian.enhancement.EnhancementDetector;
import com.z254.sentinel.guardian.learning.LearningResult;
import com.z254.sentinel.guardian.learning.RootCauseLearner;
import com.z254.sentinel.guardian.observability.GuardianMetrics;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger.CycleEventType;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger.EnhancementEventType;
import com.z254.sentinel.guardian.pipeline.PipelineResult;
import com.z254.sentinel.guardian.pipeline.VerificationPipeline;
import com.z254.sentinel.guardian.remediation.AutoRemediationEngine;
import com.z254.sentinel.guardian.remediation.RemediationRequest;
import com.z254.sentinel.guardian.remediation.RemediationResult;
import com.z254.sentinel.guardian.telemetry.TelemetryLog;
import com.z254.sentinel.guardian.ticket.CleanupResult;
import com.z254.sentinel.guardian.ticket.TicketService;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Drives the monitoring cycle.
 * <p>
 * A health cycle takes a snapshot, verifies its issues, writes tickets, auto-remediates,
 * correlates the history and learns from recurring issues. Each step is contained: a
 * failing step is logged and recorded on the {@link CycleResult} and the cycle moves on.
 * The health and cleanup cycles each skip a trigger that arrives while they are still running.
 */
@Slf4j
@Service
public class GuardianOrchestrator {

    static final int MIN_LEARNING_SNAPSHOTS = 3;
    static final String GUARDIAN_COMPONENT = "guardian";

    private final HealthCheckProvider healthCheckProvider;
    private final HealthHistory history;
    private final VerificationPipeline pipeline;
    private final TicketService ticketService;
    private final AutoRemediationEngine remediationEngine;
    private final PatternCorrelator correlator;
    private final RootCauseLearner learner;
    private final EnhancementDetector enhancementDetector;
    private final EnhancementApprovalService approvalService;
    private final TelemetryLog telemetry;
    private final GuardianProperties properties;
    private final GuardianMetrics metrics;
    private final GuardianStructuredLogger logger;
    private final Clock clock;

    private final AtomicBoolean healthCycleRunning = new AtomicBoolean(false);
    private final AtomicBoolean cleanupRunning = new AtomicBoolean(false);
    private volatile CycleResult lastCycle;

    public GuardianOrchestrator(HealthCheckProvider healthCheckProvider,
                                HealthHistory history,
                                VerificationPipeline pipeline,
                                TicketService ticketService,
                                AutoRemediationEngine remediationEngine,
                                PatternCorrelator correlator,
                                RootCauseLearner learner,
                                EnhancementDetector enhancementDetector,
                                EnhancementApprovalService approvalService,
                                TelemetryLog telemetry,
                                GuardianProperties properties,
                                GuardianMetrics metrics,
                                GuardianStructuredLogger logger,
                                Clock clock) {
        this.healthCheckProvider = healthCheckProvider;
        this.history = history;
        this.pipeline = pipeline;
        this.ticketService = ticketService;
        this.remediationEngine = remediationEngine;
        this.correlator = correlator;
        this.learner = learner;
        this.enhancementDetector = enhancementDetector;
        this.approvalService = approvalService;
        this.telemetry = telemetry;
        this.properties = properties;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    // ========== Scheduled Entry Points ==========

    @Scheduled(fixedRateString = "${guardian.schedule.health-check-interval:PT30M}",
            initialDelayString = "${guardian.schedule.initial-delay:PT1M}")
    public void scheduledHealthCycle() {
        runHealthCycle().block();
    }

    @Scheduled(fixedRateString = "${guardian.schedule.cleanup-interval:PT30M}",
            initialDelayString = "${guardian.schedule.initial-delay:PT1M}")
    public void scheduledCleanup() {
        if (!properties.getSchedule().isCleanupEnabled()) {
            return;
        }
        runCleanup();
    }

    // ========== Health Cycle ==========

    /**
     * Run a health cycle on a snapshot from the configured provider.
     */
    public Mono<CycleResult> runHealthCycle() {
        return runGuarded(this::loadSnapshot);
    }

    /**
     * Run a health cycle on a snapshot pushed by a caller.
     */
    public Mono<CycleResult> submitSnapshot(HealthSnapshot snapshot) {
        return runGuarded(() -> new LoadedSnapshot(snapshot, false));
    }

    // ========== Cleanup Cycle ==========

    /**
     * Archive expired tickets.
     *
     * @return the cleanup result, or empty when a cleanup is already running
     */
    public Optional<CleanupResult> runCleanup() {
        String cycleId = newCycleId("cleanup");
        if (!cleanupRunning.compareAndSet(false, true)) {
            metrics.recordCycleSkipped();
            logger.logCycleEvent(cycleId, CycleEventType.SKIPPED_OVERLAP,
                    "Cleanup cycle still running, skipping", Map.of());
            return Optional.empty();
        }
        try {
            CleanupResult result = ticketService.cleanup();
            logger.logCycleEvent(cycleId, CycleEventType.CLEANUP_COMPLETED, "Cleanup cycle completed",
                    Map.of("archived", result.getArchivedCount(), "kept", result.getKeptCount()));
            return Optional.of(result);
        } catch (RuntimeException e) {
            logger.logCycleEvent(cycleId, CycleEventType.FAILED, "Cleanup cycle failed",
                    Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        } finally {
            cleanupRunning.set(false);
        }
    }

    public Optional<CycleResult> getLastCycle() {
        return Optional.ofNullable(lastCycle);
    }

    public boolean isHealthCycleRunning() {
        return healthCycleRunning.get();
    }

    public CorrelationAnalysis analyzeHistory() {
        return correlator.analyze(history.snapshots());
    }

    // ========== Private Methods ==========

    private Mono<CycleResult> runGuarded(Supplier<LoadedSnapshot> snapshotSource) {
        return Mono.defer(() -> {
            String cycleId = newCycleId("cycle");
            if (!healthCycleRunning.compareAndSet(false, true)) {
                metrics.recordCycleSkipped();
                logger.logCycleEvent(cycleId, CycleEventType.SKIPPED_OVERLAP,
                        "Health cycle still running, skipping", Map.of());
                return Mono.just(CycleResult.skipped(cycleId, clock.instant()));
            }
            return Mono.fromCallable(() -> executeCycle(cycleId, snapshotSource))
                    .subscribeOn(Schedulers.boundedElastic())
                    .doOnNext(result -> lastCycle = result)
                    .doFinally(signal -> healthCycleRunning.set(false));
        });
    }

    private CycleResult executeCycle(String cycleId, Supplier<LoadedSnapshot> snapshotSource) {
        Instant startedAt = clock.instant();
        Timer.Sample sample = metrics.startCycleTimer();
        CycleResult.CycleResultBuilder result = CycleResult.builder()
                .cycleId(cycleId)
                .startedAt(startedAt);

        try (var scope = logger.withContext(Map.of(GuardianStructuredLogger.MDC_CYCLE_ID, cycleId))) {
            logger.logCycleEvent(cycleId, CycleEventType.STARTED, "Health cycle started", Map.of());

            LoadedSnapshot loaded = snapshotSource.get();
            HealthSnapshot snapshot = history.append(loaded.snapshot());
            result.snapshot(snapshot).syntheticSnapshot(loaded.synthetic());

            PipelineResult pipelineResult = step(cycleId, "verification", result,
                    () -> pipeline.run(snapshot.getIssues(), workingContext()).block());
            result.pipeline(pipelineResult);

            if (pipelineResult != null) {
                step(cycleId, "telemetry.verification", result, () -> {
                    telemetry.recordVerification(pipelineResult);
                    return null;
                });
                result.tickets(step(cycleId, "tickets", result,
                        () -> ticketService.writeTickets(pipelineResult.getVerified())));
                List<RemediationResult> remediations = step(cycleId, "remediation", result,
                        () -> remediate(pipelineResult));
                if (remediations != null) {
                    result.remediations(remediations);
                }
            }

            CorrelationAnalysis analysis = step(cycleId, "correlation", result, this::correlate);
            result.analysis(analysis);

            if (properties.getEnhancement().isEnabled() && history.size() >= MIN_LEARNING_SNAPSHOTS) {
                learn(cycleId, result);
            }

            result.durationMs(Duration.between(startedAt, clock.instant()).toMillis());
            CycleResult cycle = result.build();
            metrics.recordCycleCompleted(sample);
            logger.logCycleEvent(cycleId, CycleEventType.COMPLETED, "Health cycle completed",
                    Map.of("overallHealth", snapshot.getOverallHealth(),
                            "issues", snapshot.getIssues().size(),
                            "failedSteps", cycle.getStepFailures().size(),
                            "durationMs", cycle.getDurationMs()));
            return cycle;
        }
    }

    private LoadedSnapshot loadSnapshot() {
        try {
            HealthSnapshot snapshot = healthCheckProvider.performHealthCheck().block();
            if (snapshot == null) {
                return new LoadedSnapshot(syntheticSnapshot("Health check returned no snapshot"), true);
            }
            return new LoadedSnapshot(snapshot, false);
        } catch (RuntimeException e) {
            log.error("Health check failed, recording critical snapshot: {}", e.getMessage());
            return new LoadedSnapshot(syntheticSnapshot("Health check failed: " + e.getMessage()), true);
        }
    }

    private HealthSnapshot syntheticSnapshot(String reason) {
        return HealthSnapshot.builder()
                .overallHealth(0)
                .issue(Issue.builder()
                        .component(GUARDIAN_COMPONENT)
                        .severity(Severity.CRITICAL)
                        .description(reason)
                        .build())
                .timestamp(clock.instant())
                .build();
    }

    private List<RemediationResult> remediate(PipelineResult pipelineResult) {
        List<RemediationResult> results = new ArrayList<>();
        int index = 0;
        for (VerifiedIssue issue : pipelineResult.getAutoApplyIssues()) {
            String issueId = pipelineResult.getSessionId() + "-" + index++;
            RemediationResult remediation = remediationEngine.execute(RemediationRequest.builder()
                    .issueId(issueId)
                    .issue(issue.getIssue())
                    .executionContext(properties.getExecutionContext())
                    .workingDirectory(Path.of(properties.getWorkingDirectory()))
                    .build());
            results.add(remediation);
            telemetry.recordRemediation(remediation);
        }
        return results;
    }

    private CorrelationAnalysis correlate() {
        CorrelationAnalysis analysis = correlator.analyze(history.snapshots());
        for (PredictiveAlert alert : analysis.getPredictiveAlerts()) {
            metrics.recordPredictiveAlert(alert.getType().name(), alert.getSeverity().name());
            logger.logEnhancementEvent(alert.getId(), EnhancementEventType.ALERT_RAISED, alert.getTitle(),
                    Map.of("type", alert.getType().name(),
                            "severity", alert.getSeverity().name(),
                            "confidence", alert.getConfidence()));
            telemetry.recordAlert(alert);
        }
        return analysis;
    }

    private void learn(String cycleId, CycleResult.CycleResultBuilder result) {
        LearningResult learning = step(cycleId, "learning", result,
                () -> learner.learn(history.snapshots()).block());
        result.learning(learning);
        if (learning == null || learning.getEnhancementCandidates() == 0) {
            return;
        }

        EnhancementDetectionResult detection = step(cycleId, "enhancement-detection", result,
                () -> enhancementDetector.detect(learning.getPatterns()).block());
        result.enhancements(detection);
        if (detection == null || detection.getSuggestions().isEmpty()) {
            return;
        }

        ApprovalResult approvals = step(cycleId, "enhancement-approval", result, () -> {
            ApprovalResult approval = approvalService.process(detection.getSuggestions());
            telemetry.recordEnhancements(detection.getSuggestions().size(), approval);
            return approval;
        });
        result.approvals(approvals);
    }

    /**
     * Run one step, recording a failure instead of propagating it.
     *
     * @return the step's value, or null when it failed
     */
    private <T> T step(String cycleId, String name, CycleResult.CycleResultBuilder result, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logger.logCycleEvent(cycleId, CycleEventType.STEP_FAILED, "Cycle step failed: " + name,
                    Map.of("step", name, "error", message));
            log.debug("Step {} failure", name, e);
            result.stepFailure(name, message);
            return null;
        }
    }

    private WorkingContext workingContext() {
        return WorkingContext.builder()
                .workingDirectory(Path.of(properties.getWorkingDirectory()))
                .executionContext(properties.getExecutionContext())
                .build();
    }

    private String newCycleId(String kind) {
        return kind + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private record LoadedSnapshot(HealthSnapshot snapshot, boolean synthetic) {
    }
}
