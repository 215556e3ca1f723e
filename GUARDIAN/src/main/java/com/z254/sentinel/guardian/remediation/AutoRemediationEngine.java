package com.z254.sentinel.guardian.remediation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.ExecutionContext;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.observability.GuardianMetrics;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger.RemediationEventType;
import com.z254.sentinel.guardian.verify.CommandRunner;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Auto-remediation engine.
 * <p>
 * Matches an issue against the scenario registry and either runs the scenario's fix
 * procedure or reports the manual steps. Every path returns a {@link RemediationResult};
 * nothing here throws for a miss or a failed fix.
 */
@Slf4j
@Service
public class AutoRemediationEngine {

    private final RemediationScenarioRegistry registry;
    private final GuardianMetrics metrics;
    private final GuardianStructuredLogger logger;
    private final Clock clock;

    @Autowired
    public AutoRemediationEngine(GuardianProperties properties,
                                 CommandRunner commandRunner,
                                 ObjectMapper objectMapper,
                                 GuardianMetrics metrics,
                                 GuardianStructuredLogger logger,
                                 Clock clock) {
        this(new RemediationScenarioRegistry(
                        new RemediationCatalogue(properties, commandRunner, objectMapper).scenarios()),
                metrics, logger, clock);
    }

    AutoRemediationEngine(RemediationScenarioRegistry registry,
                          GuardianMetrics metrics,
                          GuardianStructuredLogger logger,
                          Clock clock) {
        this.registry = registry;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
        log.info("Auto-remediation engine initialized with {} scenarios", registry.getScenarios().size());
    }

    /**
     * Remediate on the bounded-elastic scheduler; fix procedures block on external commands.
     */
    public Mono<RemediationResult> remediate(RemediationRequest request) {
        return Mono.fromCallable(() -> execute(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Remediate on the calling thread.
     */
    public RemediationResult execute(RemediationRequest request) {
        Instant start = clock.instant();
        Issue issue = request.getIssue();
        String issueId = request.getIssueId();

        Optional<RemediationScenario> match = registry.match(issue, request.getExecutionContext());
        if (match.isEmpty()) {
            metrics.recordRemediationNoScenario();
            logger.logRemediationEvent(issueId, RemediationEventType.NO_SCENARIO,
                    "No remediation scenario matched",
                    Map.of("component", issue.componentOrEmpty(),
                            "context", request.getExecutionContext().name()));
            return RemediationResult.builder()
                    .success(false)
                    .issueId(issueId)
                    .actionTaken(RemediationResult.NO_MATCH_ACTION)
                    .confidence(0)
                    .durationMs(elapsed(start))
                    .beforeState(issue.descriptionOrEmpty())
                    .afterState(issue.descriptionOrEmpty())
                    .nextStep(RemediationResult.MANUAL_INVESTIGATION)
                    .nextStep("Review the " + issue.componentOrEmpty() + " component logs")
                    .timestamp(clock.instant())
                    .build();
        }

        RemediationScenario scenario = match.get();
        if (!scenario.isAutoFixable()) {
            metrics.recordRemediationManual();
            logger.logRemediationEvent(issueId, RemediationEventType.MANUAL_REQUIRED,
                    "Scenario requires a manual fix", Map.of("scenario", scenario.getId()));
            return RemediationResult.builder()
                    .success(false)
                    .issueId(issueId)
                    .scenarioId(scenario.getId())
                    .actionTaken(scenario.getDescription() + " - manual fix required")
                    .confidence(scenario.getConfidence())
                    .durationMs(elapsed(start))
                    .beforeState(issue.descriptionOrEmpty())
                    .afterState(issue.descriptionOrEmpty())
                    .learned(true)
                    .lesson(scenario.getDescription() + " needs manual intervention")
                    .nextSteps(scenario.getManualSteps())
                    .timestamp(clock.instant())
                    .build();
        }

        return runFix(scenario, request, start);
    }

    public Optional<RemediationScenario> findScenario(Issue issue, ExecutionContext context) {
        return registry.match(issue, context);
    }

    public List<RemediationScenario> getScenarios() {
        return registry.getScenarios();
    }

    public List<RemediationScenario> getScenarios(ExecutionContext context) {
        return registry.forContext(context);
    }

    // ========== Private Methods ==========

    private RemediationResult runFix(RemediationScenario scenario, RemediationRequest request, Instant start) {
        String issueId = request.getIssueId();
        Timer.Sample sample = metrics.startRemediationTimer();
        logger.logRemediationEvent(issueId, RemediationEventType.STARTED, "Starting remediation",
                Map.of("scenario", scenario.getId(), "confidence", scenario.getConfidence()));

        RemediationResult.RemediationResultBuilder result = RemediationResult.builder()
                .issueId(issueId)
                .scenarioId(scenario.getId())
                .confidence(scenario.getConfidence());
        try {
            FixOutcome outcome = scenario.getFixProcedure().apply(request);
            boolean learned = outcome.getLesson() != null && !outcome.getLesson().isBlank();
            result.success(outcome.isSuccess())
                    .actionTaken(outcome.getActionTaken())
                    .beforeState(outcome.getBeforeState())
                    .afterState(outcome.getAfterState())
                    .learned(learned)
                    .lesson(outcome.getLesson())
                    .nextSteps(outcome.getNextSteps());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.success(false)
                    .actionTaken(scenario.getDescription() + " - interrupted")
                    .afterState("Interrupted")
                    .nextStep(RemediationResult.MANUAL_INVESTIGATION);
        } catch (Exception e) {
            result.success(false)
                    .actionTaken(scenario.getDescription() + " - fix procedure failed")
                    .beforeState(request.getIssue().descriptionOrEmpty())
                    .afterState("Error: " + e.getMessage())
                    .nextStep(RemediationResult.MANUAL_INVESTIGATION);
        }

        RemediationResult built = result.durationMs(elapsed(start)).timestamp(clock.instant()).build();
        if (built.isSuccess()) {
            metrics.recordRemediationSucceeded(sample);
            logger.logRemediationEvent(issueId, RemediationEventType.COMPLETED, "Remediation succeeded",
                    Map.of("scenario", scenario.getId(), "durationMs", built.getDurationMs()));
        } else {
            metrics.recordRemediationFailed(sample);
            logger.logRemediationEvent(issueId, RemediationEventType.FAILED, "Remediation failed",
                    Map.of("scenario", scenario.getId(),
                            "afterState", String.valueOf(built.getAfterState())));
        }
        return built;
    }

    private long elapsed(Instant start) {
        return Math.max(0, clock.instant().toEpochMilli() - start.toEpochMilli());
    }
}
