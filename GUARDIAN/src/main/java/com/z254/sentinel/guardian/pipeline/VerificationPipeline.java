package com.z254.sentinel.guardian.pipeline;

import com.z254.sentinel.guardian.classify.LayerClassifier;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.IssueCategory;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.LayerClassification;
import com.z254.sentinel.guardian.domain.model.VerificationResult;
import com.z254.sentinel.guardian.domain.model.VerifiedIssue;
import com.z254.sentinel.guardian.domain.model.WorkingContext;
import com.z254.sentinel.guardian.guard.RecursionGuard;
import com.z254.sentinel.guardian.observability.GuardianMetrics;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger.VerificationEventType;
import com.z254.sentinel.guardian.verify.GroundTruthVerifier;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chain-of-verification pipeline.
 * <p>
 * Per run:
 * <ol>
 *     <li>Reserve a recursion guard session, or skip the run at capacity</li>
 *     <li>Classify each issue into a layer</li>
 *     <li>Verify it with the layer's ground-truth verifier</li>
 *     <li>Assign a remediation agent</li>
 *     <li>Decide auto-apply eligibility against the layer threshold</li>
 * </ol>
 * A failing or timed-out verification moves its issue to the unverified list; the batch
 * always completes.
 */
@Slf4j
@Service
public class VerificationPipeline {

    private final LayerClassifier classifier;
    private final IssueCategorizer categorizer;
    private final AgentRouter agentRouter;
    private final RecursionGuard recursionGuard;
    private final Map<Layer, GroundTruthVerifier> verifiers = new EnumMap<>(Layer.class);
    private final GuardianProperties properties;
    private final GuardianMetrics metrics;
    private final GuardianStructuredLogger logger;
    private final Clock clock;

    public VerificationPipeline(LayerClassifier classifier,
                                IssueCategorizer categorizer,
                                AgentRouter agentRouter,
                                RecursionGuard recursionGuard,
                                List<GroundTruthVerifier> verifiers,
                                GuardianProperties properties,
                                GuardianMetrics metrics,
                                GuardianStructuredLogger logger,
                                Clock clock) {
        this.classifier = classifier;
        this.categorizer = categorizer;
        this.agentRouter = agentRouter;
        this.recursionGuard = recursionGuard;
        this.properties = properties;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
        for (GroundTruthVerifier verifier : verifiers) {
            if (this.verifiers.put(verifier.layer(), verifier) != null) {
                throw new IllegalStateException("Duplicate verifier for layer " + verifier.layer());
            }
        }
    }

    /**
     * Verify a batch of issues.
     *
     * @return the partitioned result; a run rejected at capacity echoes every issue as unverified
     */
    public Mono<PipelineResult> run(List<Issue> issues, WorkingContext context) {
        return Mono.defer(() -> {
            Optional<RecursionGuard.Session> session = recursionGuard.tryAcquire(context.key());
            if (session.isEmpty()) {
                metrics.recordGuardRejection();
                logger.logVerificationEvent(null, VerificationEventType.SESSION_REJECTED,
                        "Verification skipped, recursion guard at capacity",
                        Map.of("activeSessions", recursionGuard.getActiveSessions(),
                                "maxSessions", recursionGuard.getMaxSessions(),
                                "issues", issues.size()));
                return Mono.just(PipelineResult.atCapacity(issues));
            }
            return Mono.using(session::get,
                    held -> verifyBatch(issues, context, held.getId()),
                    RecursionGuard.Session::close);
        });
    }

    /**
     * Auto-apply threshold for a layer.
     */
    public int autoApplyThreshold(Layer layer) {
        GuardianProperties.Verification config = properties.getVerification();
        return switch (layer) {
            case FRAMEWORK -> config.getFrameworkAutoApplyThreshold();
            case PROJECT -> config.getProjectAutoApplyThreshold();
            case CONTEXT -> config.getContextAutoApplyThreshold();
        };
    }

    // ========== Private Methods ==========

    private Mono<PipelineResult> verifyBatch(List<Issue> issues, WorkingContext context, String sessionId) {
        Instant start = clock.instant();
        Timer.Sample sample = metrics.startPipelineTimer();
        logger.logVerificationEvent(sessionId, VerificationEventType.SESSION_STARTED,
                "Starting three-layer verification", Map.of("issues", issues.size()));

        int parallelism = properties.getVerification().getParallelism();
        return Flux.fromIterable(issues)
                .flatMapSequential(issue -> verifyOne(issue, context, sessionId), parallelism)
                .collectList()
                .map(outcomes -> {
                    PipelineResult result = assemble(outcomes, sessionId, Duration.between(start, clock.instant()));
                    metrics.recordPipelineCompleted(sample, result.getVerified().size(), result.getUnverified().size());
                    logger.logVerificationEvent(sessionId, VerificationEventType.SESSION_COMPLETED,
                            "Verification complete",
                            Map.of("verified", result.getVerified().size(),
                                    "total", result.getTotalIssues(),
                                    "autoApply", result.getAutoApplyCount(),
                                    "manualReview", result.getManualReviewCount()));
                    return result;
                });
    }

    private Mono<Outcome> verifyOne(Issue issue, WorkingContext context, String sessionId) {
        Duration timeout = properties.getVerification().getVerifierTimeout();
        return Mono.fromCallable(() -> classifier.classify(issue))
                .flatMap(classification -> Mono.fromCallable(() -> verifierFor(classification.getLayer())
                                .map(verifier -> verifier.verify(issue, context))
                                .orElseGet(() -> VerificationResult.unverified(
                                        "No verifier for layer " + classification.getLayer())))
                        .subscribeOn(Schedulers.boundedElastic())
                        .timeout(timeout)
                        .map(verification -> toOutcome(issue, classification, verification, context, sessionId)))
                .onErrorResume(error -> {
                    metrics.recordVerifierFailure();
                    logger.logVerificationEvent(sessionId, VerificationEventType.VERIFIER_FAILED,
                            "Verification failed, issue left unverified",
                            Map.of("component", issue.componentOrEmpty(),
                                    "error", String.valueOf(error.getMessage())));
                    return Mono.just(new Outcome(issue, null, null));
                });
    }

    private Outcome toOutcome(Issue issue, LayerClassification classification, VerificationResult verification,
                              WorkingContext context, String sessionId) {
        if (!verification.isVerified()) {
            logger.logVerificationEvent(sessionId, VerificationEventType.ISSUE_UNVERIFIED,
                    "Issue not confirmed",
                    Map.of("component", issue.componentOrEmpty(), "layer", classification.getLayer().name()));
            return new Outcome(issue, classification, null);
        }

        IssueCategory category = categorizer.categorize(issue);
        if (category == IssueCategory.UNKNOWN) {
            logger.logVerificationEvent(sessionId, VerificationEventType.UNKNOWN_CATEGORY,
                    "Issue category not recognised, using default routing",
                    Map.of("component", issue.componentOrEmpty()));
        }

        Layer layer = classification.getLayer();
        String agent = agentRouter.route(layer, category, verification, context.getExecutionContext());
        boolean autoApply = verification.getConfidence() >= autoApplyThreshold(layer);

        VerifiedIssue verified = VerifiedIssue.builder()
                .issue(issue)
                .layer(layer)
                .classification(classification)
                .category(category)
                .verified(true)
                .confidence(verification.getConfidence())
                .evidence(verification.getEvidence())
                .recommendedFix(verification.getRecommendedFix())
                .assignedAgent(agent)
                .autoApply(autoApply)
                .priority(issue.getSeverity())
                .createdAt(clock.instant())
                .build();

        metrics.recordVerificationConfidence(verified.getConfidence());
        logger.logVerificationEvent(sessionId, VerificationEventType.ISSUE_VERIFIED,
                "Issue verified",
                Map.of("component", issue.componentOrEmpty(),
                        "layer", layer.name(),
                        "confidence", verified.getConfidence(),
                        "agent", agent,
                        "autoApply", autoApply));
        return new Outcome(issue, classification, verified);
    }

    private PipelineResult assemble(List<Outcome> outcomes, String sessionId, Duration duration) {
        List<VerifiedIssue> verified = new ArrayList<>();
        List<Issue> unverified = new ArrayList<>();
        Map<Layer, int[]> counts = new EnumMap<>(Layer.class);

        for (Outcome outcome : outcomes) {
            if (outcome.classification() != null) {
                int[] entry = counts.computeIfAbsent(outcome.classification().getLayer(), layer -> new int[2]);
                entry[0]++;
                entry[1] += outcome.classification().getConfidence();
            }
            if (outcome.verified() != null) {
                verified.add(outcome.verified());
            } else {
                unverified.add(outcome.issue());
            }
        }

        Map<Layer, PipelineResult.LayerStats> stats = new EnumMap<>(Layer.class);
        counts.forEach((layer, entry) -> stats.put(layer, PipelineResult.LayerStats.builder()
                .count(entry[0])
                .averageConfidence(Math.round(entry[1] * 10.0 / entry[0]) / 10.0)
                .build()));

        int autoApply = (int) verified.stream().filter(VerifiedIssue::isAutoApply).count();
        return PipelineResult.builder()
                .sessionId(sessionId)
                .totalIssues(outcomes.size())
                .verified(List.copyOf(verified))
                .unverified(List.copyOf(unverified))
                .layerStatistics(stats)
                .autoApplyCount(autoApply)
                .manualReviewCount(verified.size() - autoApply)
                .durationMs(duration.toMillis())
                .build();
    }

    private Optional<GroundTruthVerifier> verifierFor(Layer layer) {
        return Optional.ofNullable(verifiers.get(layer));
    }

    private record Outcome(Issue issue, LayerClassification classification, VerifiedIssue verified) {
    }
}
