package com.z254.sentinel.guardian.observability;

import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics for GUARDIAN.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Monitoring cycles (runs, overlaps, duration)</li>
 *     <li>Verification (verified/unverified issues, guard rejections, confidence)</li>
 *     <li>Tickets (created, suppressed, refreshed, archived)</li>
 *     <li>Remediation outcomes and duration</li>
 *     <li>Predictive alerts and enhancement tiers</li>
 * </ul>
 */
@Component
public class GuardianMetrics {

    private final MeterRegistry meterRegistry;

    // Cycle metrics
    @Getter
    private final Counter healthCycles;
    @Getter
    private final Counter cycleOverlapsSkipped;
    @Getter
    private final Counter cleanupCycles;
    private final Timer cycleDuration;

    // Verification metrics
    @Getter
    private final Counter issuesVerified;
    @Getter
    private final Counter issuesUnverified;
    @Getter
    private final Counter guardRejections;
    @Getter
    private final Counter verifierFailures;
    private final Timer pipelineDuration;
    private final DistributionSummary verificationConfidence;

    // Ticket metrics
    @Getter
    private final Counter ticketsCreated;
    @Getter
    private final Counter ticketsSuppressed;
    @Getter
    private final Counter ticketsRefreshed;
    @Getter
    private final Counter ticketsArchived;

    // Remediation metrics
    @Getter
    private final Counter remediationsSucceeded;
    @Getter
    private final Counter remediationsFailed;
    @Getter
    private final Counter remediationsManual;
    @Getter
    private final Counter remediationsNoScenario;
    private final Timer remediationDuration;

    private final Map<String, Counter> alertsByType = new ConcurrentHashMap<>();
    private final Map<Integer, Counter> enhancementsByTier = new ConcurrentHashMap<>();

    public GuardianMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        // Initialize cycle metrics
        this.healthCycles = Counter.builder("guardian.cycles.health")
                .description("Health check cycles run")
                .register(meterRegistry);
        this.cycleOverlapsSkipped = Counter.builder("guardian.cycles.skipped")
                .description("Cycles skipped because the previous one was still running")
                .register(meterRegistry);
        this.cleanupCycles = Counter.builder("guardian.cycles.cleanup")
                .description("Ticket cleanup cycles run")
                .register(meterRegistry);
        this.cycleDuration = Timer.builder("guardian.cycles.duration")
                .description("Health check cycle duration")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        // Initialize verification metrics
        this.issuesVerified = Counter.builder("guardian.verification.verified")
                .description("Issues confirmed by ground-truth evidence")
                .register(meterRegistry);
        this.issuesUnverified = Counter.builder("guardian.verification.unverified")
                .description("Issues that could not be confirmed")
                .register(meterRegistry);
        this.guardRejections = Counter.builder("guardian.guard.rejections")
                .description("Verification runs rejected at capacity")
                .register(meterRegistry);
        this.verifierFailures = Counter.builder("guardian.verification.failures")
                .description("Verifier errors and timeouts")
                .register(meterRegistry);
        this.pipelineDuration = Timer.builder("guardian.verification.duration")
                .description("Verification pipeline duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.verificationConfidence = DistributionSummary.builder("guardian.verification.confidence")
                .description("Verification confidence scores")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);

        // Initialize ticket metrics
        this.ticketsCreated = Counter.builder("guardian.tickets.created")
                .description("Tickets written")
                .register(meterRegistry);
        this.ticketsSuppressed = Counter.builder("guardian.tickets.suppressed")
                .description("Tickets suppressed as duplicates")
                .register(meterRegistry);
        this.ticketsRefreshed = Counter.builder("guardian.tickets.refreshed")
                .description("Stale tickets refreshed")
                .register(meterRegistry);
        this.ticketsArchived = Counter.builder("guardian.tickets.archived")
                .description("Tickets archived by cleanup")
                .register(meterRegistry);

        // Initialize remediation metrics
        this.remediationsSucceeded = Counter.builder("guardian.remediations.succeeded")
                .description("Remediations completed successfully")
                .register(meterRegistry);
        this.remediationsFailed = Counter.builder("guardian.remediations.failed")
                .description("Remediations that ran and failed")
                .register(meterRegistry);
        this.remediationsManual = Counter.builder("guardian.remediations.manual")
                .description("Remediations requiring a manual fix")
                .register(meterRegistry);
        this.remediationsNoScenario = Counter.builder("guardian.remediations.no_scenario")
                .description("Issues with no matching scenario")
                .register(meterRegistry);
        this.remediationDuration = Timer.builder("guardian.remediations.duration")
                .description("Remediation execution duration")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);
    }

    /**
     * Expose the active guard session count as a gauge.
     */
    public void registerActiveSessionsGauge(Supplier<Number> activeSessions) {
        Gauge.builder("guardian.guard.active_sessions", activeSessions)
                .description("Active verification sessions")
                .register(meterRegistry);
    }

    // ========== Cycle Methods ==========

    public Timer.Sample startCycleTimer() {
        healthCycles.increment();
        return Timer.start(meterRegistry);
    }

    public void recordCycleCompleted(Timer.Sample sample) {
        sample.stop(cycleDuration);
    }

    public void recordCycleSkipped() {
        cycleOverlapsSkipped.increment();
    }

    public void recordCleanupCycle(int archived) {
        cleanupCycles.increment();
        ticketsArchived.increment(archived);
    }

    // ========== Verification Methods ==========

    public Timer.Sample startPipelineTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordPipelineCompleted(Timer.Sample sample, int verified, int unverified) {
        sample.stop(pipelineDuration);
        issuesVerified.increment(verified);
        issuesUnverified.increment(unverified);
    }

    public void recordVerificationConfidence(int confidence) {
        verificationConfidence.record(confidence);
    }

    public void recordGuardRejection() {
        guardRejections.increment();
    }

    public void recordVerifierFailure() {
        verifierFailures.increment();
    }

    // ========== Ticket Methods ==========

    public void recordTicketCreated() {
        ticketsCreated.increment();
    }

    public void recordTicketSuppressed() {
        ticketsSuppressed.increment();
    }

    public void recordTicketRefreshed() {
        ticketsRefreshed.increment();
    }

    // ========== Remediation Methods ==========

    public Timer.Sample startRemediationTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordRemediationSucceeded(Timer.Sample sample) {
        sample.stop(remediationDuration);
        remediationsSucceeded.increment();
    }

    public void recordRemediationFailed(Timer.Sample sample) {
        sample.stop(remediationDuration);
        remediationsFailed.increment();
    }

    public void recordRemediationManual() {
        remediationsManual.increment();
    }

    public void recordRemediationNoScenario() {
        remediationsNoScenario.increment();
    }

    // ========== Analysis Methods ==========

    public void recordPredictiveAlert(String type, String severity) {
        alertsByType.computeIfAbsent(type + ":" + severity, key ->
                Counter.builder("guardian.alerts")
                        .tag("type", type)
                        .tag("severity", severity)
                        .description("Predictive alerts raised")
                        .register(meterRegistry))
                .increment();
    }

    public void recordEnhancementSuggested(int tier) {
        enhancementsByTier.computeIfAbsent(tier, t ->
                Counter.builder("guardian.enhancements")
                        .tag("tier", String.valueOf(t))
                        .description("Enhancement suggestions by approval tier")
                        .register(meterRegistry))
                .increment();
    }
}
