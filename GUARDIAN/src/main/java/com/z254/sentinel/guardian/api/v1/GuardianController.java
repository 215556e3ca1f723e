package com.z254.sentinel.guardian.api.v1;

import com.z254.sentinel.guardian.correlation.CorrelationAnalysis;
import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import com.z254.sentinel.guardian.orchestration.CycleResult;
import com.z254.sentinel.guardian.orchestration.GuardianOrchestrator;
import com.z254.sentinel.guardian.orchestration.HealthHistory;
import com.z254.sentinel.guardian.telemetry.TelemetryAggregate;
import com.z254.sentinel.guardian.telemetry.TelemetryEvent;
import com.z254.sentinel.guardian.telemetry.TelemetryLog;
import com.z254.sentinel.guardian.ticket.CleanupResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * REST API controller for health cycles, history, analysis and telemetry.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/guardian")
@Tag(name = "Guardian", description = "Health cycles, history, analysis and telemetry")
public class GuardianController {

    private static final int MAX_LIMIT = 1000;

    private final GuardianOrchestrator orchestrator;
    private final HealthHistory history;
    private final TelemetryLog telemetry;

    public GuardianController(GuardianOrchestrator orchestrator,
                              HealthHistory history,
                              TelemetryLog telemetry) {
        this.orchestrator = orchestrator;
        this.history = history;
        this.telemetry = telemetry;
    }

    @PostMapping("/snapshots")
    @Operation(summary = "Submit snapshot", description = "Run a health cycle on the supplied snapshot")
    public Mono<ResponseEntity<CycleResult>> submitSnapshot(@RequestBody HealthSnapshot snapshot) {
        log.info("Snapshot submitted: overallHealth={}, issues={}",
                snapshot.getOverallHealth(), snapshot.getIssues().size());
        return orchestrator.submitSnapshot(snapshot).map(GuardianController::toResponse);
    }

    @PostMapping("/cycles")
    @Operation(summary = "Trigger health cycle", description = "Run a health cycle on the provider's snapshot now")
    public Mono<ResponseEntity<CycleResult>> triggerCycle() {
        log.info("Manual health cycle requested");
        return orchestrator.runHealthCycle().map(GuardianController::toResponse);
    }

    @GetMapping("/history")
    @Operation(summary = "Snapshot history", description = "Most recent snapshots, oldest first")
    public Mono<List<HealthSnapshot>> getHistory(
            @Parameter(description = "Maximum snapshots to return") @RequestParam(defaultValue = "20") int limit) {
        return Mono.just(history.recent(clamp(limit)));
    }

    @GetMapping("/analysis")
    @Operation(summary = "Correlation analysis", description = "Correlations, trends and predictive alerts over the history")
    public Mono<CorrelationAnalysis> getAnalysis() {
        return Mono.fromCallable(orchestrator::analyzeHistory)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/cleanup")
    @Operation(summary = "Run cleanup", description = "Archive tickets past retention")
    public Mono<ResponseEntity<CleanupResult>> runCleanup() {
        return Mono.fromCallable(() -> orchestrator.runCleanup()
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/telemetry")
    @Operation(summary = "Telemetry", description = "Aggregate metrics and the most recent events")
    public Mono<TelemetryView> getTelemetry(
            @Parameter(description = "Maximum events to return") @RequestParam(defaultValue = "50") int limit) {
        return Mono.fromCallable(() -> TelemetryView.builder()
                        .aggregate(telemetry.getAggregate())
                        .events(telemetry.readEvents(clamp(limit)))
                        .build())
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static ResponseEntity<CycleResult> toResponse(CycleResult result) {
        return result.isSkipped()
                ? ResponseEntity.status(HttpStatus.CONFLICT).body(result)
                : ResponseEntity.ok(result);
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }

    @Value
    @Builder
    public static class TelemetryView {
        TelemetryAggregate aggregate;
        List<TelemetryEvent> events;
    }
}
