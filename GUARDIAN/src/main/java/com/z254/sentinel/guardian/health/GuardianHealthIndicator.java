package com.z254.sentinel.guardian.health;

import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import com.z254.sentinel.guardian.guard.RecursionGuard;
import com.z254.sentinel.guardian.orchestration.CycleResult;
import com.z254.sentinel.guardian.orchestration.GuardianOrchestrator;
import com.z254.sentinel.guardian.orchestration.HealthHistory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Health indicator for the GUARDIAN service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Last health cycle time and outcome</li>
 *     <li>Latest overall health of the monitored workspace</li>
 *     <li>Verification session capacity</li>
 * </ul>
 * DOWN when the latest snapshot is critical.
 */
@Component
public class GuardianHealthIndicator implements ReactiveHealthIndicator {

    private final GuardianOrchestrator orchestrator;
    private final HealthHistory history;
    private final RecursionGuard recursionGuard;

    public GuardianHealthIndicator(GuardianOrchestrator orchestrator,
                                   HealthHistory history,
                                   RecursionGuard recursionGuard) {
        this.orchestrator = orchestrator;
        this.history = history;
        this.recursionGuard = recursionGuard;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        Optional<CycleResult> lastCycle = orchestrator.getLastCycle();
        if (lastCycle.isPresent()) {
            details.put("lastCycle.id", lastCycle.get().getCycleId());
            details.put("lastCycle.startedAt", String.valueOf(lastCycle.get().getStartedAt()));
            details.put("lastCycle.status", lastCycle.get().isSuccessful() ? "OK" : "STEP_FAILURES");
        } else {
            details.put("lastCycle.status", "NOT_RUN");
        }
        details.put("cycleRunning", orchestrator.isHealthCycleRunning());

        Optional<HealthSnapshot> latest = history.latest();
        if (latest.isPresent()) {
            details.put("overallHealth", latest.get().getOverallHealth());
            details.put("workspaceStatus", latest.get().getStatus().name());
            if (latest.get().getStatus() == HealthSnapshot.Status.CRITICAL) {
                healthy = false;
            }
        }

        details.put("activeSessions", recursionGuard.getActiveSessions());
        details.put("maxSessions", recursionGuard.getMaxSessions());
        details.put("sessionCapacity", recursionGuard.isAtCapacity() ? "AT_LIMIT" : "AVAILABLE");
        details.put("historySize", history.size());

        return healthy
                ? Health.up().withDetails(details).build()
                : Health.down().withDetails(details).build();
    }
}
