package com.z254.sentinel.guardian.health;

import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import com.z254.sentinel.guardian.guard.RecursionGuard;
import com.z254.sentinel.guardian.orchestration.CycleResult;
import com.z254.sentinel.guardian.orchestration.GuardianOrchestrator;
import com.z254.sentinel.guardian.orchestration.HealthHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GuardianHealthIndicatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private GuardianOrchestrator orchestrator;
    private HealthHistory history;
    private RecursionGuard guard;
    private GuardianHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        orchestrator = mock(GuardianOrchestrator.class);
        history = new HealthHistory(10, CLOCK);
        guard = new RecursionGuard(2, CLOCK);
        indicator = new GuardianHealthIndicator(orchestrator, history, guard);
    }

    @Test
    void upBeforeFirstCycle() {
        when(orchestrator.getLastCycle()).thenReturn(Optional.empty());

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("lastCycle.status", "NOT_RUN")
                            .containsEntry("sessionCapacity", "AVAILABLE")
                            .containsEntry("maxSessions", 2);
                })
                .verifyComplete();
    }

    @Test
    void downWhenWorkspaceIsCritical() {
        when(orchestrator.getLastCycle()).thenReturn(Optional.of(CycleResult.builder()
                .cycleId("cycle-7")
                .startedAt(CLOCK.instant())
                .stepFailure("tickets", "read-only")
                .build()));
        history.append(HealthSnapshot.builder().overallHealth(42).build());

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails())
                            .containsEntry("lastCycle.status", "STEP_FAILURES")
                            .containsEntry("workspaceStatus", "CRITICAL")
                            .containsEntry("historySize", 1);
                })
                .verifyComplete();
    }
}
