package com.z254.sentinel.guardian.orchestration;

import com.z254.sentinel.guardian.correlation.CorrelationAnalysis;
import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import com.z254.sentinel.guardian.enhancement.ApprovalResult;
import com.z254.sentinel.guardian.enhancement.EnhancementDetectionResult;
import com.z254.sentinel.guardian.learning.LearningResult;
import com.z254.sentinel.guardian.pipeline.PipelineResult;
import com.z254.sentinel.guardian.remediation.RemediationResult;
import com.z254.sentinel.guardian.ticket.TicketWriteResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything one health cycle produced. Steps that failed or did not run are null.
 */
@Value
@Builder
public class CycleResult {

    String cycleId;

    Instant startedAt;

    long durationMs;

    /** True when another cycle was still running */
    boolean skipped;

    HealthSnapshot snapshot;

    /** True when the provider failed and a critical placeholder was recorded */
    boolean syntheticSnapshot;

    PipelineResult pipeline;

    TicketWriteResult tickets;

    @Singular
    List<RemediationResult> remediations;

    CorrelationAnalysis analysis;

    LearningResult learning;

    EnhancementDetectionResult enhancements;

    ApprovalResult approvals;

    /** Step name to error message */
    @Singular
    Map<String, String> stepFailures;

    public static CycleResult skipped(String cycleId, Instant at) {
        return CycleResult.builder()
                .cycleId(cycleId)
                .startedAt(at)
                .skipped(true)
                .build();
    }

    public boolean isSuccessful() {
        return !skipped && stepFailures.isEmpty();
    }
}
