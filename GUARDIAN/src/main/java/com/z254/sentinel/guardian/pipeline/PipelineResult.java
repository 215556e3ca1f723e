package com.z254.sentinel.guardian.pipeline;

import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.VerifiedIssue;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Partition of a batch into verified and unverified issues, with aggregate statistics.
 */
@Data
@Builder
public class PipelineResult {

    private String sessionId;

    private int totalIssues;

    @Builder.Default
    private List<VerifiedIssue> verified = List.of();

    /** Input issues that could not be confirmed, echoed back untouched */
    @Builder.Default
    private List<Issue> unverified = List.of();

    @Builder.Default
    private Map<Layer, LayerStats> layerStatistics = Map.of();

    private int autoApplyCount;

    private int manualReviewCount;

    /** True when the recursion guard rejected the run */
    private boolean skippedAtCapacity;

    private long durationMs;

    /**
     * Zero-effect result for a run rejected at capacity.
     */
    public static PipelineResult atCapacity(List<Issue> issues) {
        return PipelineResult.builder()
                .totalIssues(0)
                .unverified(List.copyOf(issues))
                .skippedAtCapacity(true)
                .build();
    }

    public List<VerifiedIssue> getAutoApplyIssues() {
        return verified.stream().filter(VerifiedIssue::isAutoApply).toList();
    }

    @Data
    @Builder
    public static class LayerStats {
        private int count;
        private double averageConfidence;
    }
}
