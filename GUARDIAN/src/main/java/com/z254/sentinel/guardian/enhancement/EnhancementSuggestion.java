package com.z254.sentinel.guardian.enhancement;

import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A proposed framework or project change that would stop a recurring issue.
 */
@Value
@Builder(toBuilder = true)
public class EnhancementSuggestion {

    String id;

    String title;

    String description;

    EnhancementCategory category;

    Severity priority;

    int confidence;

    String rootCausePatternId;

    /** Recurring issue the enhancement addresses */
    String component;

    String issueDescription;

    Severity issueSeverity;

    Layer layer;

    List<String> implementationSteps;

    double effortHours;

    String assignedAgent;

    Roi roi;

    Evidence evidence;

    /** 1 = auto-apply, 2 = approval required, 3 = manual review */
    int approvalTier;

    boolean approvalRequired;

    String approvalReason;

    boolean autoApplicable;

    boolean requiresManualReview;

    Instant createdAt;

    @Value
    @Builder
    public static class Roi {
        double hoursSavedPerWeek;
        int interventionsEliminated;
        double reliabilityImprovement;
        double roiRatio;
    }

    @Value
    @Builder
    public static class Evidence {
        int occurrences;
        int successRate;
        List<String> similarFixes;
    }
}
