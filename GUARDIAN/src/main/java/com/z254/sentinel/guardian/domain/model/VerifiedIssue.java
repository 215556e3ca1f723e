package com.z254.sentinel.guardian.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * An issue confirmed by ground-truth evidence, ready for ticketing or remediation.
 */
@Value
@Builder
public class VerifiedIssue {

    Issue issue;

    Layer layer;

    LayerClassification classification;

    IssueCategory category;

    boolean verified;

    /** Verification confidence (0-100) */
    int confidence;

    List<String> evidence;

    String recommendedFix;

    String assignedAgent;

    boolean autoApply;

    Severity priority;

    Instant createdAt;
}
