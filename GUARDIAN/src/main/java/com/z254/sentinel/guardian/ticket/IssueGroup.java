package com.z254.sentinel.guardian.ticket;

import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.domain.model.VerifiedIssue;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Verified issues that share one ticket.
 */
@Value
@Builder
public class IssueGroup {

    /** Group key, with a {@code -partN} suffix when an oversized group was split */
    String key;

    String agent;

    Severity priority;

    Layer layer;

    List<VerifiedIssue> issues;
}
