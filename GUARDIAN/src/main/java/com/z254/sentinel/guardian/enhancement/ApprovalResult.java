package com.z254.sentinel.guardian.enhancement;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome counts of one approval run.
 */
@Value
@Builder
public class ApprovalResult {

    int autoApplied;

    int approved;

    int rejected;

    int deferred;

    int ticketsCreated;

    /** Suggestions whose pattern already had a ticket */
    int ticketsSkipped;

    public static ApprovalResult empty() {
        return ApprovalResult.builder().build();
    }
}
