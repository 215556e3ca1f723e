package com.z254.sentinel.guardian.ticket;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of writing tickets for one batch of verified issues.
 */
@Value
@Builder
public class TicketWriteResult {

    @Singular
    List<String> createdTickets;

    @Singular
    List<String> refreshedTickets;

    int suppressedCount;

    @Singular
    List<String> failures;
}
