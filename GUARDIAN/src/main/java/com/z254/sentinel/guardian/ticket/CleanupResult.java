package com.z254.sentinel.guardian.ticket;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a ticket cleanup cycle.
 */
@Value
@Builder
public class CleanupResult {

    int archivedCount;

    int keptCount;

    @Singular
    List<String> errors;
}
