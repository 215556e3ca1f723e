package com.z254.sentinel.guardian.ticket;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * Repository interface for ticket persistence.
 */
public interface TicketRepository {

    /**
     * All GUARDIAN tickets currently in the store, oldest first.
     */
    List<Ticket> findAll();

    /**
     * Create a ticket; fails if a ticket with the same file name already exists.
     */
    Ticket create(TicketDraft draft);

    /**
     * Rewrite a ticket under a new timestamp, keeping its name prefix and suffix.
     */
    Ticket refresh(Ticket ticket, Instant refreshedAt);

    /**
     * Move tickets created before {@code cutoff} into the archive.
     */
    CleanupResult archiveOlderThan(Instant cutoff);

    /**
     * Run {@code action} while holding the lock of every given fingerprint.
     */
    <T> T withFingerprintLocks(Collection<String> fingerprints, Supplier<T> action);
}
