package com.z254.sentinel.guardian.ticket;

import com.z254.sentinel.guardian.config.GuardianProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Decides whether an issue fingerprint needs a new ticket.
 * <p>
 * A fingerprint found in a ticket created inside the staleness window is a duplicate; found
 * only in older tickets it is stale and the newest of those is refreshed.
 */
@Component
public class TicketDeduplicator {

    private final Duration stalenessWindow;

    public TicketDeduplicator(GuardianProperties properties) {
        this(properties.getTickets().getStalenessWindow());
    }

    TicketDeduplicator(Duration stalenessWindow) {
        this.stalenessWindow = stalenessWindow;
    }

    public Decision check(String fingerprint, List<Ticket> existing, Instant now) {
        Ticket newest = existing.stream()
                .filter(ticket -> !ticket.getName().isEnhancement())
                .filter(ticket -> ticket.mentions(fingerprint))
                .max(Comparator.comparing(Ticket::getCreatedAt))
                .orElse(null);
        if (newest == null) {
            return new Decision(Status.NEW, null);
        }
        boolean fresh = newest.getCreatedAt().isAfter(now.minus(stalenessWindow));
        return new Decision(fresh ? Status.DUPLICATE : Status.STALE, newest);
    }

    public enum Status {
        NEW,
        DUPLICATE,
        STALE
    }

    /**
     * @param status   dedup outcome
     * @param existing the matching ticket; null for {@link Status#NEW}
     */
    public record Decision(Status status, Ticket existing) {
    }
}
