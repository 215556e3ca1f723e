package com.z254.sentinel.guardian.ticket;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.VerifiedIssue;
import com.z254.sentinel.guardian.observability.GuardianMetrics;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger.TicketEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Writes deduplicated, grouped tickets for verified issues and archives old ones.
 */
@Slf4j
@Service
public class TicketService {

    private static final long SUFFIX_BOUND = 36L * 36 * 36 * 36 * 36 * 36;

    private final TicketRepository repository;
    private final TicketDeduplicator deduplicator;
    private final TicketGrouper grouper;
    private final GuardianProperties.Tickets config;
    private final GuardianMetrics metrics;
    private final GuardianStructuredLogger logger;
    private final Clock clock;

    public TicketService(TicketRepository repository,
                         TicketDeduplicator deduplicator,
                         TicketGrouper grouper,
                         GuardianProperties properties,
                         GuardianMetrics metrics,
                         GuardianStructuredLogger logger,
                         Clock clock) {
        this.repository = repository;
        this.deduplicator = deduplicator;
        this.grouper = grouper;
        this.config = properties.getTickets();
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    /**
     * Write tickets for verified issues.
     * <p>
     * Issues whose fingerprint already has a recent ticket are suppressed, stale tickets are
     * refreshed, and the remaining issues are written one ticket per group.
     */
    public TicketWriteResult writeTickets(List<VerifiedIssue> issues) {
        TicketWriteResult.TicketWriteResultBuilder result = TicketWriteResult.builder();
        Set<String> handled = new HashSet<>();
        int suppressed = 0;

        for (IssueGroup group : grouper.group(issues)) {
            Map<String, VerifiedIssue> byFingerprint = new LinkedHashMap<>();
            for (VerifiedIssue issue : group.getIssues()) {
                String fingerprint = fingerprintOf(issue);
                if (handled.add(fingerprint)) {
                    byFingerprint.put(fingerprint, issue);
                } else {
                    suppressed++;
                    metrics.recordTicketSuppressed();
                }
            }
            if (byFingerprint.isEmpty()) {
                continue;
            }
            try {
                suppressed += repository.withFingerprintLocks(byFingerprint.keySet(),
                        () -> writeGroup(group, byFingerprint, result));
            } catch (TicketStoreException e) {
                logger.logTicketEvent(group.getKey(), TicketEventType.WRITE_FAILED,
                        "Failed to write ticket group", Map.of("error", e.getMessage()));
                result.failure(group.getKey() + ": " + e.getMessage());
            }
        }
        return result.suppressedCount(suppressed).build();
    }

    /**
     * Archive tickets older than the retention period.
     */
    public CleanupResult cleanup() {
        Instant cutoff = clock.instant().minus(config.getRetention());
        CleanupResult result = repository.archiveOlderThan(cutoff);
        metrics.recordCleanupCycle(result.getArchivedCount());
        if (result.getArchivedCount() > 0) {
            logger.logTicketEvent(null, TicketEventType.ARCHIVED, "Archived old tickets",
                    Map.of("archived", result.getArchivedCount(),
                            "kept", result.getKeptCount(),
                            "errors", result.getErrors().size()));
        }
        return result;
    }

    public List<Ticket> listTickets() {
        return repository.findAll();
    }

    public String fingerprintOf(VerifiedIssue issue) {
        return TicketFingerprint.of(issue.getIssue().getDescription(), config.getFingerprintLength());
    }

    /**
     * Random lower-case alphanumeric file-name suffix.
     */
    public static String newSuffix() {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(SUFFIX_BOUND), 36);
        return "0".repeat(6 - suffix.length()) + suffix;
    }

    // ========== Private Methods ==========

    private int writeGroup(IssueGroup group, Map<String, VerifiedIssue> byFingerprint,
                           TicketWriteResult.TicketWriteResultBuilder result) {
        Instant now = clock.instant();
        List<Ticket> existing = new ArrayList<>(repository.findAll());
        Set<String> refreshedNames = new HashSet<>();
        List<Map.Entry<String, VerifiedIssue>> fresh = new ArrayList<>();
        int suppressed = 0;

        for (Map.Entry<String, VerifiedIssue> entry : byFingerprint.entrySet()) {
            TicketDeduplicator.Decision decision = deduplicator.check(entry.getKey(), existing, now);
            switch (decision.status()) {
                case NEW -> fresh.add(entry);
                case DUPLICATE -> {
                    suppressed++;
                    metrics.recordTicketSuppressed();
                    logger.logTicketEvent(decision.existing().getFileName(), TicketEventType.SUPPRESSED,
                            "Duplicate issue suppressed", Map.of("fingerprint", entry.getKey()));
                }
                case STALE -> {
                    if (refreshedNames.add(decision.existing().getFileName())) {
                        Ticket refreshed = repository.refresh(decision.existing(), now);
                        existing.remove(decision.existing());
                        existing.add(refreshed);
                        result.refreshedTicket(refreshed.getFileName());
                        metrics.recordTicketRefreshed();
                        logger.logTicketEvent(refreshed.getFileName(), TicketEventType.REFRESHED,
                                "Stale ticket refreshed",
                                Map.of("previous", decision.existing().getFileName()));
                    }
                }
            }
        }

        if (!fresh.isEmpty()) {
            Ticket ticket = repository.create(draftFor(group, fresh, now));
            result.createdTicket(ticket.getFileName());
            metrics.recordTicketCreated();
            logger.logTicketEvent(ticket.getFileName(), TicketEventType.CREATED, "Ticket created",
                    Map.of("group", group.getKey(), "issues", fresh.size()));
        }
        return suppressed;
    }

    private TicketDraft draftFor(IssueGroup group, List<Map.Entry<String, VerifiedIssue>> issues, Instant now) {
        TicketName name = TicketName.of(group.getAgent(), group.getPriority(), group.getLayer(), now, newSuffix());
        TicketDraft.TicketDraftBuilder draft = TicketDraft.builder()
                .name(name)
                .frontMatterEntry(TicketDocument.AGENT, String.valueOf(group.getAgent()))
                .frontMatterEntry(TicketDocument.PRIORITY, group.getPriority().slug())
                .frontMatterEntry(TicketDocument.LAYER, group.getLayer().slug())
                .frontMatterEntry(TicketDocument.CREATED, now.toString())
                .frontMatterEntry(TicketDocument.FINGERPRINT, issues.get(0).getKey())
                .frontMatterEntry(TicketDocument.COUNT, String.valueOf(issues.size()));
        for (Map.Entry<String, VerifiedIssue> entry : issues) {
            VerifiedIssue issue = entry.getValue();
            draft.line(entry.getKey()
                    + " | component=" + issue.getIssue().componentOrEmpty()
                    + " | severity=" + issue.getPriority().slug()
                    + " | confidence=" + issue.getConfidence()
                    + " | fix=" + (issue.getRecommendedFix() != null ? issue.getRecommendedFix() : ""));
        }
        return draft.build();
    }
}
