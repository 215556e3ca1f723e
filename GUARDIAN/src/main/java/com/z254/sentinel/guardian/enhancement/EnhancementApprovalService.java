package com.z254.sentinel.guardian.enhancement;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.config.GuardianProperties.ApprovalMode;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger.EnhancementEventType;
import com.z254.sentinel.guardian.remediation.RemediationResult;
import com.z254.sentinel.guardian.ticket.Ticket;
import com.z254.sentinel.guardian.ticket.TicketStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes enhancement suggestions by approval tier.
 * <ul>
 *     <li>Tier 1 is applied; a failed apply falls back to a ticket</li>
 *     <li>Tier 2 follows the configured {@link ApprovalMode}</li>
 *     <li>Tier 3 always becomes a ticket</li>
 * </ul>
 */
@Slf4j
@Service
public class EnhancementApprovalService {

    private final EnhancementExecutor executor;
    private final EnhancementTicketWriter ticketWriter;
    private final ApprovalPrompter prompter;
    private final ApprovalMode mode;
    private final GuardianStructuredLogger logger;

    public EnhancementApprovalService(EnhancementExecutor executor,
                                      EnhancementTicketWriter ticketWriter,
                                      ApprovalPrompter prompter,
                                      GuardianProperties properties,
                                      GuardianStructuredLogger logger) {
        this.executor = executor;
        this.ticketWriter = ticketWriter;
        this.prompter = prompter;
        this.mode = properties.getEnhancement().getApprovalMode();
        this.logger = logger;
    }

    public ApprovalResult process(List<EnhancementSuggestion> suggestions) {
        Counts counts = new Counts();
        for (EnhancementSuggestion suggestion : suggestions) {
            switch (suggestion.getApprovalTier()) {
                case 1 -> applyOrFile(suggestion, counts, false);
                case 2 -> handleTier2(suggestion, counts);
                default -> fileTicket(suggestion, counts);
            }
        }
        return counts.toResult();
    }

    // ========== Private Methods ==========

    private void handleTier2(EnhancementSuggestion suggestion, Counts counts) {
        switch (mode) {
            case AUTO -> applyOrFile(suggestion, counts, false);
            case MANUAL -> defer(suggestion, counts, "Manual approval mode");
            case INTERACTIVE -> {
                ApprovalPrompter.Decision decision = prompter.prompt(suggestion);
                switch (decision) {
                    case APPROVE -> {
                        logger.logEnhancementEvent(suggestion.getId(), EnhancementEventType.APPROVED,
                                "Enhancement approved", Map.of("title", suggestion.getTitle()));
                        applyOrFile(suggestion, counts, true);
                    }
                    case REJECT -> {
                        counts.rejected++;
                        logger.logEnhancementEvent(suggestion.getId(), EnhancementEventType.REJECTED,
                                "Enhancement rejected", Map.of("title", suggestion.getTitle()));
                    }
                    case DEFER -> defer(suggestion, counts, "Deferred by prompter");
                }
            }
        }
    }

    private void applyOrFile(EnhancementSuggestion suggestion, Counts counts, boolean approved) {
        RemediationResult result = executor.apply(suggestion);
        if (result.isSuccess()) {
            if (approved) {
                counts.approved++;
            } else {
                counts.autoApplied++;
            }
            logger.logEnhancementEvent(suggestion.getId(), EnhancementEventType.AUTO_APPLIED,
                    "Enhancement applied", Map.of("action", result.getActionTaken(),
                            "tier", suggestion.getApprovalTier()));
            return;
        }
        logger.logEnhancementEvent(suggestion.getId(), EnhancementEventType.APPLY_FAILED,
                "Enhancement could not be applied, filing ticket",
                Map.of("action", String.valueOf(result.getActionTaken())));
        fileTicket(suggestion, counts);
    }

    private void defer(EnhancementSuggestion suggestion, Counts counts, String reason) {
        counts.deferred++;
        logger.logEnhancementEvent(suggestion.getId(), EnhancementEventType.DEFERRED, reason,
                Map.of("title", suggestion.getTitle()));
        fileTicket(suggestion, counts);
    }

    private void fileTicket(EnhancementSuggestion suggestion, Counts counts) {
        try {
            Optional<Ticket> ticket = ticketWriter.write(suggestion);
            if (ticket.isPresent()) {
                counts.ticketsCreated++;
                log.info("Filed enhancement ticket {} for pattern {}",
                        ticket.get().getFileName(), suggestion.getRootCausePatternId());
            } else {
                counts.ticketsSkipped++;
                log.debug("Enhancement ticket already exists for pattern {}", suggestion.getRootCausePatternId());
            }
        } catch (TicketStoreException e) {
            log.error("Failed to file enhancement ticket for {}: {}", suggestion.getId(), e.getMessage());
        }
    }

    private static final class Counts {
        int autoApplied;
        int approved;
        int rejected;
        int deferred;
        int ticketsCreated;
        int ticketsSkipped;

        ApprovalResult toResult() {
            return ApprovalResult.builder()
                    .autoApplied(autoApplied)
                    .approved(approved)
                    .rejected(rejected)
                    .deferred(deferred)
                    .ticketsCreated(ticketsCreated)
                    .ticketsSkipped(ticketsSkipped)
                    .build();
        }
    }
}
