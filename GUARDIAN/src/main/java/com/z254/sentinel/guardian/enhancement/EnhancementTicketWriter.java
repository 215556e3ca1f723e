package com.z254.sentinel.guardian.enhancement;

import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.ticket.Ticket;
import com.z254.sentinel.guardian.ticket.TicketDocument;
import com.z254.sentinel.guardian.ticket.TicketDraft;
import com.z254.sentinel.guardian.ticket.TicketName;
import com.z254.sentinel.guardian.ticket.TicketRepository;
import com.z254.sentinel.guardian.ticket.TicketService;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Files enhancement suggestions as {@code guardian-enhancement-*} tickets, one per pattern.
 */
@Component
public class EnhancementTicketWriter {

    private final TicketRepository repository;
    private final Clock clock;

    public EnhancementTicketWriter(TicketRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Write a ticket for the suggestion.
     *
     * @return the new ticket, or empty when its pattern already has one
     */
    public Optional<Ticket> write(EnhancementSuggestion suggestion) {
        String patternId = suggestion.getRootCausePatternId();
        return repository.withFingerprintLocks(List.of("pattern:" + patternId), () -> {
            boolean exists = repository.findAll().stream()
                    .anyMatch(ticket -> patternId.equals(ticket.getPatternId()));
            if (exists) {
                return Optional.empty();
            }
            return Optional.of(repository.create(draftFor(suggestion, clock.instant())));
        });
    }

    private TicketDraft draftFor(EnhancementSuggestion suggestion, Instant now) {
        Severity priority = suggestion.getPriority() != null ? suggestion.getPriority() : Severity.MEDIUM;
        Layer layer = suggestion.getLayer() != null ? suggestion.getLayer() : Layer.PROJECT;
        TicketName name = TicketName.of("enhancement-" + suggestion.getAssignedAgent(),
                priority, layer, now, TicketService.newSuffix());
        EnhancementSuggestion.Roi roi = suggestion.getRoi();

        TicketDraft.TicketDraftBuilder draft = TicketDraft.builder()
                .name(name)
                .frontMatterEntry(TicketDocument.AGENT, suggestion.getAssignedAgent())
                .frontMatterEntry(TicketDocument.PRIORITY, priority.slug())
                .frontMatterEntry(TicketDocument.LAYER, layer.slug())
                .frontMatterEntry(TicketDocument.CREATED, now.toString())
                .frontMatterEntry(TicketDocument.PATTERN, suggestion.getRootCausePatternId())
                .frontMatterEntry("category", suggestion.getCategory().slug())
                .frontMatterEntry("tier", String.valueOf(suggestion.getApprovalTier()))
                .line(suggestion.getTitle())
                .line(suggestion.getDescription())
                .line("approval: " + suggestion.getApprovalReason())
                .line("effort: " + suggestion.getEffortHours() + "h | confidence: " + suggestion.getConfidence() + "%")
                .line("roi: " + roi.getHoursSavedPerWeek() + "h saved/week | "
                        + roi.getInterventionsEliminated() + " interventions/week | ratio " + roi.getRoiRatio());
        int step = 1;
        for (String implementationStep : suggestion.getImplementationSteps()) {
            draft.line("step " + step++ + ": " + implementationStep);
        }
        for (String fix : suggestion.getEvidence().getSimilarFixes()) {
            draft.line("similar fix: " + fix);
        }
        return draft.build();
    }
}
