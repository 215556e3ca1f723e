package com.z254.sentinel.guardian.enhancement;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.config.GuardianProperties.ApprovalMode;
import com.z254.sentinel.guardian.observability.GuardianStructuredLogger;
import com.z254.sentinel.guardian.remediation.RemediationResult;
import com.z254.sentinel.guardian.ticket.Ticket;
import com.z254.sentinel.guardian.ticket.TicketStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnhancementApprovalServiceTest {

    @Mock
    private EnhancementExecutor executor;

    @Mock
    private EnhancementTicketWriter ticketWriter;

    @Mock
    private ApprovalPrompter prompter;

    @Test
    void tier1IsAppliedWithoutTicket() {
        EnhancementSuggestion suggestion = suggestion("a", 1);
        when(executor.apply(suggestion)).thenReturn(result(true));

        ApprovalResult result = service(ApprovalMode.MANUAL).process(List.of(suggestion));

        assertThat(result.getAutoApplied()).isEqualTo(1);
        assertThat(result.getTicketsCreated()).isZero();
        verifyNoInteractions(ticketWriter);
    }

    @Test
    void failedApplyFallsBackToTicket() {
        EnhancementSuggestion suggestion = suggestion("a", 1);
        when(executor.apply(suggestion)).thenReturn(result(false));
        when(ticketWriter.write(suggestion)).thenReturn(Optional.of(mock(Ticket.class)));

        ApprovalResult result = service(ApprovalMode.MANUAL).process(List.of(suggestion));

        assertThat(result.getAutoApplied()).isZero();
        assertThat(result.getTicketsCreated()).isEqualTo(1);
    }

    @Test
    void tier2IsDeferredInManualMode() {
        EnhancementSuggestion suggestion = suggestion("b", 2);
        when(ticketWriter.write(suggestion)).thenReturn(Optional.of(mock(Ticket.class)));

        ApprovalResult result = service(ApprovalMode.MANUAL).process(List.of(suggestion));

        assertThat(result.getDeferred()).isEqualTo(1);
        assertThat(result.getTicketsCreated()).isEqualTo(1);
        verifyNoInteractions(executor, prompter);
    }

    @Test
    void tier2IsAppliedInAutoMode() {
        EnhancementSuggestion suggestion = suggestion("b", 2);
        when(executor.apply(suggestion)).thenReturn(result(true));

        ApprovalResult result = service(ApprovalMode.AUTO).process(List.of(suggestion));

        assertThat(result.getAutoApplied()).isEqualTo(1);
    }

    @Test
    void interactiveModeFollowsPrompter() {
        EnhancementSuggestion approved = suggestion("approve", 2);
        EnhancementSuggestion rejected = suggestion("reject", 2);
        EnhancementSuggestion deferred = suggestion("defer", 2);
        when(prompter.prompt(approved)).thenReturn(ApprovalPrompter.Decision.APPROVE);
        when(prompter.prompt(rejected)).thenReturn(ApprovalPrompter.Decision.REJECT);
        when(prompter.prompt(deferred)).thenReturn(ApprovalPrompter.Decision.DEFER);
        when(executor.apply(approved)).thenReturn(result(true));
        when(ticketWriter.write(deferred)).thenReturn(Optional.empty());

        ApprovalResult result = service(ApprovalMode.INTERACTIVE).process(List.of(approved, rejected, deferred));

        assertThat(result.getApproved()).isEqualTo(1);
        assertThat(result.getAutoApplied()).isZero();
        assertThat(result.getRejected()).isEqualTo(1);
        assertThat(result.getDeferred()).isEqualTo(1);
        assertThat(result.getTicketsSkipped()).isEqualTo(1);
        verify(ticketWriter, never()).write(rejected);
    }

    @Test
    void tier3AlwaysBecomesTicket() {
        EnhancementSuggestion suggestion = suggestion("c", 3);
        when(ticketWriter.write(suggestion)).thenReturn(Optional.of(mock(Ticket.class)));

        ApprovalResult result = service(ApprovalMode.AUTO).process(List.of(suggestion));

        assertThat(result.getTicketsCreated()).isEqualTo(1);
        verifyNoInteractions(executor);
    }

    @Test
    void ticketStoreFailureDoesNotStopOtherSuggestions() {
        EnhancementSuggestion failing = suggestion("c1", 3);
        EnhancementSuggestion next = suggestion("c2", 3);
        when(ticketWriter.write(failing)).thenThrow(new TicketStoreException("disk full", new IOException("disk full")));
        when(ticketWriter.write(next)).thenReturn(Optional.of(mock(Ticket.class)));

        ApprovalResult result = service(ApprovalMode.MANUAL).process(List.of(failing, next));

        assertThat(result.getTicketsCreated()).isEqualTo(1);
        verify(ticketWriter).write(next);
    }

    private EnhancementApprovalService service(ApprovalMode mode) {
        GuardianProperties properties = new GuardianProperties();
        properties.getEnhancement().setApprovalMode(mode);
        return new EnhancementApprovalService(executor, ticketWriter, prompter, properties,
                new GuardianStructuredLogger());
    }

    private static EnhancementSuggestion suggestion(String id, int tier) {
        return EnhancementSuggestion.builder()
                .id("enhancement-" + id)
                .title("Improve " + id)
                .rootCausePatternId(id)
                .approvalTier(tier)
                .build();
    }

    private static RemediationResult result(boolean success) {
        return RemediationResult.builder()
                .success(success)
                .actionTaken(success ? "Installed dependencies" : "Command exited with 1")
                .build();
    }
}
