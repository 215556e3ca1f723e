package com.z254.sentinel.guardian.enhancement;

import lombok.extern.slf4j.Slf4j;

/**
 * Prompter for unattended runs: every suggestion is deferred to a ticket.
 */
@Slf4j
public class DeferringApprovalPrompter implements ApprovalPrompter {

    @Override
    public Decision prompt(EnhancementSuggestion suggestion) {
        log.debug("No operator attached, deferring suggestion {}", suggestion.getId());
        return Decision.DEFER;
    }
}
