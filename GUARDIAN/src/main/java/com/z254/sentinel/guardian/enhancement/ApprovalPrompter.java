package com.z254.sentinel.guardian.enhancement;

/**
 * Asks an operator whether a Tier 2 suggestion should be applied.
 * <p>
 * Used only in {@code INTERACTIVE} approval mode.
 */
@FunctionalInterface
public interface ApprovalPrompter {

    Decision prompt(EnhancementSuggestion suggestion);

    enum Decision {
        APPROVE,
        REJECT,
        DEFER
    }
}
