package com.z254.sentinel.guardian.domain.model;

import java.util.Locale;

/**
 * Verification layer an issue is routed to.
 */
public enum Layer {
    /** Framework infrastructure: build, agents, hooks, RAG */
    FRAMEWORK,
    /** Application code of the monitored project */
    PROJECT,
    /** User, team and project preferences and conventions */
    CONTEXT;

    public String slug() {
        return name().toLowerCase(Locale.ROOT);
    }
}
