package com.z254.sentinel.guardian.domain.model;

import java.util.Locale;

/**
 * Closed set of issue categories used for agent routing and ticket metadata.
 */
public enum IssueCategory {
    BUILD_FAILURE,
    COMPILE_ERROR,
    AGENT_INVALID,
    HOOK_ERROR,
    MCP_ERROR,
    RAG_HEALTH,
    TEST_FAILURE,
    TEST_COVERAGE,
    SECURITY_VULNERABILITY,
    CODE_QUALITY,
    ACCESSIBILITY,
    PERFORMANCE,
    DATABASE,
    DEPENDENCY,
    STYLE_VIOLATION,
    CONVENTION_VIOLATION,
    VISION_MISALIGNMENT,
    PREFERENCE_MISMATCH,
    UNKNOWN;

    public String slug() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
