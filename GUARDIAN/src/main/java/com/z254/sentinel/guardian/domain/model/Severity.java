package com.z254.sentinel.guardian.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Issue and alert severity, most severe first.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Sort rank where 0 is the most severe.
     */
    public int rank() {
        return ordinal();
    }

    public boolean isAtLeast(Severity other) {
        return rank() <= other.rank();
    }

    public String slug() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
