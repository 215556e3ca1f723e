package com.z254.sentinel.guardian.ticket;

import java.util.Locale;

/**
 * Normalized issue fingerprint used for ticket deduplication.
 */
public final class TicketFingerprint {

    public static final int DEFAULT_LENGTH = 100;

    private TicketFingerprint() {
    }

    /**
     * Lower-case the description, collapse whitespace and keep the first {@code length} characters.
     */
    public static String of(String description, int length) {
        if (description == null) {
            return "";
        }
        String normalized = description.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        return normalized.length() <= length ? normalized : normalized.substring(0, length).trim();
    }

    public static String of(String description) {
        return of(description, DEFAULT_LENGTH);
    }
}
