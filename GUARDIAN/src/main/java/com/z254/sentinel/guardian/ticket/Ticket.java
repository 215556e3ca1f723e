package com.z254.sentinel.guardian.ticket;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A ticket file in the ticket directory.
 */
@Value
@Builder(toBuilder = true)
public class Ticket {

    TicketName name;

    /** Front matter keys in file order */
    @Builder.Default
    Map<String, String> frontMatter = Map.of();

    String body;

    public String getFileName() {
        return name.fileName();
    }

    public Instant getCreatedAt() {
        return name.createdAt();
    }

    public String getFingerprint() {
        return frontMatter.getOrDefault(TicketDocument.FINGERPRINT, "");
    }

    public int getCount() {
        try {
            return Integer.parseInt(frontMatter.getOrDefault(TicketDocument.COUNT, "1"));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    /**
     * Root-cause pattern id of an enhancement ticket, if any.
     */
    public String getPatternId() {
        return frontMatter.get(TicketDocument.PATTERN);
    }

    public boolean mentions(String fingerprint) {
        return !fingerprint.isEmpty()
                && (fingerprint.equals(getFingerprint()) || (body != null && body.contains(fingerprint)));
    }
}
