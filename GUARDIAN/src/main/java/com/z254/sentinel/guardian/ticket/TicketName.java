package com.z254.sentinel.guardian.ticket;

import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.Severity;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Metadata carried by a ticket file name.
 * <p>
 * Format: {@code guardian-<agentSlug>-<priority>-<layer>-<epochMillis>-<suffix>.md}. The agent
 * slug may itself contain hyphens, so the remaining fields are parsed from the right.
 *
 * @param agentSlug  lower-case agent slug
 * @param priority   ticket priority
 * @param layer      verification layer
 * @param createdAt  creation time, millisecond precision
 * @param suffix     alphanumeric discriminator
 */
public record TicketName(String agentSlug, Severity priority, Layer layer, Instant createdAt, String suffix) {

    public static final String PREFIX = "guardian-";
    public static final String EXTENSION = ".md";

    private static final Pattern FILE_NAME = Pattern.compile(
            "^guardian-([a-z0-9]+(?:-[a-z0-9]+)*)-(critical|high|medium|low)-(framework|project|context)"
                    + "-(\\d{1,19})-([a-z0-9]+)\\.md$");

    public TicketName {
        if (suffix == null || !suffix.matches("[a-z0-9]+")) {
            throw new IllegalArgumentException("Ticket suffix must be lower-case alphanumeric: " + suffix);
        }
    }

    /**
     * Build a name from a display agent name such as {@code Dr.AI-ML}.
     */
    public static TicketName of(String agent, Severity priority, Layer layer, Instant createdAt, String suffix) {
        return new TicketName(slug(agent), priority, layer, createdAt, suffix);
    }

    /**
     * Parse a file name; names without the {@code guardian-} prefix or in another shape are ignored.
     */
    public static Optional<TicketName> parse(String fileName) {
        if (fileName == null || !fileName.startsWith(PREFIX)) {
            return Optional.empty();
        }
        Matcher matcher = FILE_NAME.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new TicketName(
                    matcher.group(1),
                    Severity.fromValue(matcher.group(2)),
                    Layer.valueOf(matcher.group(3).toUpperCase(Locale.ROOT)),
                    Instant.ofEpochMilli(Long.parseLong(matcher.group(4))),
                    matcher.group(5)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static String slug(String value) {
        if (value == null || value.isBlank()) {
            return "unassigned";
        }
        String slug = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "unassigned" : slug;
    }

    /**
     * Everything before the timestamp; kept when a stale ticket is refreshed.
     */
    public String prefix() {
        return PREFIX + agentSlug + "-" + priority.slug() + "-" + layer.slug();
    }

    public String fileName() {
        return prefix() + "-" + createdAt.toEpochMilli() + "-" + suffix + EXTENSION;
    }

    public TicketName withCreatedAt(Instant newCreatedAt) {
        return new TicketName(agentSlug, priority, layer, newCreatedAt, suffix);
    }

    public boolean isEnhancement() {
        return agentSlug.startsWith("enhancement-");
    }
}
