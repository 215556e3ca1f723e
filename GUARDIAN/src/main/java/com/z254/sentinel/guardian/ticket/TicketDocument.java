package com.z254.sentinel.guardian.ticket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ticket file format: a YAML front matter block between {@code ---} lines, followed by
 * one markdown list item per issue.
 */
@Slf4j
public final class TicketDocument {

    public static final String AGENT = "agent";
    public static final String PRIORITY = "priority";
    public static final String LAYER = "layer";
    public static final String CREATED = "created";
    public static final String FINGERPRINT = "fingerprint";
    public static final String COUNT = "count";
    public static final String PATTERN = "pattern";

    private static final String DELIMITER = "---";

    private static final YAMLMapper YAML = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .disable(YAMLGenerator.Feature.SPLIT_LINES)
            .build();

    private static final TypeReference<LinkedHashMap<String, Object>> FRONT_MATTER_TYPE = new TypeReference<>() {
    };

    private TicketDocument() {
    }

    static String render(Map<String, String> frontMatter, List<String> lines) {
        Map<String, String> values = new LinkedHashMap<>();
        frontMatter.forEach((key, value) -> values.put(key, value == null ? "" : value));

        StringBuilder sb = new StringBuilder(DELIMITER).append('\n');
        if (!values.isEmpty()) {
            try {
                sb.append(YAML.writeValueAsString(values));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Failed to render ticket front matter", e);
            }
        }
        sb.append(DELIMITER).append('\n');
        for (String line : lines) {
            sb.append("- ").append(singleLine(line)).append('\n');
        }
        return sb.toString();
    }

    /**
     * Front matter of a ticket file; empty when the file has none or it is not valid YAML.
     */
    static Map<String, String> parseFrontMatter(String text) {
        Map<String, String> values = new LinkedHashMap<>();
        String block = frontMatterBlock(text);
        if (block == null || block.isBlank()) {
            return values;
        }
        Map<String, Object> parsed;
        try {
            parsed = YAML.readValue(block, FRONT_MATTER_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable ticket front matter: {}", e.getOriginalMessage());
            return values;
        }
        if (parsed != null) {
            parsed.forEach((key, value) -> values.put(key, value == null ? "" : String.valueOf(value)));
        }
        return values;
    }

    /**
     * Everything after the front matter.
     */
    static String content(String text) {
        int start = text.indexOf(DELIMITER);
        if (start != 0) {
            return text;
        }
        int end = text.indexOf("\n" + DELIMITER + "\n", DELIMITER.length());
        return end < 0 ? "" : text.substring(end + DELIMITER.length() + 2);
    }

    private static String frontMatterBlock(String text) {
        if (!text.startsWith(DELIMITER + "\n")) {
            return null;
        }
        int bodyStart = DELIMITER.length() + 1;
        if (text.startsWith(DELIMITER + "\n", bodyStart)) {
            return "";
        }
        int end = text.indexOf("\n" + DELIMITER + "\n", DELIMITER.length());
        return end < 0 ? null : text.substring(bodyStart, end + 1);
    }

    private static String singleLine(String value) {
        return value == null ? "" : value.replaceAll("[\\r\\n]+", " ").trim();
    }
}
