package com.z254.sentinel.guardian.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for GUARDIAN.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context management for cycle and session IDs</li>
 *     <li>Domain-specific logging methods for cycles, verification, tickets, remediation</li>
 * </ul>
 */
@Slf4j
@Component
public class GuardianStructuredLogger {

    // MDC keys
    public static final String MDC_CYCLE_ID = "cycleId";
    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_ISSUE_ID = "issueId";
    public static final String MDC_COMPONENT = "component";

    /**
     * Log a monitoring cycle event.
     */
    public void logCycleEvent(String cycleId, CycleEventType eventType, String message,
                              Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_CYCLE_ID, cycleId))) {
            Map<String, Object> logData = baseData(eventType.name(), details);
            logData.put("cycleId", cycleId);

            switch (eventType) {
                case STARTED, COMPLETED, CLEANUP_COMPLETED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case SKIPPED_OVERLAP, STEP_FAILED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case FAILED ->
                        log.error("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a verification event.
     */
    public void logVerificationEvent(String sessionId, VerificationEventType eventType,
                                     String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_SESSION_ID, sessionId != null ? sessionId : ""))) {
            Map<String, Object> logData = baseData(eventType.name(), details);
            if (sessionId != null) {
                logData.put("sessionId", sessionId);
            }

            switch (eventType) {
                case SESSION_STARTED, ISSUE_VERIFIED, SESSION_COMPLETED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case ISSUE_UNVERIFIED ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                case SESSION_REJECTED, VERIFIER_FAILED, UNKNOWN_CATEGORY ->
                        log.warn("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a ticket store event.
     */
    public void logTicketEvent(String ticketName, TicketEventType eventType, String message,
                               Map<String, Object> details) {
        Map<String, Object> logData = baseData(eventType.name(), details);
        logData.put("ticket", ticketName);

        switch (eventType) {
            case CREATED, REFRESHED, ARCHIVED ->
                    log.info("{} | data={}", message, formatLogData(logData));
            case SUPPRESSED ->
                    log.debug("{} | data={}", message, formatLogData(logData));
            case WRITE_FAILED ->
                    log.error("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log a remediation event.
     */
    public void logRemediationEvent(String issueId, RemediationEventType eventType,
                                    String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_ISSUE_ID, issueId))) {
            Map<String, Object> logData = baseData(eventType.name(), details);
            logData.put("issueId", issueId);

            switch (eventType) {
                case STARTED, COMPLETED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case NO_SCENARIO, MANUAL_REQUIRED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case FAILED ->
                        log.error("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an enhancement or predictive analysis event.
     */
    public void logEnhancementEvent(String suggestionId, EnhancementEventType eventType,
                                    String message, Map<String, Object> details) {
        Map<String, Object> logData = baseData(eventType.name(), details);
        if (suggestionId != null) {
            logData.put("suggestionId", suggestionId);
        }

        switch (eventType) {
            case PATTERN_LEARNED, SUGGESTED, AUTO_APPLIED, APPROVED, ALERT_RAISED ->
                    log.info("{} | data={}", message, formatLogData(logData));
            case DEFERRED, REJECTED ->
                    log.info("{} | data={}", message, formatLogData(logData));
            case APPLY_FAILED ->
                    log.warn("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private Map<String, Object> baseData(String event, Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", event);
        if (details != null) {
            logData.putAll(details);
        }
        return logData;
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum CycleEventType {
        STARTED, COMPLETED, SKIPPED_OVERLAP, STEP_FAILED, FAILED, CLEANUP_COMPLETED
    }

    public enum VerificationEventType {
        SESSION_STARTED, SESSION_REJECTED, ISSUE_VERIFIED, ISSUE_UNVERIFIED,
        VERIFIER_FAILED, UNKNOWN_CATEGORY, SESSION_COMPLETED
    }

    public enum TicketEventType {
        CREATED, SUPPRESSED, REFRESHED, ARCHIVED, WRITE_FAILED
    }

    public enum RemediationEventType {
        STARTED, COMPLETED, FAILED, NO_SCENARIO, MANUAL_REQUIRED
    }

    public enum EnhancementEventType {
        PATTERN_LEARNED, SUGGESTED, AUTO_APPLIED, APPROVED, REJECTED, DEFERRED,
        APPLY_FAILED, ALERT_RAISED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
