package com.z254.sentinel.guardian.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.correlation.PredictiveAlert;
import com.z254.sentinel.guardian.enhancement.ApprovalResult;
import com.z254.sentinel.guardian.pipeline.PipelineResult;
import com.z254.sentinel.guardian.remediation.RemediationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * File-backed telemetry: an append-only JSONL event log plus an aggregate record.
 * <p>
 * Every write appends the event and folds it into the aggregate under one lock, so
 * concurrent cycles never lose an aggregate update.
 */
@Slf4j
@Component
public class TelemetryLog {

    private final Path eventLog;
    private final Path metricsFile;
    private final double alpha;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public TelemetryLog(GuardianProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(Path.of(properties.getWorkingDirectory()).resolve(properties.getTelemetry().getDirectory()),
                properties.getTelemetry(), objectMapper, clock);
    }

    TelemetryLog(Path directory, GuardianProperties.Telemetry config, ObjectMapper objectMapper, Clock clock) {
        this.eventLog = directory.resolve(config.getEventLogFile());
        this.metricsFile = directory.resolve(config.getMetricsFile());
        this.alpha = config.getMovingAverageAlpha();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void recordRemediation(RemediationResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("issueId", result.getIssueId());
        payload.put("scenarioId", result.getScenarioId());
        payload.put("success", result.isSuccess());
        payload.put("actionTaken", result.getActionTaken());
        payload.put("confidence", result.getConfidence());
        payload.put("durationMs", result.getDurationMs());
        payload.put("lesson", result.getLesson());
        append(event(TelemetryEvent.Type.REMEDIATION, payload),
                aggregate -> aggregate.withRemediation(result.isSuccess(), result.getDurationMs(), alpha));
    }

    public void recordAlert(PredictiveAlert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alert.getId());
        payload.put("alertType", alert.getType().name());
        payload.put("severity", alert.getSeverity().name());
        payload.put("title", alert.getTitle());
        payload.put("etaHours", alert.getEtaHours());
        payload.put("confidence", alert.getConfidence());
        append(event(TelemetryEvent.Type.PREDICTIVE_ALERT, payload),
                aggregate -> aggregate.withAlert(alert.getSeverity()));
    }

    public void recordVerification(PipelineResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", result.getSessionId());
        payload.put("totalIssues", result.getTotalIssues());
        payload.put("verified", result.getVerified().size());
        payload.put("unverified", result.getUnverified().size());
        payload.put("autoApply", result.getAutoApplyCount());
        payload.put("skippedAtCapacity", result.isSkippedAtCapacity());
        payload.put("durationMs", result.getDurationMs());
        append(event(TelemetryEvent.Type.VERIFICATION, payload), UnaryOperator.identity());
    }

    public void recordEnhancements(int suggested, ApprovalResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("suggested", suggested);
        payload.put("autoApplied", result.getAutoApplied());
        payload.put("approved", result.getApproved());
        payload.put("rejected", result.getRejected());
        payload.put("deferred", result.getDeferred());
        payload.put("ticketsCreated", result.getTicketsCreated());
        append(event(TelemetryEvent.Type.ENHANCEMENT, payload), UnaryOperator.identity());
    }

    /**
     * Most recent events, oldest first.
     */
    public synchronized List<TelemetryEvent> readEvents(int limit) {
        if (!Files.exists(eventLog)) {
            return List.of();
        }
        try {
            List<String> lines = Files.readAllLines(eventLog, StandardCharsets.UTF_8);
            List<TelemetryEvent> events = new ArrayList<>();
            for (String line : lines.subList(Math.max(0, lines.size() - limit), lines.size())) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    events.add(objectMapper.readValue(line, TelemetryEvent.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed telemetry line: {}", e.getOriginalMessage());
                }
            }
            return events;
        } catch (IOException e) {
            throw new TelemetryException("Failed to read " + eventLog, e);
        }
    }

    public synchronized TelemetryAggregate getAggregate() {
        return readAggregate();
    }

    // ========== Private Methods ==========

    private TelemetryEvent event(TelemetryEvent.Type type, Map<String, Object> payload) {
        return TelemetryEvent.builder()
                .timestamp(clock.instant())
                .type(type)
                .payload(payload)
                .build();
    }

    private synchronized void append(TelemetryEvent event, UnaryOperator<TelemetryAggregate> update) {
        try {
            Files.createDirectories(eventLog.getParent());
            Files.writeString(eventLog, objectMapper.writeValueAsString(event) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);

            TelemetryAggregate aggregate = update.apply(readAggregate().withEvent(event.getType(), event.getTimestamp()));
            writeAggregate(aggregate);
        } catch (IOException e) {
            throw new TelemetryException("Failed to record " + event.getType() + " telemetry", e);
        }
    }

    private TelemetryAggregate readAggregate() {
        if (!Files.exists(metricsFile)) {
            return TelemetryAggregate.empty();
        }
        try {
            return objectMapper.readValue(metricsFile.toFile(), TelemetryAggregate.class);
        } catch (IOException e) {
            throw new TelemetryException("Failed to read " + metricsFile, e);
        }
    }

    private void writeAggregate(TelemetryAggregate aggregate) throws IOException {
        Path temp = metricsFile.resolveSibling(metricsFile.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), aggregate);
        Files.move(temp, metricsFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
