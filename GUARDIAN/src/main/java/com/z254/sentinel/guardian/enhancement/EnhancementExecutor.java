package com.z254.sentinel.guardian.enhancement;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.remediation.AutoRemediationEngine;
import com.z254.sentinel.guardian.remediation.RemediationRequest;
import com.z254.sentinel.guardian.remediation.RemediationResult;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Applies an approved enhancement by replaying its recurring issue through the
 * auto-remediation engine.
 */
@Component
public class EnhancementExecutor {

    private final AutoRemediationEngine engine;
    private final GuardianProperties properties;

    public EnhancementExecutor(AutoRemediationEngine engine, GuardianProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    public RemediationResult apply(EnhancementSuggestion suggestion) {
        Issue issue = Issue.builder()
                .component(suggestion.getComponent())
                .severity(suggestion.getIssueSeverity() != null ? suggestion.getIssueSeverity() : Severity.MEDIUM)
                .description(suggestion.getIssueDescription())
                .autoFixAvailable(true)
                .build();
        return engine.execute(RemediationRequest.builder()
                .issueId(suggestion.getId())
                .issue(issue)
                .executionContext(properties.getExecutionContext())
                .workingDirectory(Path.of(properties.getWorkingDirectory()))
                .build());
    }
}
