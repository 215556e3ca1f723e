package com.z254.sentinel.guardian.remediation;

import com.z254.sentinel.guardian.domain.model.ExecutionContext;
import com.z254.sentinel.guardian.domain.model.Issue;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * An issue handed to the remediation engine.
 */
@Value
@Builder
public class RemediationRequest {

    String issueId;

    Issue issue;

    /** Context the engine runs in; selects which scenarios are eligible */
    ExecutionContext executionContext;

    Path workingDirectory;
}
