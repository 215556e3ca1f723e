package com.z254.sentinel.guardian.domain.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Workspace a cycle runs against.
 */
@Value
@Builder(toBuilder = true)
public class WorkingContext {

    Path workingDirectory;

    @Builder.Default
    ExecutionContext executionContext = ExecutionContext.PROJECT;

    String userId;
    String teamId;
    String projectId;

    public Path resolve(String relative) {
        return workingDirectory.resolve(relative).normalize();
    }

    public String key() {
        return workingDirectory.toAbsolutePath().normalize().toString();
    }
}
