package com.z254.sentinel.guardian.domain.model;

/**
 * Where GUARDIAN is running, and which remediation scenarios apply.
 */
public enum ExecutionContext {
    /** Developing the framework itself */
    FRAMEWORK,
    /** Installed inside an end-user project */
    PROJECT,
    /** Scenarios valid in either context */
    SHARED
}
