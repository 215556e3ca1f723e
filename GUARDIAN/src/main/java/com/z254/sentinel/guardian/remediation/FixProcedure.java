package com.z254.sentinel.guardian.remediation;

/**
 * Automated fix for one remediation scenario.
 */
@FunctionalInterface
public interface FixProcedure {

    FixOutcome apply(RemediationRequest request) throws Exception;
}
