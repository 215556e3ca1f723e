package com.z254.sentinel.guardian.remediation;

import com.z254.sentinel.guardian.domain.model.ExecutionContext;
import com.z254.sentinel.guardian.domain.model.Issue;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.function.Predicate;

/**
 * A known failure scenario and how to fix it.
 */
@Value
@Builder
public class RemediationScenario {

    public static final int MIN_CONFIDENCE = 70;

    String id;

    ExecutionContext executionContext;

    Predicate<Issue> matcher;

    boolean autoFixable;

    /** Fix confidence (70-100) */
    int confidence;

    String description;

    /** Null for manual scenarios */
    FixProcedure fixProcedure;

    /** Operator guidance returned when the scenario cannot be fixed automatically */
    @Singular
    List<String> manualSteps;

    public boolean isEligibleIn(ExecutionContext context) {
        return executionContext == ExecutionContext.SHARED || executionContext == context;
    }

    public boolean matches(Issue issue) {
        return matcher.test(issue);
    }
}
