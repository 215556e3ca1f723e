package com.z254.sentinel.guardian.remediation;

import com.z254.sentinel.guardian.domain.model.ExecutionContext;
import com.z254.sentinel.guardian.domain.model.Issue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, validated set of remediation scenarios. Registration order is match priority.
 */
public class RemediationScenarioRegistry {

    private final List<RemediationScenario> scenarios;

    public RemediationScenarioRegistry(List<RemediationScenario> scenarios) {
        Set<String> ids = new HashSet<>();
        List<RemediationScenario> validated = new ArrayList<>();
        for (RemediationScenario scenario : scenarios) {
            if (scenario.getId() == null || scenario.getId().isBlank()) {
                throw new IllegalStateException("Remediation scenario without id");
            }
            if (!ids.add(scenario.getId())) {
                throw new IllegalStateException("Duplicate remediation scenario: " + scenario.getId());
            }
            if (scenario.getConfidence() < RemediationScenario.MIN_CONFIDENCE || scenario.getConfidence() > 100) {
                throw new IllegalStateException("Scenario " + scenario.getId()
                        + " confidence must be between " + RemediationScenario.MIN_CONFIDENCE
                        + " and 100, was " + scenario.getConfidence());
            }
            if (scenario.getMatcher() == null || scenario.getExecutionContext() == null) {
                throw new IllegalStateException("Scenario " + scenario.getId() + " needs a matcher and a context");
            }
            if (scenario.isAutoFixable() && scenario.getFixProcedure() == null) {
                throw new IllegalStateException("Auto-fixable scenario " + scenario.getId() + " has no fix procedure");
            }
            validated.add(scenario);
        }
        this.scenarios = List.copyOf(validated);
    }

    /**
     * First eligible scenario whose matcher accepts the issue.
     */
    public Optional<RemediationScenario> match(Issue issue, ExecutionContext context) {
        return scenarios.stream()
                .filter(scenario -> scenario.isEligibleIn(context))
                .filter(scenario -> scenario.matches(issue))
                .findFirst();
    }

    public List<RemediationScenario> getScenarios() {
        return scenarios;
    }

    /**
     * Scenarios eligible in a context, shared ones included.
     */
    public List<RemediationScenario> forContext(ExecutionContext context) {
        return scenarios.stream().filter(scenario -> scenario.isEligibleIn(context)).toList();
    }

    public Optional<RemediationScenario> findById(String id) {
        return scenarios.stream().filter(scenario -> scenario.getId().equals(id)).findFirst();
    }
}
