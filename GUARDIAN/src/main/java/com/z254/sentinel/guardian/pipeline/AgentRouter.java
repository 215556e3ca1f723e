package com.z254.sentinel.guardian.pipeline;

import com.z254.sentinel.guardian.domain.model.ExecutionContext;
import com.z254.sentinel.guardian.domain.model.IssueCategory;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.VerificationResult;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Routes verified issues to a remediation agent by layer and category.
 */
@Component
public class AgentRouter {

    public static final String DEFAULT_AGENT = "Maria-QA";
    public static final String CONTEXT_FALLBACK_AGENT = "Alex-BA";

    /** Resolved from the verifier's responsible agent */
    static final String RESPONSIBLE_AUTHOR = "git-blame";

    /** Agents that only exist when developing the framework itself */
    static final Set<String> FRAMEWORK_ONLY_AGENTS = Set.of("Sarah-PM");

    private final Map<Layer, Map<IssueCategory, String>> routing = new EnumMap<>(Layer.class);

    public AgentRouter() {
        routing.put(Layer.FRAMEWORK, new EnumMap<>(Map.of(
                IssueCategory.BUILD_FAILURE, "Marcus-Backend",
                IssueCategory.COMPILE_ERROR, "Marcus-Backend",
                IssueCategory.AGENT_INVALID, "Sarah-PM",
                IssueCategory.HOOK_ERROR, "Sarah-PM",
                IssueCategory.MCP_ERROR, "Marcus-Backend",
                IssueCategory.RAG_HEALTH, "Dr.AI-ML",
                IssueCategory.TEST_FAILURE, "Maria-QA",
                IssueCategory.DEPENDENCY, "Marcus-Backend")));

        Map<IssueCategory, String> project = new EnumMap<>(IssueCategory.class);
        project.put(IssueCategory.BUILD_FAILURE, "Marcus-Backend");
        project.put(IssueCategory.COMPILE_ERROR, "James-Frontend");
        project.put(IssueCategory.TEST_FAILURE, "Maria-QA");
        project.put(IssueCategory.TEST_COVERAGE, "Maria-QA");
        project.put(IssueCategory.CODE_QUALITY, "Maria-QA");
        project.put(IssueCategory.SECURITY_VULNERABILITY, "Marcus-Backend");
        project.put(IssueCategory.PERFORMANCE, "Marcus-Backend");
        project.put(IssueCategory.ACCESSIBILITY, "James-Frontend");
        project.put(IssueCategory.DATABASE, "Dana-Database");
        project.put(IssueCategory.DEPENDENCY, "Marcus-Backend");
        routing.put(Layer.PROJECT, project);

        routing.put(Layer.CONTEXT, new EnumMap<>(Map.of(
                IssueCategory.STYLE_VIOLATION, RESPONSIBLE_AUTHOR,
                IssueCategory.CONVENTION_VIOLATION, RESPONSIBLE_AUTHOR,
                IssueCategory.PREFERENCE_MISMATCH, RESPONSIBLE_AUTHOR,
                IssueCategory.VISION_MISALIGNMENT, CONTEXT_FALLBACK_AGENT)));
    }

    /**
     * Pick the agent for a verified issue.
     */
    public String route(Layer layer, IssueCategory category, VerificationResult verification,
                        ExecutionContext executionContext) {
        String agent = routing.getOrDefault(layer, Map.of()).getOrDefault(category, DEFAULT_AGENT);

        if (layer == Layer.CONTEXT && RESPONSIBLE_AUTHOR.equals(agent)) {
            agent = verification.getResponsibleAgent() != null
                    ? verification.getResponsibleAgent()
                    : CONTEXT_FALLBACK_AGENT;
        }
        if (executionContext == ExecutionContext.PROJECT && FRAMEWORK_ONLY_AGENTS.contains(agent)) {
            agent = DEFAULT_AGENT;
        }
        return agent;
    }
}
