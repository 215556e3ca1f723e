package com.z254.sentinel.guardian.pipeline;

import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.IssueCategory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Maps an issue to its routing category by keyword inspection. First match wins.
 */
@Component
public class IssueCategorizer {

    public IssueCategory categorize(Issue issue) {
        String component = issue.componentOrEmpty().toLowerCase(Locale.ROOT);
        String description = issue.descriptionOrEmpty().toLowerCase(Locale.ROOT);

        if (component.contains("build") || description.contains("build")) {
            return IssueCategory.BUILD_FAILURE;
        }
        if (component.contains("typescript") || description.contains("typescript")
                || component.contains("compile") || description.contains("compil")) {
            return IssueCategory.COMPILE_ERROR;
        }
        if (component.contains("agent")) {
            return IssueCategory.AGENT_INVALID;
        }
        if (component.contains("hook")) {
            return IssueCategory.HOOK_ERROR;
        }
        if (component.contains("mcp")) {
            return IssueCategory.MCP_ERROR;
        }
        if (component.contains("rag")) {
            return IssueCategory.RAG_HEALTH;
        }
        if (description.contains("test") && description.contains("fail")) {
            return IssueCategory.TEST_FAILURE;
        }
        if (description.contains("coverage")) {
            return IssueCategory.TEST_COVERAGE;
        }
        if (description.contains("vulnerab") || description.contains("security")) {
            return IssueCategory.SECURITY_VULNERABILITY;
        }
        if (description.contains("quality") || description.contains("lint")) {
            return IssueCategory.CODE_QUALITY;
        }
        if (description.contains("accessib")) {
            return IssueCategory.ACCESSIBILITY;
        }
        if (description.contains("performance")) {
            return IssueCategory.PERFORMANCE;
        }
        if (component.contains("database")) {
            return IssueCategory.DATABASE;
        }
        if (description.contains("outdated")) {
            return IssueCategory.DEPENDENCY;
        }
        if (description.contains("indent") || description.contains("tabs") || description.contains("spaces")) {
            return IssueCategory.STYLE_VIOLATION;
        }
        if (description.contains("convention")) {
            return IssueCategory.CONVENTION_VIOLATION;
        }
        if (description.contains("vision")) {
            return IssueCategory.VISION_MISALIGNMENT;
        }
        if (description.contains("preference")) {
            return IssueCategory.PREFERENCE_MISMATCH;
        }
        return IssueCategory.UNKNOWN;
    }
}
