package com.z254.sentinel.guardian.ticket;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.config.GuardianProperties.GroupingStrategy;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.domain.model.VerifiedIssue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Partitions verified issues into ticket groups.
 */
@Component
public class TicketGrouper {

    private final GuardianProperties.Tickets config;

    public TicketGrouper(GuardianProperties properties) {
        this.config = properties.getTickets();
    }

    /**
     * Group issues by the configured strategy, sorted by key; one group per issue when
     * grouping is disabled.
     */
    public List<IssueGroup> group(List<VerifiedIssue> issues) {
        if (!config.isGroupingEnabled()) {
            List<IssueGroup> singles = new ArrayList<>();
            for (int i = 0; i < issues.size(); i++) {
                singles.add(toGroup("issue-" + (i + 1), List.of(issues.get(i))));
            }
            return singles;
        }

        Map<String, List<VerifiedIssue>> byKey = new TreeMap<>();
        for (VerifiedIssue issue : issues) {
            byKey.computeIfAbsent(keyOf(issue, config.getGroupingStrategy()), key -> new ArrayList<>()).add(issue);
        }

        int maxSize = config.getMaxGroupSize();
        List<IssueGroup> groups = new ArrayList<>();
        byKey.forEach((key, members) -> {
            if (members.size() <= maxSize) {
                groups.add(toGroup(key, members));
                return;
            }
            int part = 1;
            for (int from = 0; from < members.size(); from += maxSize) {
                List<VerifiedIssue> slice = members.subList(from, Math.min(from + maxSize, members.size()));
                groups.add(toGroup(key + "-part" + part++, List.copyOf(slice)));
            }
        });
        return groups;
    }

    static String keyOf(VerifiedIssue issue, GroupingStrategy strategy) {
        String agent = TicketName.slug(issue.getAssignedAgent());
        String priority = issue.getPriority().slug();
        String layer = issue.getLayer().slug();
        return switch (strategy) {
            case AGENT -> agent + "-" + priority;
            case PRIORITY -> priority + "-" + layer;
            case LAYER -> layer + "-" + agent;
        };
    }

    private IssueGroup toGroup(String key, List<VerifiedIssue> members) {
        VerifiedIssue first = members.get(0);
        Severity priority = members.stream()
                .map(VerifiedIssue::getPriority)
                .min(Comparator.comparingInt(Severity::rank))
                .orElse(first.getPriority());
        return IssueGroup.builder()
                .key(key)
                .agent(first.getAssignedAgent())
                .priority(priority)
                .layer(first.getLayer())
                .issues(List.copyOf(members))
                .build();
    }
}
