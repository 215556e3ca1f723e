package com.z254.sentinel.guardian.ticket;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.config.GuardianProperties.GroupingStrategy;
import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.Severity;
import com.z254.sentinel.guardian.domain.model.VerifiedIssue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TicketGrouperTest {

    @Test
    void keysFollowStrategy() {
        VerifiedIssue issue = verified("Dr.AI-ML", Severity.HIGH, Layer.FRAMEWORK);

        assertThat(TicketGrouper.keyOf(issue, GroupingStrategy.AGENT)).isEqualTo("dr-ai-ml-high");
        assertThat(TicketGrouper.keyOf(issue, GroupingStrategy.PRIORITY)).isEqualTo("high-framework");
        assertThat(TicketGrouper.keyOf(issue, GroupingStrategy.LAYER)).isEqualTo("framework-dr-ai-ml");
    }

    @Test
    void oversizedGroupsAreSplit() {
        GuardianProperties properties = new GuardianProperties();
        properties.getTickets().setMaxGroupSize(2);
        List<VerifiedIssue> issues = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            issues.add(verified("Maria-QA", Severity.MEDIUM, Layer.PROJECT));
        }

        List<IssueGroup> groups = new TicketGrouper(properties).group(issues);

        assertThat(groups).extracting(IssueGroup::getKey)
                .containsExactly("maria-qa-medium-part1", "maria-qa-medium-part2", "maria-qa-medium-part3");
        assertThat(groups).extracting(g -> g.getIssues().size()).containsExactly(2, 2, 1);
    }

    @Test
    void groupPriorityIsMostSevereMember() {
        GuardianProperties properties = new GuardianProperties();
        properties.getTickets().setGroupingStrategy(GroupingStrategy.LAYER);

        List<IssueGroup> groups = new TicketGrouper(properties).group(List.of(
                verified("Maria-QA", Severity.LOW, Layer.PROJECT),
                verified("Maria-QA", Severity.CRITICAL, Layer.PROJECT)));

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).getPriority()).isEqualTo(Severity.CRITICAL);
    }

    private static VerifiedIssue verified(String agent, Severity severity, Layer layer) {
        return VerifiedIssue.builder()
                .issue(Issue.builder().component("x").description("d").severity(severity).build())
                .layer(layer)
                .verified(true)
                .assignedAgent(agent)
                .priority(severity)
                .build();
    }
}
