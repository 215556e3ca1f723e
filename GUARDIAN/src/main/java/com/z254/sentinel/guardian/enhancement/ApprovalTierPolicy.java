package com.z254.sentinel.guardian.enhancement;

import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns an approval tier to an enhancement suggestion.
 * <ul>
 *     <li>Tier 1: high-confidence, proven, small, non-critical changes apply automatically</li>
 *     <li>Tier 3: anything low-confidence, critical, complex, unproven or large needs manual review</li>
 *     <li>Tier 2: everything in between needs approval</li>
 * </ul>
 */
@Component
public class ApprovalTierPolicy {

    static final int MIN_TIER1_SUCCESS_RATE = 95;
    static final int MAX_TIER1_SECONDARY_CAUSES = 1;
    static final double MAX_TIER1_EFFORT_HOURS = 1.0;
    static final int MIN_SUCCESS_RATE = 70;
    static final int MAX_SECONDARY_CAUSES = 3;
    static final double MAX_EFFORT_HOURS = 8.0;

    private final GuardianProperties.Enhancement config;

    public ApprovalTierPolicy(GuardianProperties properties) {
        this.config = properties.getEnhancement();
    }

    public TierDecision decide(int confidence, int successRate, Severity severity,
                               int secondaryCauses, double effortHours) {
        if (confidence >= config.getTier1Threshold()
                && successRate >= MIN_TIER1_SUCCESS_RATE
                && severity != Severity.CRITICAL
                && secondaryCauses <= MAX_TIER1_SECONDARY_CAUSES
                && effortHours <= MAX_TIER1_EFFORT_HOURS) {
            return new TierDecision(1, "High confidence, proven fix, low effort");
        }

        List<String> reasons = new ArrayList<>();
        if (confidence < config.getTier2Threshold()) {
            reasons.add("confidence " + confidence + "% below " + config.getTier2Threshold() + "%");
        }
        if (severity == Severity.CRITICAL) {
            reasons.add("critical severity");
        }
        if (secondaryCauses >= MAX_SECONDARY_CAUSES) {
            reasons.add(secondaryCauses + " secondary causes");
        }
        if (successRate < MIN_SUCCESS_RATE) {
            reasons.add("success rate " + successRate + "% below " + MIN_SUCCESS_RATE + "%");
        }
        if (effortHours > MAX_EFFORT_HOURS) {
            reasons.add("effort " + effortHours + "h above " + MAX_EFFORT_HOURS + "h");
        }
        if (!reasons.isEmpty()) {
            return new TierDecision(3, "Manual review required: " + String.join(", ", reasons));
        }
        return new TierDecision(2, "Approval required: moderate confidence or effort");
    }

    /**
     * @param tier   approval tier (1-3)
     * @param reason why the suggestion landed in this tier
     */
    public record TierDecision(int tier, String reason) {
    }
}
