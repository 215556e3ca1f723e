package com.z254.sentinel.guardian.verify;

import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.VerificationResult;
import com.z254.sentinel.guardian.domain.model.WorkingContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base verifier: runs the layer's checks and folds them into a fail-closed result.
 */
@Slf4j
public abstract class AbstractGroundTruthVerifier implements GroundTruthVerifier {

    private static final Pattern FILE_REFERENCE = Pattern.compile(
            "((?:[\\w.-]+/)*[\\w-][\\w.-]*\\.(?:tsx?|jsx?|mjs|cjs|java|kt|py|json|md|ya?ml|s?css|html|vue|sql|xml|go|rs|sh))"
                    + "(?::(\\d+))?\\b");

    @Override
    public final VerificationResult verify(Issue issue, WorkingContext context) {
        try {
            List<CheckOutcome> outcomes = runChecks(issue, context);
            return aggregate(issue, context, outcomes);
        } catch (RuntimeException e) {
            log.warn("{} verifier failed for component {}: {}",
                    layer().slug(), issue.getComponent(), e.getMessage());
            return VerificationResult.unverified("Verifier error: " + e.getMessage());
        }
    }

    /**
     * Run every check applicable to the issue.
     */
    protected abstract List<CheckOutcome> runChecks(Issue issue, WorkingContext context);

    protected abstract String recommendFix(Issue issue, List<CheckOutcome> outcomes);

    /**
     * Default rule: at least one confirmation and no refutation. Confidence is the mean of
     * the confirming checks.
     */
    protected boolean isVerified(List<CheckOutcome> outcomes) {
        return outcomes.stream().anyMatch(CheckOutcome::isConfirmed)
                && outcomes.stream().noneMatch(CheckOutcome::isRefuted);
    }

    protected int confidenceOf(List<CheckOutcome> outcomes) {
        return (int) Math.round(outcomes.stream()
                .filter(CheckOutcome::isConfirmed)
                .mapToInt(CheckOutcome::confidence)
                .average()
                .orElse(0));
    }

    protected String responsibleAgent(Issue issue, WorkingContext context) {
        return null;
    }

    private VerificationResult aggregate(Issue issue, WorkingContext context, List<CheckOutcome> outcomes) {
        if (outcomes.isEmpty()) {
            return VerificationResult.unverified("No verifiable " + layer().slug() + " claim in issue");
        }

        List<String> evidence = new ArrayList<>();
        for (CheckOutcome outcome : outcomes) {
            for (String line : outcome.evidence()) {
                evidence.add("[" + outcome.check() + "/" + outcome.verdict().name().toLowerCase() + "] " + line);
            }
        }

        boolean verified = isVerified(outcomes);
        return VerificationResult.builder()
                .verified(verified)
                .confidence(verified ? Math.max(0, Math.min(100, confidenceOf(outcomes))) : 0)
                .evidence(evidence)
                .recommendedFix(recommendFix(issue, outcomes))
                .responsibleAgent(responsibleAgent(issue, context))
                .build();
    }

    /**
     * First file path mentioned in the text, if any.
     */
    protected static Optional<FileReference> findFileReference(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = FILE_REFERENCE.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        Integer line = matcher.group(2) != null ? Integer.valueOf(matcher.group(2)) : null;
        return Optional.of(new FileReference(matcher.group(1), line));
    }

    protected record FileReference(String path, Integer line) {
    }
}
