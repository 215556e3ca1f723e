package com.z254.sentinel.guardian.learning;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Patterns found by one learning pass.
 */
@Value
@Builder
public class LearningResult {

    @Builder.Default
    List<RootCausePattern> patterns = List.of();

    int newPatterns;

    int updatedPatterns;

    int enhancementCandidates;

    double avgConfidence;

    public static LearningResult empty() {
        return LearningResult.builder().build();
    }
}
