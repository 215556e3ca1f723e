package com.z254.sentinel.guardian.enhancement;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Suggestions produced from one set of learned patterns.
 */
@Value
@Builder
public class EnhancementDetectionResult {

    int patternsAnalyzed;

    @Builder.Default
    List<EnhancementSuggestion> suggestions = List.of();

    int highPriorityCount;

    double totalHoursSavedPerWeek;

    int avgConfidence;
}
