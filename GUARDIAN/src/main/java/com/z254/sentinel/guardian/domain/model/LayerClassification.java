package com.z254.sentinel.guardian.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Layer assigned to an issue, with the evidence behind the decision.
 */
@Value
@Builder
public class LayerClassification {
    Layer layer;
    int confidence;
    List<String> matchedPatterns;
    String reasoning;
}
