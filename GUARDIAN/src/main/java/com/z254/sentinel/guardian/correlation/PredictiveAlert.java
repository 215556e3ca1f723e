package com.z254.sentinel.guardian.correlation;

import com.z254.sentinel.guardian.domain.model.Severity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * An alert raised before a predicted failure.
 */
@Value
@Builder
public class PredictiveAlert {

    String id;

    AlertType type;

    String title;

    String description;

    Severity severity;

    /** Hours until the predicted event; null for open-ended degradation */
    Double etaHours;

    int confidence;

    @Singular("evidenceLine")
    List<String> evidence;

    String recommendedAction;

    boolean autoRemediable;

    public enum AlertType {
        THRESHOLD_BREACH,
        CORRELATION_CASCADE,
        DEGRADATION_PATTERN
    }
}
