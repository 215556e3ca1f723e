package com.z254.sentinel.guardian.remediation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What a fix procedure did.
 */
@Value
@Builder
public class FixOutcome {

    boolean success;

    String actionTaken;

    String beforeState;

    String afterState;

    String lesson;

    @Singular
    List<String> nextSteps;
}
