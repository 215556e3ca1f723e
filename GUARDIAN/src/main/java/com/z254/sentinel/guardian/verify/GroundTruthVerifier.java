package com.z254.sentinel.guardian.verify;

import com.z254.sentinel.guardian.domain.model.Issue;
import com.z254.sentinel.guardian.domain.model.Layer;
import com.z254.sentinel.guardian.domain.model.VerificationResult;
import com.z254.sentinel.guardian.domain.model.WorkingContext;

/**
 * Confirms a detector's claim against independent evidence.
 * <p>
 * Implementations never throw: a claim that cannot be checked yields
 * {@code verified=false}.
 */
public interface GroundTruthVerifier {

    Layer layer();

    VerificationResult verify(Issue issue, WorkingContext context);
}
