package com.z254.sentinel.guardian.orchestration;

import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import reactor.core.publisher.Mono;

/**
 * Source of health snapshots for the monitoring cycle.
 */
public interface HealthCheckProvider {

    /**
     * Take or load the current snapshot. Errors are signalled through the returned Mono.
     */
    Mono<HealthSnapshot> performHealthCheck();
}
