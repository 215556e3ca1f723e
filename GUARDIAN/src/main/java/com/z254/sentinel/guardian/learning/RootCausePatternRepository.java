package com.z254.sentinel.guardian.learning;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for learned root-cause patterns.
 */
public interface RootCausePatternRepository {

    RootCausePattern save(RootCausePattern pattern);

    Optional<RootCausePattern> findById(String id);

    Optional<RootCausePattern> findByKey(String component, String fingerprint);

    List<RootCausePattern> findAll();
}
