package com.z254.sentinel.guardian.learning;

import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory pattern store keyed by component and fingerprint.
 */
@Repository
public class InMemoryRootCausePatternRepository implements RootCausePatternRepository {

    private final Map<String, RootCausePattern> store = new ConcurrentHashMap<>();

    @Override
    public RootCausePattern save(RootCausePattern pattern) {
        store.put(pattern.key(), pattern);
        return pattern;
    }

    @Override
    public Optional<RootCausePattern> findById(String id) {
        return store.values().stream().filter(pattern -> pattern.getId().equals(id)).findFirst();
    }

    @Override
    public Optional<RootCausePattern> findByKey(String component, String fingerprint) {
        return Optional.ofNullable(store.get(RootCausePattern.keyOf(component, fingerprint)));
    }

    @Override
    public List<RootCausePattern> findAll() {
        return new ArrayList<>(store.values());
    }
}
