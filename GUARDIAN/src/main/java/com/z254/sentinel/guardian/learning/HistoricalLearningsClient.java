package com.z254.sentinel.guardian.learning;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Search over learnings recorded by earlier remediations.
 * <p>
 * Implementations never signal an error for an unavailable store; they return an empty list.
 */
public interface HistoricalLearningsClient {

    Mono<List<HistoricalLearning>> search(String description, int limit);
}
