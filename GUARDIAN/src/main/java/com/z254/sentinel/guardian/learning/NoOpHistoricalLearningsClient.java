package com.z254.sentinel.guardian.learning;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client used when the learnings store is disabled.
 */
public class NoOpHistoricalLearningsClient implements HistoricalLearningsClient {

    @Override
    public Mono<List<HistoricalLearning>> search(String description, int limit) {
        return Mono.just(List.of());
    }
}
