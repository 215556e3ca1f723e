package com.z254.sentinel.guardian.learning;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.sentinel.guardian.config.GuardianProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST client for the historical-learnings store.
 * <p>
 * Results are cached per query; when the store is unavailable the circuit breaker
 * fallback returns an empty list so callers fall back to heuristics.
 */
@Slf4j
public class WebClientHistoricalLearningsClient implements HistoricalLearningsClient {

    private static final ParameterizedTypeReference<List<HistoricalLearning>> LEARNING_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final GuardianProperties.HistoricalLearnings config;
    private final Cache<String, List<HistoricalLearning>> cache;

    public WebClientHistoricalLearningsClient(WebClient.Builder webClientBuilder, GuardianProperties properties) {
        this.config = properties.getHistoricalLearnings();
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .build();
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(config.getCacheTtl())
                .maximumSize(500)
                .recordStats()
                .build();
        log.info("Initialized historical learnings client: url={}, cacheTtl={}", config.getUrl(), config.getCacheTtl());
    }

    @Override
    @CircuitBreaker(name = "historical-learnings", fallbackMethod = "searchFallback")
    @Retry(name = "historical-learnings")
    public Mono<List<HistoricalLearning>> search(String description, int limit) {
        String key = limit + ":" + description;
        List<HistoricalLearning> cached = cache.getIfPresent(key);
        if (cached != null) {
            return Mono.just(cached);
        }
        return webClient.get()
                .uri(uri -> uri.path("/api/v1/learnings/search")
                        .queryParam("q", description)
                        .queryParam("limit", limit)
                        .build())
                .retrieve()
                .bodyToMono(LEARNING_LIST)
                .timeout(config.getTimeout())
                .defaultIfEmpty(List.of())
                .doOnNext(learnings -> cache.put(key, List.copyOf(learnings)))
                .doOnError(error -> log.debug("Learnings search failed: {}", error.getMessage()));
    }

    /**
     * Fallback when the learnings store is unavailable.
     */
    public Mono<List<HistoricalLearning>> searchFallback(String description, int limit, Throwable throwable) {
        log.warn("Historical learnings unavailable, continuing without them: {}", throwable.getMessage());
        return Mono.just(List.of());
    }
}
