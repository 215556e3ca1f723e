package com.z254.sentinel.guardian.config;

import com.z254.sentinel.guardian.enhancement.ApprovalPrompter;
import com.z254.sentinel.guardian.enhancement.DeferringApprovalPrompter;
import com.z254.sentinel.guardian.guard.RecursionGuard;
import com.z254.sentinel.guardian.learning.HistoricalLearningsClient;
import com.z254.sentinel.guardian.learning.NoOpHistoricalLearningsClient;
import com.z254.sentinel.guardian.learning.WebClientHistoricalLearningsClient;
import com.z254.sentinel.guardian.observability.GuardianMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Core GUARDIAN beans that need wiring beyond component scanning.
 */
@Slf4j
@Configuration
public class GuardianConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RecursionGuard recursionGuard(GuardianProperties properties, GuardianMetrics metrics, Clock clock) {
        RecursionGuard guard = new RecursionGuard(properties.getRecursion().getMaxConcurrentSessions(), clock);
        metrics.registerActiveSessionsGauge(guard::getActiveSessions);
        return guard;
    }

    @Bean
    public HistoricalLearningsClient historicalLearningsClient(GuardianProperties properties,
                                                               WebClient.Builder webClientBuilder) {
        if (!properties.getHistoricalLearnings().isEnabled()) {
            log.info("Historical learnings disabled, enhancement effort uses heuristics only");
            return new NoOpHistoricalLearningsClient();
        }
        return new WebClientHistoricalLearningsClient(webClientBuilder, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ApprovalPrompter approvalPrompter() {
        return new DeferringApprovalPrompter();
    }
}
