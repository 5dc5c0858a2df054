package com.replyline.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Circuit breaker registry guarding completion providers, one breaker per agent.
 */
@Slf4j
@Configuration
public class ResilienceConfiguration {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ReplylineProperties properties) {
        return CircuitBreakerRegistry.of(toConfig(properties.getCircuitBreaker()));
    }

    /**
     * Count-based window the size of the failure threshold at a 100% failure rate,
     * i.e. the breaker opens after that many consecutive failures.
     */
    public static CircuitBreakerConfig toConfig(ReplylineProperties.CircuitBreakerConfig config) {
        log.info("Completion circuit breaker: open after {} failures, reset after {}, {} half-open calls",
                config.getFailureThreshold(), config.getResetTimeout(), config.getHalfOpenMaxRequests());

        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(config.getFailureThreshold())
                .minimumNumberOfCalls(config.getFailureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(config.getResetTimeout())
                .permittedNumberOfCallsInHalfOpenState(config.getHalfOpenMaxRequests())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
    }
}
