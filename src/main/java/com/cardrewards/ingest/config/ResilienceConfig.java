package com.cardrewards.ingest.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j instances guarding the normalization model call.
 * Instance settings live under {@code resilience4j.*.instances.normalizer}.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String NORMALIZER_INSTANCE = "normalizer";

    /**
     * While open, files fail immediately without waiting for the request timeout.
     */
    @Bean
    public CircuitBreaker normalizerCircuitBreaker(CircuitBreakerRegistry circuitBreakerRegistry) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(NORMALIZER_INSTANCE);

        circuitBreaker.getEventPublisher()
                .onError(event -> log.warn("Normalizer circuit breaker error: {}", event))
                .onStateTransition(event -> log.warn("Normalizer circuit breaker state transition: {} -> {}",
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState()))
                .onCallNotPermitted(event -> log.warn("Normalizer call rejected, circuit open"));

        return circuitBreaker;
    }

    @Bean
    public Retry normalizerRetry(RetryRegistry retryRegistry) {
        Retry retry = retryRegistry.retry(NORMALIZER_INSTANCE);

        retry.getEventPublisher()
                .onRetry(event -> log.warn("Normalizer retry attempt #{}: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage()))
                .onError(event -> log.error("Normalizer call failed after {} attempts: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage()));

        return retry;
    }
}
