package com.auditeng.backend.extraction;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Builds the breaker guarding vision extraction: it opens after {@code failureThreshold}
 * consecutive failed extractions and lets a single trial call through once the reset window passes.
 */
public final class VisionCircuitBreakers {

    private static final Logger log = LoggerFactory.getLogger(VisionCircuitBreakers.class);

    private VisionCircuitBreakers() {
    }

    public static CircuitBreaker create(String name, int failureThreshold, Duration resetTimeout) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(resetTimeout)
                .permittedNumberOfCallsInHalfOpenState(1)
                .recordExceptions(Exception.class)
                .build();

        CircuitBreaker circuitBreaker = CircuitBreaker.of(name, config);
        circuitBreaker.getEventPublisher()
                .onStateTransition(event ->
                        log.warn("[EXTRACTION] Circuit breaker {}: {} -> {}", name,
                                event.getStateTransition().getFromState(),
                                event.getStateTransition().getToState()))
                .onCallNotPermitted(event ->
                        log.warn("[EXTRACTION] Circuit breaker {} open, call refused", name));
        return circuitBreaker;
    }
}
