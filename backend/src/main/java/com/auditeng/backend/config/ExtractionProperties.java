package com.auditeng.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry, fallback and circuit breaker settings for vision extraction.
 *
 * @param model             primary vision model
 * @param fallbackModel     model switched to once the primary is rate limited
 * @param maxRetries        retries after the first attempt
 * @param initialRetryDelay delay before the first retry
 * @param retryMultiplier   growth factor between consecutive delays
 * @param maxRetryDelay     upper bound of any retry delay
 * @param timeout           timeout of a single model call
 * @param visionDetail      image detail level sent with every image (low, high, auto)
 * @param maxTokens         completion token limit per call
 * @param temperature       sampling temperature
 * @param circuitBreaker    breaker settings
 */
@ConfigurationProperties(prefix = "auditeng.extraction")
public record ExtractionProperties(
        String model,
        String fallbackModel,
        Integer maxRetries,
        Duration initialRetryDelay,
        Double retryMultiplier,
        Duration maxRetryDelay,
        Duration timeout,
        String visionDetail,
        Integer maxTokens,
        Double temperature,
        CircuitBreaker circuitBreaker
) {

    public ExtractionProperties {
        model = model != null ? model : "gpt-4o";
        fallbackModel = fallbackModel != null ? fallbackModel : "gpt-4o-mini";
        maxRetries = maxRetries != null ? maxRetries : 3;
        initialRetryDelay = initialRetryDelay != null ? initialRetryDelay : Duration.ofSeconds(1);
        retryMultiplier = retryMultiplier != null ? retryMultiplier : 2.0;
        maxRetryDelay = maxRetryDelay != null ? maxRetryDelay : Duration.ofSeconds(10);
        timeout = timeout != null ? timeout : Duration.ofSeconds(60);
        visionDetail = visionDetail != null ? visionDetail : "high";
        maxTokens = maxTokens != null ? maxTokens : 4000;
        temperature = temperature != null ? temperature : 0.0;
        circuitBreaker = circuitBreaker != null ? circuitBreaker : new CircuitBreaker(null, null);
    }

    public static ExtractionProperties defaults() {
        return new ExtractionProperties(null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * @param failureThreshold consecutive failed extractions that open the breaker
     * @param resetWindow      time the breaker stays open before a trial call
     */
    public record CircuitBreaker(Integer failureThreshold, Duration resetWindow) {

        public CircuitBreaker {
            failureThreshold = failureThreshold != null ? failureThreshold : 5;
            resetWindow = resetWindow != null ? resetWindow : Duration.ofSeconds(60);
        }
    }
}
