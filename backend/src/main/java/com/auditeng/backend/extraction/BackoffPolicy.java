package com.auditeng.backend.extraction;

import java.time.Duration;

/**
 * Exponential backoff: the delay before retry n (1-based) is
 * {@code min(initialDelay * multiplier^(n-1), maxDelay)}.
 */
public final class BackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    public BackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
    }

    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, retry - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
