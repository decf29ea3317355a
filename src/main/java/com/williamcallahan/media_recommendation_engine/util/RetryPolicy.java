package com.williamcallahan.media_recommendation_engine.util;

import java.time.Duration;

/**
 * Retry budget for one upstream service
 *
 * @param maxAttempts total attempts including the first call
 * @param initialBackoff delay before the first retry; doubles on each further retry
 * @param maxBackoff cap on the delay between attempts
 * @param jitter random jitter factor applied to each delay, between 0 and 1
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double jitter) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be non-negative");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            maxBackoff = initialBackoff;
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1]");
        }
    }

    public int maxRetries() {
        return maxAttempts - 1;
    }

    /**
     * A policy that performs the call once and never retries
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.0);
    }
}
