package com.smartmoneyradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff for rate-limited provider calls: base, 2×base, 4×base... with optional ± jitter.
 * The Helius defaults (2s base, 3 retries, no jitter) wait 2s, 4s and 8s.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxRetries;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxRetries) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxRetries = maxRetries;
    }

    /**
     * Delay in milliseconds before the retry that follows the given zero-based attempt.
     * Formula: baseDelay * 2^attempt, then ± jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /** Retries allowed after the initial call. */
    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Default: 2s base, no jitter, 3 retries.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(2000L, 0.0, 3);
    }
}
