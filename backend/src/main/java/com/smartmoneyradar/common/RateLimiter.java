package com.smartmoneyradar.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Token bucket of one with a fixed refill interval. Used for the Helius free tier: one request per 150ms
 * (about 6.6 req/s against a 10 req/s quota).
 */
public class RateLimiter {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos;

    /**
     * @param minInterval minimum time between two permits, e.g. 150ms
     */
    public RateLimiter(Duration minInterval) {
        if (minInterval == null || minInterval.isNegative() || minInterval.isZero()) {
            throw new IllegalArgumentException("minInterval must be positive");
        }
        this.minIntervalNanos = minInterval.toNanos();
        this.nextFreeAtNanos = new AtomicLong(System.nanoTime());
    }

    /**
     * @param permitsPerMinute e.g. 400 for 400 requests per minute
     */
    public static RateLimiter perMinute(int permitsPerMinute) {
        if (permitsPerMinute <= 0) {
            throw new IllegalArgumentException("permitsPerMinute must be positive");
        }
        return new RateLimiter(Duration.ofNanos(60_000_000_000L / permitsPerMinute));
    }

    /**
     * Blocks until a permit is available, then returns.
     */
    public void acquire() {
        long now;
        long next;
        do {
            now = System.nanoTime();
            next = nextFreeAtNanos.get();
            if (now - next >= 0) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return;
                }
            } else {
                long sleepNanos = next - now;
                try {
                    Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Rate limiter interrupted", e);
                }
            }
        } while (true);
    }

    /**
     * Non-blocking: returns true if a permit was taken, false if would block.
     */
    public boolean tryAcquire() {
        long now = System.nanoTime();
        long next = nextFreeAtNanos.get();
        return now - next >= 0 && nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos);
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
