package com.smartmoneyradar.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    @Test
    @DisplayName("tryAcquire allows first call and denies second immediately at 1/min")
    void tryAcquireOnePerMinute() {
        RateLimiter limiter = RateLimiter.perMinute(1);
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("acquire spaces consecutive permits by the minimum interval")
    void acquireSpacesPermits() {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(150));
        limiter.acquire();
        long start = System.nanoTime();
        limiter.acquire();
        limiter.acquire();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(elapsedMs).isGreaterThanOrEqualTo(280);
    }

    @Test
    @DisplayName("multiple threads all get their permits")
    void multipleThreadsRespectRate() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(10));
        int threadCount = 4;
        int acquiresPerThread = 5;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < acquiresPerThread; i++) {
                        limiter.acquire();
                        successCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }).start();
        }
        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        assertThat(successCount.get()).isEqualTo(threadCount * acquiresPerThread);
    }

    @Test
    @DisplayName("constructor rejects non-positive interval and rate")
    void constructorRejectsNonPositive() {
        assertThatThrownBy(() -> new RateLimiter(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> RateLimiter.perMinute(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void perMinute_derivesInterval() {
        assertThat(RateLimiter.perMinute(400).getMinInterval()).isEqualTo(Duration.ofMillis(150));
    }
}
