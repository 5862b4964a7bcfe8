package com.smartmoneyradar.ingestion.adapter;

import com.smartmoneyradar.common.RateLimiter;
import com.smartmoneyradar.common.RetryPolicy;
import com.smartmoneyradar.common.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Throttles and retries calls to the chain-data provider.
 * <ul>
 *   <li>every attempt (including retries) first takes a permit from the shared {@link RateLimiter};</li>
 *   <li>{@link ProviderRateLimitedException}: sleep {@code retryPolicy.delayMs(attempt)} and retry, up to
 *       {@code maxRetries} retries, then {@link CallResult.Status#RATE_LIMITED};</li>
 *   <li>any other exception: {@link CallResult.Status#FAILED} at once, no retry.</li>
 * </ul>
 * One instance serves a whole polling cycle; calls are expected to be sequential.
 */
@Slf4j
public class RateLimitedClient {

    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public RateLimitedClient(RateLimiter rateLimiter, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    public RateLimitedClient(RateLimiter rateLimiter, RetryPolicy retryPolicy) {
        this(rateLimiter, retryPolicy, Sleeper.THREAD);
    }

    /**
     * Runs {@code request} under the throttle and the rate-limit backoff policy.
     *
     * @param operation name used in logs, e.g. "getSignaturesForAddress"
     * @param request   blocking provider call
     */
    public <T> CallResult<T> call(String operation, Supplier<T> request) {
        int maxRetries = retryPolicy.getMaxRetries();
        for (int attempt = 0; ; attempt++) {
            rateLimiter.acquire();
            try {
                return CallResult.ok(request.get());
            } catch (ProviderRateLimitedException e) {
                if (attempt >= maxRetries) {
                    log.warn("{}: rate limited, giving up after {} retries", operation, maxRetries);
                    return CallResult.rateLimited(e.getMessage());
                }
                long waitMs = retryPolicy.delayMs(attempt);
                log.info("{}: rate limited (429), waiting {}ms (retry {}/{})", operation, waitMs, attempt + 1, maxRetries);
                try {
                    sleeper.sleep(waitMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return CallResult.failed(operation + " interrupted during backoff");
                }
            } catch (RuntimeException e) {
                log.warn("{} failed: {}", operation, e.getMessage());
                return CallResult.failed(e.getMessage());
            }
        }
    }
}
