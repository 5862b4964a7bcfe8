package com.smartmoneyradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backoff on provider rate limits (exponential, optional ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "smartmoney.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for the first retry; doubles each attempt. Default 2000. */
    private long baseDelayMs = 2000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0 (deterministic 2s/4s/8s). */
    private double jitterFactor = 0.0;

    /** Max retries after the initial call. Default 3. */
    private int maxRetries = 3;
}
