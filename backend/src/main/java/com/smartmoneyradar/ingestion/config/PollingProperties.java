package com.smartmoneyradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backup polling of tracked wallets. The interval itself is read by @Scheduled from
 * smartmoney.ingestion.polling.interval-ms.
 */
@ConfigurationProperties(prefix = "smartmoney.ingestion.polling")
@NoArgsConstructor
@Getter
@Setter
public class PollingProperties {

    /** false = webhook-only mode. */
    private boolean enabled = true;

    /** Cycle period (fixed rate). Default 300000 (5 min). */
    private long intervalMs = 300_000L;

    /** Wallets per batch. Default 25. */
    private int batchSize = 25;

    /** Signatures fetched per wallet per cycle. Default 5. */
    private int fetchLimit = 5;

    /** Pause after a rate-limited batch before moving on. Default 5000. */
    private long rateLimitPauseMs = 5_000L;

    /** Log a summary every N cycles. Default 20. */
    private int summaryEveryCycles = 20;

    /** Checkpoint flush period, read by CheckpointFlushJob. Default 600000 (10 min). */
    private long checkpointFlushIntervalMs = 600_000L;
}
