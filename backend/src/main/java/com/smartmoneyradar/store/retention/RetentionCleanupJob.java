package com.smartmoneyradar.store.retention;

import com.smartmoneyradar.store.DecisionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Daily purge of stored decisions older than the retention period.
 */
@Component
@EnableConfigurationProperties(RetentionProperties.class)
@Slf4j
public class RetentionCleanupJob {

    private final DecisionStore decisionStore;
    private final RetentionProperties properties;
    private final Clock clock;

    public RetentionCleanupJob(DecisionStore decisionStore, RetentionProperties properties, Clock clock) {
        this.decisionStore = decisionStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${smartmoney.retention.cron:0 0 4 * * *}", zone = "UTC")
    public void runScheduled() {
        if (!properties.isEnabled()) {
            return;
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getDays()));
        Map<String, Long> removed = decisionStore.purgeOlderThan(cutoff);
        log.info("Retention cleanup before {}: {}", cutoff, removed);
    }
}
