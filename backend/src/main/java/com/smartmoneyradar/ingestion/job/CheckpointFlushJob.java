package com.smartmoneyradar.ingestion.job;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Writes polling checkpoints to the store periodically and once more on shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CheckpointFlushJob {

    private final CheckpointRegistry checkpointRegistry;

    @Scheduled(
            fixedDelayString = "${smartmoney.ingestion.polling.checkpoint-flush-interval-ms:600000}",
            initialDelayString = "${smartmoney.ingestion.polling.checkpoint-flush-interval-ms:600000}")
    public void runScheduled() {
        try {
            checkpointRegistry.flush();
        } catch (RuntimeException e) {
            log.warn("Checkpoint flush failed: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void flushOnShutdown() {
        log.info("Flushing checkpoints on shutdown");
        runScheduled();
    }
}
