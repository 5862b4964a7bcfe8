package com.smartmoneyradar.ingestion.job;

import com.smartmoneyradar.alert.engine.AlertEngine;
import com.smartmoneyradar.common.Sleeper;
import com.smartmoneyradar.ingestion.adapter.CallResult;
import com.smartmoneyradar.ingestion.adapter.ChainDataProvider;
import com.smartmoneyradar.ingestion.config.PollingProperties;
import com.smartmoneyradar.ingestion.filter.TrackedWallets;
import com.smartmoneyradar.ingestion.model.EnhancedTransaction;
import com.smartmoneyradar.ingestion.model.TransactionIdInfo;
import com.smartmoneyradar.ingestion.pipeline.MonitorStats;
import com.smartmoneyradar.ingestion.pipeline.SwapProcessingPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backup polling of tracked wallets in fixed-size batches. Per wallet: newest signatures since the checkpoint,
 * checkpoint moved to the newest one, failed and already-processed signatures dropped. The batch's signatures
 * are then resolved in chunks of {@link ChainDataProvider#MAX_ENHANCED_BATCH} and fed to the pipeline.
 * A rate-limited batch is abandoned after a short pause.
 */
@Component
@Slf4j
public class WalletPollingJob {

    private final ChainDataProvider chainDataProvider;
    private final TrackedWallets trackedWallets;
    private final CheckpointRegistry checkpointRegistry;
    private final SwapProcessingPipeline pipeline;
    private final AlertEngine alertEngine;
    private final MonitorStats monitorStats;
    private final PollingProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public WalletPollingJob(ChainDataProvider chainDataProvider,
                            TrackedWallets trackedWallets,
                            CheckpointRegistry checkpointRegistry,
                            SwapProcessingPipeline pipeline,
                            AlertEngine alertEngine,
                            MonitorStats monitorStats,
                            PollingProperties properties) {
        this(chainDataProvider, trackedWallets, checkpointRegistry, pipeline, alertEngine, monitorStats, properties,
                Sleeper.THREAD);
    }

    WalletPollingJob(ChainDataProvider chainDataProvider,
                     TrackedWallets trackedWallets,
                     CheckpointRegistry checkpointRegistry,
                     SwapProcessingPipeline pipeline,
                     AlertEngine alertEngine,
                     MonitorStats monitorStats,
                     PollingProperties properties,
                     Sleeper sleeper) {
        this.chainDataProvider = chainDataProvider;
        this.trackedWallets = trackedWallets;
        this.checkpointRegistry = checkpointRegistry;
        this.pipeline = pipeline;
        this.alertEngine = alertEngine;
        this.monitorStats = monitorStats;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    @Scheduled(
            fixedRateString = "${smartmoney.ingestion.polling.interval-ms:300000}",
            initialDelayString = "${smartmoney.ingestion.polling.initial-delay-ms:10000}")
    public void runScheduled() {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.warn("Polling cycle failed: {}", e.getMessage(), e);
        }
    }

    /** One full pass over all tracked wallets. */
    public void runCycle() {
        long cycle = monitorStats.incrementCycles();
        List<String> wallets = trackedWallets.asList();
        int batchSize = Math.max(1, properties.getBatchSize());
        for (int i = 0; i < wallets.size(); i += batchSize) {
            processBatch(wallets.subList(i, Math.min(i + batchSize, wallets.size())));
        }
        int every = properties.getSummaryEveryCycles();
        if (every > 0 && cycle % every == 0) {
            log.info("Cycle {} | {} swaps | {} alerts | {} fake alerts blocked | uptime {}h",
                    cycle, monitorStats.swapsFound(), monitorStats.alertsSent(), alertEngine.fakeAlertsBlocked(),
                    String.format("%.1f", monitorStats.uptime().toMinutes() / 60.0));
        }
    }

    void processBatch(List<String> batch) {
        Map<String, String> walletBySignature = new LinkedHashMap<>();
        for (String wallet : batch) {
            String since = checkpointRegistry.get(wallet).orElse(null);
            CallResult<List<TransactionIdInfo>> result =
                    chainDataProvider.getLatestTransactionIds(wallet, properties.getFetchLimit(), since);
            if (result.isRateLimited()) {
                pauseAfterRateLimit(batch.size());
                return;
            }
            if (!result.hasData()) {
                log.warn("Signature fetch failed for {}: {}", wallet, result.error());
                continue;
            }
            List<TransactionIdInfo> ids = result.data();
            if (ids.isEmpty()) {
                continue;
            }
            checkpointRegistry.update(wallet, ids.get(0).signature());
            for (TransactionIdInfo id : ids) {
                if (!id.failed() && !alertEngine.isProcessed(id.signature())) {
                    walletBySignature.putIfAbsent(id.signature(), wallet);
                }
            }
        }
        if (walletBySignature.isEmpty()) {
            return;
        }
        List<String> signatures = new ArrayList<>(walletBySignature.keySet());
        for (int i = 0; i < signatures.size(); i += ChainDataProvider.MAX_ENHANCED_BATCH) {
            List<String> chunk = signatures.subList(i, Math.min(i + ChainDataProvider.MAX_ENHANCED_BATCH,
                    signatures.size()));
            CallResult<List<EnhancedTransaction>> enhanced = chainDataProvider.getEnhancedTransactions(chunk);
            if (!enhanced.hasData()) {
                log.warn("Enhanced transactions unavailable ({} ids, {}): {}", chunk.size(), enhanced.status(),
                        enhanced.error());
                continue;
            }
            for (EnhancedTransaction tx : enhanced.data()) {
                String wallet = walletBySignature.get(tx.signature());
                if (wallet != null) {
                    pipeline.process(tx, wallet);
                }
            }
        }
    }

    private void pauseAfterRateLimit(int batchSize) {
        log.warn("Batch of {} wallets rate limited, pausing {}ms", batchSize, properties.getRateLimitPauseMs());
        try {
            sleeper.sleep(properties.getRateLimitPauseMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
