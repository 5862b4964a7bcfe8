package com.smartmoneyradar.ingestion.pipeline;

import com.smartmoneyradar.alert.config.AlertProperties;
import com.smartmoneyradar.alert.engine.AlertDecision;
import com.smartmoneyradar.alert.engine.AlertEngine;
import com.smartmoneyradar.alert.engine.IngestOutcome;
import com.smartmoneyradar.alert.notify.AlertNotifier;
import com.smartmoneyradar.domain.AlertRecord;
import com.smartmoneyradar.domain.PurchaseEventRecord;
import com.smartmoneyradar.domain.SwapEvent;
import com.smartmoneyradar.domain.TradeSignal;
import com.smartmoneyradar.ingestion.classifier.SwapClassifier;
import com.smartmoneyradar.ingestion.classifier.SwapDecision;
import com.smartmoneyradar.ingestion.classifier.SwapDetails;
import com.smartmoneyradar.ingestion.classifier.SwapExtraction;
import com.smartmoneyradar.ingestion.model.EnhancedTransaction;
import com.smartmoneyradar.store.DecisionStore;
import com.smartmoneyradar.valuation.scheduler.ValuationScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Shared path for polled and pushed transactions: classify, extract the purchase, ingest, evaluate, then
 * notify, persist, emit a trade signal and schedule valuation checks for a raised alert.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SwapProcessingPipeline {

    private final SwapClassifier swapClassifier;
    private final AlertEngine alertEngine;
    private final AlertNotifier alertNotifier;
    private final DecisionStore decisionStore;
    private final ValuationScheduler valuationScheduler;
    private final MonitorStats monitorStats;
    private final AlertProperties alertProperties;
    private final Clock clock;

    /**
     * @param wallet tracked wallet the transaction was fetched for or matched to
     * @return the alert raised by this transaction, if any
     */
    public Optional<AlertDecision> process(EnhancedTransaction tx, String wallet) {
        SwapDecision decision = swapClassifier.classify(tx);
        if (!decision.isSwap()) {
            log.debug("Skipped {} ({}): {}", tx.signature(), decision.type(), decision.reason());
            return Optional.empty();
        }
        SwapExtraction extraction = swapClassifier.extractSwap(tx, wallet);
        if (!extraction.isValid()) {
            log.debug("No purchase in {} for {}: {}", tx.signature(), wallet, extraction.rejectionReason());
            return Optional.empty();
        }
        monitorStats.swapFound();
        SwapEvent event = toEvent(tx, wallet, extraction.details());

        IngestOutcome outcome = alertEngine.ingest(wallet, event);
        if (!outcome.isAccepted()) {
            return Optional.empty();
        }
        monitorStats.purchaseAccepted();
        decisionStore.recordPurchaseEvent(toPurchaseRecord(event, outcome));

        Optional<AlertDecision> alert = alertEngine.evaluate(event.assetMint());
        alert.ifPresent(this::dispatch);
        return alert;
    }

    private void dispatch(AlertDecision decision) {
        boolean delivered;
        try {
            delivered = alertNotifier.notify(decision);
        } catch (RuntimeException e) {
            log.warn("Alert delivery failed for {}: {}", decision.assetMint(), e.getMessage());
            delivered = false;
        }
        if (delivered) {
            monitorStats.alertSent();
        }
        decisionStore.recordAlert(toAlertRecord(decision));
        decisionStore.recordTradeSignal(toTradeSignal(decision),
                Duration.ofSeconds(alertProperties.getTradeSignalCooldownSeconds()));
        valuationScheduler.schedule(decision.assetMint(), decision.symbol(), decision.currentValuationUsd(),
                decision.walletAddresses());
    }

    private SwapEvent toEvent(EnhancedTransaction tx, String wallet, SwapDetails details) {
        Instant observedAt = tx.timestamp() != null ? Instant.ofEpochSecond(tx.timestamp()) : clock.instant();
        return new SwapEvent(wallet, details.assetMint(), details.amountReceived(), details.nativeSpent(),
                tx.signature(), details.sourceLabel(), observedAt);
    }

    private PurchaseEventRecord toPurchaseRecord(SwapEvent event, IngestOutcome outcome) {
        PurchaseEventRecord r = new PurchaseEventRecord();
        r.setWalletAddress(event.wallet());
        r.setAssetMint(event.assetMint());
        r.setSymbol(outcome.snapshot().symbol());
        r.setSignature(event.signature());
        r.setNativeSpent(event.nativeSpent());
        r.setValuationUsd(outcome.snapshot().marketValuationUsd());
        r.setCreatedAt(clock.instant());
        return r;
    }

    private static TradeSignal toTradeSignal(AlertDecision decision) {
        TradeSignal s = new TradeSignal();
        s.setAssetMint(decision.assetMint());
        s.setSymbol(decision.symbol());
        s.setEntryValuationUsd(decision.currentValuationUsd());
        s.setTrigger(decision.isBullish() ? TradeSignal.Trigger.BULLISH : TradeSignal.Trigger.WALLET_CLUSTER);
        s.setWalletCount(decision.walletCount());
        s.setCreatedAt(decision.decidedAt());
        return s;
    }

    private static AlertRecord toAlertRecord(AlertDecision decision) {
        AlertRecord r = new AlertRecord();
        r.setAssetMint(decision.assetMint());
        r.setSymbol(decision.symbol());
        r.setAlertValuationUsd(decision.currentValuationUsd());
        r.setBaselineValuationUsd(decision.baselineValuationUsd());
        r.setWalletCount(decision.walletCount());
        r.setWallets(new ArrayList<>(decision.walletAddresses()));
        r.setStreakPosition(decision.streakPosition());
        r.setBullish(decision.isBullish());
        r.setCreatedAt(decision.decidedAt());
        return r;
    }
}
