package com.smartmoneyradar.alert.engine;

import com.smartmoneyradar.alert.config.AlertProperties;
import com.smartmoneyradar.common.ExcludedAssetRegistry;
import com.smartmoneyradar.domain.SwapEvent;
import com.smartmoneyradar.valuation.market.AssetSnapshot;
import com.smartmoneyradar.valuation.market.AssetSnapshotProvider;
import com.smartmoneyradar.valuation.market.NativePriceResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides when enough distinct tracked wallets bought the same asset inside the sliding window.
 * <p>
 * Window, processed ids and alert states are guarded by one lock. Market lookups run outside it, so
 * {@link #evaluate} re-checks threshold and cooldown before committing an alert.
 */
@Component
@Slf4j
public class AlertEngine {

    private final AlertProperties properties;
    private final ExcludedAssetRegistry excludedAssets;
    private final AssetSnapshotProvider snapshotProvider;
    private final NativePriceResolver nativePriceResolver;
    private final Clock clock;
    private final BlackoutSchedule blackout;

    private final ReentrantLock lock = new ReentrantLock();
    private final PurchaseWindow window;
    private final ProcessedIdSet processedIds;
    private final Map<String, AlertState> alertStates = new LinkedHashMap<>();

    private final AtomicLong alertsRaised = new AtomicLong();
    private final AtomicLong fakeAlertsBlocked = new AtomicLong();

    public AlertEngine(AlertProperties properties,
                       ExcludedAssetRegistry excludedAssets,
                       AssetSnapshotProvider snapshotProvider,
                       NativePriceResolver nativePriceResolver,
                       Clock clock) {
        this.properties = properties;
        this.excludedAssets = excludedAssets;
        this.snapshotProvider = snapshotProvider;
        this.nativePriceResolver = nativePriceResolver;
        this.clock = clock;
        this.blackout = new BlackoutSchedule(properties.getBlackoutHours(), properties.getBlackoutExtraThreshold(),
                ZoneOffset.of(properties.getZoneOffset()));
        this.window = new PurchaseWindow(Duration.ofSeconds(properties.getWindowSeconds()));
        this.processedIds = new ProcessedIdSet(properties.getProcessedIdCapacity());
    }

    /**
     * Filters a purchase and, when it passes, adds it to the asset's window. The signature is marked as
     * processed before any filter runs, so a rejected event is never reconsidered. Expired records are pruned
     * before the repeat-wallet check, so a wallet buying again after the window starts a new record.
     */
    public IngestOutcome ingest(String wallet, SwapEvent event) {
        String asset = event.assetMint();
        lock.lock();
        try {
            if (!processedIds.add(event.signature())) {
                return IngestOutcome.rejected(IngestOutcome.Status.DUPLICATE, event.signature());
            }
            if (excludedAssets.isExcludedMint(asset)) {
                return reject(IngestOutcome.Status.EXCLUDED_ASSET, asset, "excluded mint");
            }
            window.prune(clock.instant());
            if (window.containsWallet(asset, wallet)) {
                return reject(IngestOutcome.Status.DUPLICATE_WALLET, asset, "wallet already in window");
            }
        } finally {
            lock.unlock();
        }

        Optional<AssetSnapshot> found = snapshotProvider.getAssetSnapshot(asset);
        if (found.isEmpty()) {
            return reject(IngestOutcome.Status.SNAPSHOT_UNAVAILABLE, asset, "no market data");
        }
        AssetSnapshot snapshot = found.get();
        if (excludedAssets.isExcludedSymbol(snapshot.symbol())) {
            return reject(IngestOutcome.Status.EXCLUDED_ASSET, asset, "excluded symbol " + snapshot.symbol(), snapshot);
        }
        if (snapshot.liquidityUsd().compareTo(properties.getMinLiquidityUsd()) < 0) {
            return reject(IngestOutcome.Status.BELOW_MIN_LIQUIDITY, asset,
                    "liquidity " + snapshot.liquidityUsd() + " < " + properties.getMinLiquidityUsd(), snapshot);
        }
        BigDecimal buyValueUsd = buyValueUsd(event.nativeSpent());
        if (buyValueUsd.signum() > 0 && buyValueUsd.compareTo(properties.getMinBuyUsd()) < 0) {
            return reject(IngestOutcome.Status.DUST, asset,
                    "buy $" + buyValueUsd + " < $" + properties.getMinBuyUsd(), snapshot);
        }
        if (snapshot.marketValuationUsd().compareTo(properties.getMaxValuationUsd()) > 0) {
            return reject(IngestOutcome.Status.ABOVE_MAX_VALUATION, asset,
                    "valuation " + snapshot.marketValuationUsd() + " > " + properties.getMaxValuationUsd(), snapshot);
        }
        if (snapshot.volume24hUsd().compareTo(properties.getMinVolume24hUsd()) < 0) {
            return reject(IngestOutcome.Status.BELOW_MIN_VOLUME, asset,
                    "volume " + snapshot.volume24hUsd() + " < " + properties.getMinVolume24hUsd(), snapshot);
        }
        if (snapshot.txns24h() < properties.getMinTxns24h()) {
            return reject(IngestOutcome.Status.BELOW_MIN_TXNS, asset,
                    "txns " + snapshot.txns24h() + " < " + properties.getMinTxns24h(), snapshot);
        }

        lock.lock();
        try {
            Instant now = clock.instant();
            window.prune(now);
            PurchaseRecord record = new PurchaseRecord(wallet, event.nativeSpent(), snapshot.marketValuationUsd(),
                    now, event.signature());
            if (!window.add(asset, record)) {
                return reject(IngestOutcome.Status.DUPLICATE_WALLET, asset, "wallet already in window", snapshot);
            }
        } finally {
            lock.unlock();
        }
        log.info("Purchase accepted: {} bought {} ({}) for {} SOL (~${}) at valuation ${}",
                wallet, snapshot.symbol(), asset, event.nativeSpent(), buyValueUsd, snapshot.marketValuationUsd());
        return IngestOutcome.accepted(snapshot, buyValueUsd);
    }

    private BigDecimal buyValueUsd(BigDecimal nativeSpent) {
        if (nativeSpent == null || nativeSpent.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return nativeSpent.multiply(nativePriceResolver.getNativeUsdPrice());
    }

    private static IngestOutcome reject(IngestOutcome.Status status, String asset, String detail) {
        log.debug("Purchase rejected ({}): {} {}", status, asset, detail);
        return IngestOutcome.rejected(status, detail);
    }

    private static IngestOutcome reject(IngestOutcome.Status status, String asset, String detail,
                                        AssetSnapshot snapshot) {
        log.info("Purchase rejected ({}): {} {}", status, asset, detail);
        return IngestOutcome.rejected(status, detail, snapshot);
    }

    /**
     * Raises an alert for the asset if the window holds enough distinct wallets, the cooldown allows it and a
     * fresh snapshot confirms activity. A snapshot failing the volume or transaction floors discards the window
     * (fake alert). An unavailable snapshot defers the decision and keeps the window.
     */
    public Optional<AlertDecision> evaluate(String asset) {
        Instant now = clock.instant();
        int threshold = blackout.effectiveThreshold(properties.getThreshold(), now);
        lock.lock();
        try {
            window.prune(now);
            if (!eligible(asset, threshold, now)) {
                return Optional.empty();
            }
        } finally {
            lock.unlock();
        }

        Optional<AssetSnapshot> fresh = snapshotProvider.getAssetSnapshot(asset);
        if (fresh.isEmpty()) {
            log.warn("Alert deferred for {}: fresh snapshot unavailable", asset);
            return Optional.empty();
        }
        AssetSnapshot snapshot = fresh.get();
        boolean fake = snapshot.volume24hUsd().compareTo(properties.getMinVolume24hUsd()) < 0
                || snapshot.txns24h() < properties.getMinTxns24h();

        lock.lock();
        try {
            Instant decidedAt = clock.instant();
            if (!eligible(asset, threshold, decidedAt)) {
                return Optional.empty();
            }
            if (fake) {
                window.clear(asset);
                fakeAlertsBlocked.incrementAndGet();
                log.warn("Fake alert blocked for {} ({}): volume ${} txns {}", snapshot.symbol(), asset,
                        snapshot.volume24hUsd(), snapshot.txns24h());
                return Optional.empty();
            }
            List<WalletPurchase> wallets = window.records(asset).stream()
                    .map(r -> new WalletPurchase(r.wallet(), r.nativeSpent(), r.valuationUsd()))
                    .toList();
            AlertState previous = alertStates.get(asset);
            int streak = 1;
            BigDecimal baseline = snapshot.marketValuationUsd();
            if (previous != null && Duration.between(previous.lastAlertAt(), decidedAt)
                    .compareTo(Duration.ofSeconds(properties.getBullishWindowSeconds())) <= 0) {
                streak = previous.streakCount() + 1;
                baseline = previous.streakBaselineValuationUsd();
            }
            putState(asset, new AlertState(decidedAt, wallets.size(), baseline, streak));
            alertsRaised.incrementAndGet();
            AlertDecision decision = new AlertDecision(asset, wallets, snapshot, streak, baseline, threshold, decidedAt);
            log.info("Alert: {} ({}) {} wallets, valuation ${}, streak {}{}", snapshot.symbol(), asset,
                    wallets.size(), snapshot.marketValuationUsd(), streak,
                    blackout.isBlackout(decidedAt) ? " [blackout threshold " + threshold + "]" : "");
            return Optional.of(decision);
        } finally {
            lock.unlock();
        }
    }

    /** Caller holds the lock. */
    private boolean eligible(String asset, int threshold, Instant now) {
        int count = window.uniqueWalletCount(asset);
        if (count < threshold) {
            return false;
        }
        AlertState state = alertStates.get(asset);
        if (state == null) {
            return true;
        }
        boolean cooling = Duration.between(state.lastAlertAt(), now)
                .compareTo(Duration.ofSeconds(properties.getCooldownSeconds())) <= 0;
        if (cooling && count <= state.walletCountAtLastAlert()) {
            log.debug("Alert suppressed for {}: cooldown, {} wallets (last alert {})", asset, count,
                    state.walletCountAtLastAlert());
            return false;
        }
        return true;
    }

    /** Caller holds the lock. */
    private void putState(String asset, AlertState state) {
        alertStates.remove(asset);
        alertStates.put(asset, state);
        if (alertStates.size() > properties.getAlertStateCapacity()) {
            List<Map.Entry<String, AlertState>> entries = new ArrayList<>(alertStates.entrySet());
            entries.sort(Comparator.comparing(e -> e.getValue().lastAlertAt()));
            int toRemove = entries.size() / 2;
            for (int i = 0; i < toRemove; i++) {
                alertStates.remove(entries.get(i).getKey());
            }
        }
    }

    public Optional<AlertState> alertState(String asset) {
        lock.lock();
        try {
            return Optional.ofNullable(alertStates.get(asset));
        } finally {
            lock.unlock();
        }
    }

    public int uniqueWalletCount(String asset) {
        lock.lock();
        try {
            return window.uniqueWalletCount(asset);
        } finally {
            lock.unlock();
        }
    }

    public int trackedAssetCount() {
        lock.lock();
        try {
            return window.assetCount();
        } finally {
            lock.unlock();
        }
    }

    /** True when the signature was already ingested by either path. */
    public boolean isProcessed(String signature) {
        lock.lock();
        try {
            return processedIds.contains(signature);
        } finally {
            lock.unlock();
        }
    }

    public int processedIdCount() {
        lock.lock();
        try {
            return processedIds.size();
        } finally {
            lock.unlock();
        }
    }

    public int effectiveThreshold() {
        return blackout.effectiveThreshold(properties.getThreshold(), clock.instant());
    }

    public long alertsRaised() {
        return alertsRaised.get();
    }

    public long fakeAlertsBlocked() {
        return fakeAlertsBlocked.get();
    }

    /** Clears window, processed ids and alert states. */
    public void reset() {
        lock.lock();
        try {
            window.reset();
            processedIds.clear();
            alertStates.clear();
        } finally {
            lock.unlock();
        }
    }
}
