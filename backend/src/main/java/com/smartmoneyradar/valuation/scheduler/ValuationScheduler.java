package com.smartmoneyradar.valuation.scheduler;

import com.smartmoneyradar.domain.ValuationCheckEvent;
import com.smartmoneyradar.domain.ValuationOutcome;
import com.smartmoneyradar.store.DecisionStore;
import com.smartmoneyradar.valuation.config.ValuationProperties;
import com.smartmoneyradar.valuation.market.AssetSnapshot;
import com.smartmoneyradar.valuation.market.AssetSnapshotProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Deferred valuation checks after an alert: 60s, 300s (short-list threshold), 900s, 1800s (contracts-check
 * threshold). Tracks a per-alert peak valuation that never decreases.
 * <p>
 * The queue and peaks are guarded by one lock; snapshot lookups and store writes run outside it.
 */
@Component
@Slf4j
public class ValuationScheduler {

    private final AssetSnapshotProvider snapshotProvider;
    private final DecisionStore decisionStore;
    private final ValuationProperties properties;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<PendingValuationCheck> queue =
            new PriorityQueue<>(Comparator.comparing(PendingValuationCheck::fireAt));
    /** Peak per alert lifecycle; dropped once the lifecycle's last check ran. */
    private final Map<Lifecycle, Track> tracks = new HashMap<>();

    public ValuationScheduler(AssetSnapshotProvider snapshotProvider,
                              DecisionStore decisionStore,
                              ValuationProperties properties,
                              Clock clock) {
        this.snapshotProvider = snapshotProvider;
        this.decisionStore = decisionStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Queues the four checks for an alert raised now.
     *
     * @return the alert time that identifies this lifecycle
     */
    public Instant schedule(String assetMint, String symbol, BigDecimal baselineValuationUsd, List<String> wallets) {
        Instant alertTime = clock.instant();
        BigDecimal baseline = baselineValuationUsd == null ? BigDecimal.ZERO : baselineValuationUsd;
        List<String> involved = wallets == null ? List.of() : List.copyOf(wallets);
        lock.lock();
        try {
            for (ValuationCheckpoint cp : ValuationCheckpoint.values()) {
                queue.add(new PendingValuationCheck(assetMint, symbol, baseline, alertTime, involved,
                        alertTime.plus(cp.offset()), cp, thresholdFor(cp)));
            }
            tracks.put(new Lifecycle(assetMint, alertTime), new Track(baseline, ValuationCheckpoint.values().length));
        } finally {
            lock.unlock();
        }
        log.info("Valuation checks scheduled: {} ({}) at {}s/{}s/{}s/{}s", symbol, assetMint,
                ValuationCheckpoint.OFFSET_1.offset().toSeconds(), ValuationCheckpoint.OFFSET_2.offset().toSeconds(),
                ValuationCheckpoint.OFFSET_3.offset().toSeconds(), ValuationCheckpoint.OFFSET_4.offset().toSeconds());
        return alertTime;
    }

    private Double thresholdFor(ValuationCheckpoint cp) {
        return switch (cp) {
            case OFFSET_2 -> properties.getShortListThreshold();
            case OFFSET_4 -> properties.getContractsCheckThreshold();
            default -> null;
        };
    }

    /**
     * Runs every check whose fire time is at or before {@code now}, in fire-time order.
     */
    public List<ValuationCheckResult> tick(Instant now) {
        List<PendingValuationCheck> due = new ArrayList<>();
        lock.lock();
        try {
            while (!queue.isEmpty() && !queue.peek().fireAt().isAfter(now)) {
                due.add(queue.poll());
            }
        } finally {
            lock.unlock();
        }
        List<ValuationCheckResult> results = new ArrayList<>(due.size());
        for (PendingValuationCheck check : due) {
            results.add(execute(check, now));
        }
        return results;
    }

    private ValuationCheckResult execute(PendingValuationCheck check, Instant now) {
        Optional<AssetSnapshot> snapshot = snapshotProvider.getAssetSnapshot(check.assetMint());
        if (snapshot.isEmpty()) {
            log.warn("Valuation {} for {}: snapshot unavailable, using 0", check.checkpoint().label(), check.symbol());
        }
        BigDecimal current = snapshot.map(AssetSnapshot::marketValuationUsd).orElse(BigDecimal.ZERO);
        double change = change(check.alertValuationUsd(), current);
        ValuationOutcome outcome = classify(check, current, change);
        BigDecimal peak = updatePeak(check, current);

        decisionStore.recordValuationCheck(new ValuationCheckEvent(
                check.assetMint(), check.symbol(), check.alertValuationUsd(), check.alertTime(), check.wallets(),
                check.checkpoint().label(), check.checkpoint().offset().toSeconds(), current, change, outcome,
                peak, now));

        log.info("Valuation {}: {} | alert ${} -> now ${} ({}%){}", check.checkpoint().label(), check.symbol(),
                check.alertValuationUsd().toBigInteger(), current.toBigInteger(),
                String.format("%+.1f", change * 100), outcome == null ? "" : " -> " + outcome.label());
        return new ValuationCheckResult(check.assetMint(), check.symbol(), check.checkpoint(), current, change,
                outcome, peak, snapshot.isPresent());
    }

    static double change(BigDecimal baseline, BigDecimal current) {
        if (baseline == null || baseline.signum() <= 0) {
            return 0.0;
        }
        return current.subtract(baseline).divide(baseline, MathContext.DECIMAL64).doubleValue();
    }

    private ValuationOutcome classify(PendingValuationCheck check, BigDecimal current, double change) {
        if (!check.hasThreshold()) {
            return null;
        }
        if (current.compareTo(properties.getDeadValuationFloorUsd()) <= 0) {
            return ValuationOutcome.TRASH;
        }
        if (change >= check.threshold()) {
            return check.checkpoint().passOutcome();
        }
        return ValuationOutcome.NOT_SHORT_LIST;
    }

    private BigDecimal updatePeak(PendingValuationCheck check, BigDecimal current) {
        Lifecycle key = new Lifecycle(check.assetMint(), check.alertTime());
        lock.lock();
        try {
            Track track = tracks.computeIfAbsent(key, k -> new Track(check.alertValuationUsd(), 1));
            if (current.compareTo(track.peak) > 0) {
                track.peak = current;
            }
            BigDecimal peak = track.peak;
            if (--track.remaining <= 0) {
                tracks.remove(key);
            }
            return peak;
        } finally {
            lock.unlock();
        }
    }

    /** Current peak of an alert lifecycle whose checks are still pending. */
    public Optional<BigDecimal> peakValuation(String assetMint, Instant alertTime) {
        lock.lock();
        try {
            Track track = tracks.get(new Lifecycle(assetMint, alertTime));
            return track == null ? Optional.empty() : Optional.of(track.peak);
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /** Drops all queued checks and peaks. */
    public void reset() {
        lock.lock();
        try {
            queue.clear();
            tracks.clear();
        } finally {
            lock.unlock();
        }
    }

    private record Lifecycle(String assetMint, Instant alertTime) {
    }

    private static final class Track {
        private BigDecimal peak;
        private int remaining;

        private Track(BigDecimal peak, int remaining) {
            this.peak = peak;
            this.remaining = remaining;
        }
    }
}
