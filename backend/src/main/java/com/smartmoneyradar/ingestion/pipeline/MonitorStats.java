package com.smartmoneyradar.ingestion.pipeline;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters shown by the health endpoint and the periodic polling summary.
 */
@Component
public class MonitorStats {

    private final Clock clock;
    private final Instant startedAt;
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong swapsFound = new AtomicLong();
    private final AtomicLong purchasesAccepted = new AtomicLong();
    private final AtomicLong alertsSent = new AtomicLong();
    private final AtomicLong webhookTransactions = new AtomicLong();

    public MonitorStats(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public long incrementCycles() {
        return cycles.incrementAndGet();
    }

    public void swapFound() {
        swapsFound.incrementAndGet();
    }

    public void purchaseAccepted() {
        purchasesAccepted.incrementAndGet();
    }

    public void alertSent() {
        alertsSent.incrementAndGet();
    }

    public void webhookTransactions(int count) {
        webhookTransactions.addAndGet(count);
    }

    public long cycles() {
        return cycles.get();
    }

    public long swapsFound() {
        return swapsFound.get();
    }

    public long alertsSent() {
        return alertsSent.get();
    }

    public Duration uptime() {
        return Duration.between(startedAt, clock.instant());
    }

    public Map<String, Object> snapshot(long fakeAlertsBlocked) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("cycles", cycles.get());
        m.put("swapsFound", swapsFound.get());
        m.put("purchasesAccepted", purchasesAccepted.get());
        m.put("alertsSent", alertsSent.get());
        m.put("fakeAlertsBlocked", fakeAlertsBlocked);
        m.put("webhookTransactions", webhookTransactions.get());
        m.put("startedAt", startedAt.toString());
        return m;
    }
}
