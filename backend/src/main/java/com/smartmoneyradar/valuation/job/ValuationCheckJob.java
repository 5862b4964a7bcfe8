package com.smartmoneyradar.valuation.job;

import com.smartmoneyradar.valuation.scheduler.ValuationCheckResult;
import com.smartmoneyradar.valuation.scheduler.ValuationScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Drains due valuation checks on the scheduler pool.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ValuationCheckJob {

    private final ValuationScheduler valuationScheduler;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${smartmoney.valuation.tick-interval-ms:60000}",
            initialDelayString = "${smartmoney.valuation.tick-interval-ms:60000}")
    public void runScheduled() {
        try {
            List<ValuationCheckResult> results = valuationScheduler.tick(clock.instant());
            if (!results.isEmpty()) {
                log.debug("Valuation tick: {} checks run, {} pending", results.size(), valuationScheduler.pendingCount());
            }
        } catch (RuntimeException e) {
            log.error("Valuation tick failed", e);
        }
    }
}
