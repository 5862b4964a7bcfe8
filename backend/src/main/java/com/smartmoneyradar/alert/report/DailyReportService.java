package com.smartmoneyradar.alert.report;

import com.smartmoneyradar.alert.config.ReportProperties;
import com.smartmoneyradar.domain.ValuationOutcome;
import com.smartmoneyradar.store.DecisionStore;
import com.smartmoneyradar.store.ReportedAlert;
import com.smartmoneyradar.valuation.market.AssetSnapshot;
import com.smartmoneyradar.valuation.market.AssetSnapshotProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the daily closing report: the day's alerts grouped per asset, each compared against a live snapshot.
 * The first alert's valuation is the entry; the peak is the larger of the stored peak and the current valuation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DailyReportService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final String UNKNOWN_SYMBOL = "???";

    private final DecisionStore decisionStore;
    private final AssetSnapshotProvider snapshotProvider;
    private final ReportProperties properties;
    private final Clock clock;

    /** The local day before today, in the report zone. */
    public LocalDate previousDay() {
        return LocalDate.now(clock.withZone(zone())).minusDays(1);
    }

    public DailyReport build(LocalDate day) {
        ZoneId zone = zone();
        Instant from = day.atStartOfDay(zone).toInstant();
        Instant to = day.plusDays(1).atStartOfDay(zone).toInstant();
        List<ReportedAlert> alerts = decisionStore.findAlertsBetween(from, to);

        Map<String, Group> groups = new LinkedHashMap<>();
        for (ReportedAlert alert : alerts) {
            groups.computeIfAbsent(alert.assetMint(), mint -> new Group(alert)).add(alert);
        }
        List<TokenSummary> tokens = new ArrayList<>(groups.size());
        for (Group group : groups.values()) {
            tokens.add(summarize(group));
        }
        tokens.sort(Comparator.comparing(TokenSummary::peakChangePct,
                Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder())));
        log.info("Daily report for {}: {} alerts over {} tokens", day, alerts.size(), tokens.size());
        return new DailyReport(day, tokens, alerts.size());
    }

    private TokenSummary summarize(Group group) {
        BigDecimal current = snapshotProvider.getAssetSnapshot(group.assetMint)
                .map(AssetSnapshot::marketValuationUsd)
                .orElse(BigDecimal.ZERO);
        BigDecimal peak = group.peak.max(current);
        BigDecimal entry = group.alertValuation;
        boolean hasEntry = entry.signum() > 0;

        BigDecimal change = hasEntry ? percentChange(entry, current) : null;
        BigDecimal peakChange = hasEntry && peak.signum() > 0 ? percentChange(entry, peak) : null;
        boolean win;
        if (peakChange != null) {
            win = peakChange.signum() > 0;
        } else {
            win = change != null && change.signum() > 0;
        }
        return new TokenSummary(group.assetMint, group.symbol, entry, current, peak, change, peakChange, win,
                group.count, group.classification);
    }

    private static BigDecimal percentChange(BigDecimal from, BigDecimal to) {
        return to.subtract(from).multiply(HUNDRED).divide(from, 1, RoundingMode.HALF_UP);
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getZone());
    }

    private static final class Group {
        private final String assetMint;
        private final String symbol;
        private final BigDecimal alertValuation;
        private BigDecimal peak = BigDecimal.ZERO;
        private ValuationOutcome classification;
        private int count;

        Group(ReportedAlert first) {
            this.assetMint = first.assetMint();
            this.symbol = first.symbol() == null || first.symbol().isBlank() ? UNKNOWN_SYMBOL : first.symbol();
            this.alertValuation = first.alertValuationUsd();
        }

        void add(ReportedAlert alert) {
            count++;
            if (classification == null) {
                classification = alert.classification();
            }
            if (alert.peakValuationUsd() != null) {
                peak = peak.max(alert.peakValuationUsd());
            }
        }
    }
}
