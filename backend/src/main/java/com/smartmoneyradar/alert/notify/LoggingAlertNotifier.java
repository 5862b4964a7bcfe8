package com.smartmoneyradar.alert.notify;

import com.smartmoneyradar.alert.engine.AlertDecision;
import com.smartmoneyradar.alert.engine.WalletPurchase;
import com.smartmoneyradar.alert.report.DailyReport;
import com.smartmoneyradar.alert.report.TokenSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;
import java.util.StringJoiner;

/**
 * Writes alerts and daily reports to the application log in a fixed, greppable format.
 */
@Component
@Slf4j
public class LoggingAlertNotifier implements AlertNotifier {

    private static final DateTimeFormatter REPORT_DAY = DateTimeFormatter.ofPattern("dd.MM.yyyy");
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    @Override
    public boolean notify(AlertDecision decision) {
        log.info(format(decision));
        return true;
    }

    static String format(AlertDecision decision) {
        StringJoiner lines = new StringJoiner("\n");
        String header = decision.isBullish()
                ? "BULLISH ALERT #" + decision.streakPosition()
                : "SMART MONEY ALERT";
        lines.add(header + ": " + decision.symbol() + " (" + decision.assetMint() + ")");
        lines.add("Wallets: " + decision.walletCount() + " (threshold " + decision.effectiveThreshold() + ")");
        lines.add("Valuation: $" + usd(decision.currentValuationUsd()));
        if (decision.isBullish()) {
            lines.add("First alert valuation: $" + usd(decision.baselineValuationUsd()));
        }
        lines.add("Liquidity: $" + usd(decision.snapshot().liquidityUsd())
                + " | Volume 24h: $" + usd(decision.snapshot().volume24hUsd())
                + " | Txns 24h: " + decision.snapshot().txns24h());
        for (WalletPurchase w : decision.displayWallets()) {
            lines.add("  " + w.wallet() + " spent " + w.nativeSpent() + " SOL at $"
                    + usd(w.valuationAtPurchaseUsd()));
        }
        int hidden = decision.walletCount() - decision.displayWallets().size();
        if (hidden > 0) {
            lines.add("  +" + hidden + " more");
        }
        return lines.toString();
    }

    @Override
    public boolean notifyReport(DailyReport report) {
        log.info(formatReport(report));
        return true;
    }

    static String formatReport(DailyReport report) {
        StringJoiner lines = new StringJoiner("\n");
        lines.add("DAILY CLOSE: " + REPORT_DAY.format(report.day()));
        if (report.isEmpty()) {
            lines.add("No alerts.");
            return lines.toString();
        }
        for (TokenSummary t : report.tokens()) {
            lines.add(tokenLine(t));
        }
        lines.add("----");
        int judged = report.judged().size();
        if (judged > 0) {
            lines.add(report.wins() + "W / " + report.losses() + "L: " + judged + " tokens ("
                    + percentOf(report.wins(), judged) + "% peak win rate)");
        }
        if (report.withoutAlertValuation() > 0) {
            lines.add(report.withoutAlertValuation() + " tokens without alert valuation");
        }
        long classified = report.trashCount() + report.successCount();
        if (classified > 0) {
            lines.add("Trash: " + report.trashCount() + "/" + classified + " ("
                    + percentOf(report.trashCount(), classified) + "%) | Successful: " + report.successCount());
        }
        if (report.unevaluatedCount() > 0) {
            lines.add("Not yet evaluated: " + report.unevaluatedCount());
        }
        lines.add("Total alerts: " + report.totalAlerts() + " (" + report.tokens().size() + " tokens)");
        return lines.toString();
    }

    private static String tokenLine(TokenSummary t) {
        String entry = compactUsd(t.alertValuationUsd());
        String now = compactUsd(t.currentValuationUsd());
        if (t.hasAlertValuation() && t.peakChangePct() != null) {
            return (t.win() ? "[W] " : "[L] ") + t.symbol() + " | " + entry + " -> peak "
                    + compactUsd(t.peakValuationUsd()) + " (" + signedPct(t.peakChangePct()) + ") | now " + now
                    + " (" + (t.changePct() == null ? "?" : signedPct(t.changePct())) + ")";
        }
        if (t.hasAlertValuation() && t.changePct() != null) {
            return (t.win() ? "[W] " : "[L] ") + t.symbol() + " | " + entry + " -> now " + now
                    + " (" + signedPct(t.changePct()) + ")";
        }
        return "[?] " + t.symbol() + " | ? -> now " + now + " (no data)";
    }

    /** $1.2M, $350K, $900, $0. */
    static String compactUsd(BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            return "$0";
        }
        if (value.compareTo(MILLION) >= 0) {
            return "$" + value.divide(MILLION, 1, RoundingMode.HALF_UP).toPlainString() + "M";
        }
        if (value.compareTo(THOUSAND) >= 0) {
            return "$" + value.divide(THOUSAND, 0, RoundingMode.HALF_UP).toPlainString() + "K";
        }
        return "$" + value.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }

    private static String signedPct(BigDecimal pct) {
        BigDecimal whole = pct.setScale(0, RoundingMode.HALF_UP);
        return (whole.signum() >= 0 ? "+" : "") + whole.toPlainString() + "%";
    }

    private static long percentOf(long part, long total) {
        return Math.round(part * 100.0 / total);
    }

    private static String usd(BigDecimal value) {
        return value == null ? "0" : value.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }
}
