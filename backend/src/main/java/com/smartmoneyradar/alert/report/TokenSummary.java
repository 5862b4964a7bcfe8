package com.smartmoneyradar.alert.report;

import com.smartmoneyradar.domain.ValuationOutcome;

import java.math.BigDecimal;

/**
 * One asset's line in the daily report.
 *
 * @param alertValuationUsd   valuation at the asset's first alert of the day, zero when unknown
 * @param peakValuationUsd    max(stored peak, current)
 * @param changePct           alert to now, percent with one decimal; null without an alert valuation
 * @param peakChangePct       alert to peak; null without an alert valuation or a peak
 * @param win                 peak above the alert valuation (or, without a peak, current above it)
 * @param classification      latest evaluation outcome seen for the asset; null when not yet evaluated
 */
public record TokenSummary(
        String assetMint,
        String symbol,
        BigDecimal alertValuationUsd,
        BigDecimal currentValuationUsd,
        BigDecimal peakValuationUsd,
        BigDecimal changePct,
        BigDecimal peakChangePct,
        boolean win,
        int alertCount,
        ValuationOutcome classification
) {

    public boolean hasAlertValuation() {
        return alertValuationUsd.signum() > 0;
    }
}
