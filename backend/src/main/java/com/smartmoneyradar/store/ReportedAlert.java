package com.smartmoneyradar.store;

import com.smartmoneyradar.domain.ValuationOutcome;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A stored alert joined with the valuation evaluation closest to it in time.
 *
 * @param alertValuationUsd the alert's valuation, or the evaluation's when the alert stored none; zero if neither
 * @param peakValuationUsd  evaluation peak, zero without an evaluation
 * @param classification    latest thresholded outcome, null while unclassified
 */
public record ReportedAlert(
        String assetMint,
        String symbol,
        BigDecimal alertValuationUsd,
        int walletCount,
        Instant createdAt,
        ValuationOutcome classification,
        BigDecimal peakValuationUsd
) {
}
