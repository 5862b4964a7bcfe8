package com.smartmoneyradar.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One executed post-alert valuation check, as handed to the decision store.
 *
 * @param checkpoint     "offset-1".."offset-4"
 * @param change         fractional change vs. alert valuation (0 when the alert valuation is not positive)
 * @param outcome        classification, null for observation-only checks
 * @param peakValuationUsd peak observed so far for this alert, including this check
 */
public record ValuationCheckEvent(
        String assetMint,
        String symbol,
        BigDecimal alertValuationUsd,
        Instant alertTime,
        List<String> wallets,
        String checkpoint,
        long offsetSeconds,
        BigDecimal valuationUsd,
        double change,
        ValuationOutcome outcome,
        BigDecimal peakValuationUsd,
        Instant checkedAt
) {
}
