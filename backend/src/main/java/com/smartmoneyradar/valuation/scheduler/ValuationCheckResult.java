package com.smartmoneyradar.valuation.scheduler;

import com.smartmoneyradar.domain.ValuationOutcome;

import java.math.BigDecimal;

/**
 * Outcome of one executed check.
 *
 * @param snapshotKnown false when the lookup returned nothing and the check ran with valuation zero
 */
public record ValuationCheckResult(
        String assetMint,
        String symbol,
        ValuationCheckpoint checkpoint,
        BigDecimal valuationUsd,
        double change,
        ValuationOutcome outcome,
        BigDecimal peakValuationUsd,
        boolean snapshotKnown
) {
}
