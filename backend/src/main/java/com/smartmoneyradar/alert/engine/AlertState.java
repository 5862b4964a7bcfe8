package com.smartmoneyradar.alert.engine;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Last alert of an asset, replaced on every alert.
 *
 * @param streakBaselineValuationUsd valuation at the first alert of the current bullish streak
 * @param streakCount                position of the last alert within its streak (1 = fresh)
 */
public record AlertState(
        Instant lastAlertAt,
        int walletCountAtLastAlert,
        BigDecimal streakBaselineValuationUsd,
        int streakCount
) {
}
