package com.smartmoneyradar.valuation.scheduler;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A queued check. {@code threshold} is null for observation-only checkpoints.
 */
public record PendingValuationCheck(
        String assetMint,
        String symbol,
        BigDecimal alertValuationUsd,
        Instant alertTime,
        List<String> wallets,
        Instant fireAt,
        ValuationCheckpoint checkpoint,
        Double threshold
) {

    public boolean hasThreshold() {
        return threshold != null;
    }
}
