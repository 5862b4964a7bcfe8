package com.smartmoneyradar.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A verified purchase by a tracked wallet: the asset it received and the native SOL it paid.
 * Produced by the swap classifier, consumed once by the alert engine (keyed by {@code signature}).
 *
 * @param wallet         tracked wallet that bought
 * @param assetMint      mint of the token received
 * @param amountReceived token amount received (UI units)
 * @param nativeSpent    SOL spent, never negative
 * @param signature      provider transaction signature
 * @param sourceLabel    DEX source label (e.g. "Raydium AMM V4", "JUPITER")
 * @param observedAt     block time of the transaction, or receive time when unknown
 */
public record SwapEvent(
        String wallet,
        String assetMint,
        BigDecimal amountReceived,
        BigDecimal nativeSpent,
        String signature,
        String sourceLabel,
        Instant observedAt
) {
}
