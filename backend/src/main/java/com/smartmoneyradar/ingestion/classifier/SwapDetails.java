package com.smartmoneyradar.ingestion.classifier;

import java.math.BigDecimal;

/**
 * What a wallet got out of a verified swap.
 *
 * @param assetMint      mint of the received token
 * @param amountReceived UI amount received
 * @param nativeSpent    SOL spent, floored at zero
 * @param sourceLabel    DEX label
 */
public record SwapDetails(String assetMint, BigDecimal amountReceived, BigDecimal nativeSpent, String sourceLabel) {
}
