package com.smartmoneyradar.alert.engine;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A wallet's accepted purchase inside an asset's window.
 *
 * @param valuationUsd asset valuation when the purchase was accepted
 * @param acceptedAt   engine time of acceptance (window age is measured from it)
 */
public record PurchaseRecord(
        String wallet,
        BigDecimal nativeSpent,
        BigDecimal valuationUsd,
        Instant acceptedAt,
        String signature
) {
}
