package com.smartmoneyradar.alert.engine;

import java.math.BigDecimal;

/**
 * One wallet's contribution to an alert.
 */
public record WalletPurchase(String wallet, BigDecimal nativeSpent, BigDecimal valuationAtPurchaseUsd) {
}
