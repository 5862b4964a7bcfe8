package com.smartmoneyradar.alert.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Alert thresholds, windows and purchase filters. Documented in application.yml (smartmoney.alert).
 */
@ConfigurationProperties(prefix = "smartmoney.alert")
@NoArgsConstructor
@Getter
@Setter
public class AlertProperties {

    /** Distinct wallets needed inside the window. Default 3. */
    private int threshold = 3;

    /** Sliding purchase window. Default 20s. */
    private long windowSeconds = 20L;

    /** Same-asset re-alert suppression unless the wallet count grows. Default 300s. */
    private long cooldownSeconds = 300L;

    /** Re-alerts within this interval continue a bullish streak. Default 1800s. */
    private long bullishWindowSeconds = 1800L;

    /** Purchases of assets valued above this are ignored. Default 700000. */
    private BigDecimal maxValuationUsd = BigDecimal.valueOf(700_000);

    private BigDecimal minLiquidityUsd = BigDecimal.valueOf(5_000);

    private BigDecimal minVolume24hUsd = BigDecimal.valueOf(10_000);

    /** 24h buys + sells. Default 15. */
    private int minTxns24h = 15;

    /** Dust floor for a single purchase (SOL spent x SOL/USD). Default 5. */
    private BigDecimal minBuyUsd = BigDecimal.valueOf(5);

    /** Local hours (0-23, in {@link #zoneOffset}) during which the threshold is raised. Empty = no blackout. */
    private List<Integer> blackoutHours = new ArrayList<>();

    private int blackoutExtraThreshold = 1;

    private String zoneOffset = "+03:00";

    /** Processed signature memory before the oldest half is evicted. Default 10000. */
    private int processedIdCapacity = 10_000;

    /** Per-asset alert states kept before the oldest half is evicted. Default 10000. */
    private int alertStateCapacity = 10_000;

    /** A new trade signal for an asset is skipped while a live one is younger than this. Default 300s. */
    private long tradeSignalCooldownSeconds = 300L;
}
