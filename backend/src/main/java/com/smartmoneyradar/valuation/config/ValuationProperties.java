package com.smartmoneyradar.valuation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Post-alert valuation checks and market-data endpoints. Documented in application.yml (smartmoney.valuation).
 */
@ConfigurationProperties(prefix = "smartmoney.valuation")
@NoArgsConstructor
@Getter
@Setter
public class ValuationProperties {

    /** Gain at the 5-minute check that short-lists the asset. Default 0.20. */
    private double shortListThreshold = 0.20;

    /** Gain at the 30-minute check that marks the asset for a contracts check. Default 0.50. */
    private double contractsCheckThreshold = 0.50;

    /** Valuation at or below which a thresholded check classifies the asset as trash. Default 20000. */
    private BigDecimal deadValuationFloorUsd = BigDecimal.valueOf(20_000);

    /** How often due checks are drained. Default 60000. */
    private long tickIntervalMs = 60_000L;

    private String dexscreenerBaseUrl = "https://api.dexscreener.com/latest/dex";

    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /** Timeout for DexScreener and CoinGecko requests. Default 10000. */
    private long requestTimeoutMs = 10_000L;

    /** DexScreener token endpoints allow 300 req/min. */
    private int dexscreenerRequestsPerMinute = 300;

    /** Max wait for a DexScreener permit before treating the lookup as unknown. Default 10000. */
    private long limiterTimeoutMs = 10_000L;

    /** SOL/USD used when DexScreener and CoinGecko both fail. Default 180. */
    private BigDecimal fallbackNativePriceUsd = BigDecimal.valueOf(180);
}
