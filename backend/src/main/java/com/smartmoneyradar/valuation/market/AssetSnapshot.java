package com.smartmoneyradar.valuation.market;

import java.math.BigDecimal;

/**
 * Point-in-time market data for one asset, taken from its most liquid Solana pair. Never cached.
 *
 * @param marketValuationUsd market cap, falling back to FDV when the pair reports none
 */
public record AssetSnapshot(
        String symbol,
        BigDecimal marketValuationUsd,
        BigDecimal liquidityUsd,
        BigDecimal volume24hUsd,
        int buys24h,
        int sells24h,
        BigDecimal priceUsd
) {

    public static final String UNKNOWN_SYMBOL = "UNKNOWN";

    public int txns24h() {
        return buys24h + sells24h;
    }
}
