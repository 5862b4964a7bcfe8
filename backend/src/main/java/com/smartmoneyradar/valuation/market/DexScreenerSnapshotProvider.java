package com.smartmoneyradar.valuation.market;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Asset snapshot from the most liquid DexScreener pair. Market cap falls back to FDV.
 */
@Component
@RequiredArgsConstructor
public class DexScreenerSnapshotProvider implements AssetSnapshotProvider {

    private final DexScreenerClient dexScreenerClient;

    @Override
    public Optional<AssetSnapshot> getAssetSnapshot(String mint) {
        if (mint == null || mint.isBlank()) {
            return Optional.empty();
        }
        return dexScreenerClient.findBestPair(mint.strip()).map(DexScreenerSnapshotProvider::toSnapshot);
    }

    static AssetSnapshot toSnapshot(JsonNode pair) {
        String symbol = pair.path("baseToken").path("symbol").asText("");
        if (symbol.isBlank()) {
            symbol = AssetSnapshot.UNKNOWN_SYMBOL;
        }
        BigDecimal marketCap = DexScreenerClient.decimal(pair.path("marketCap"));
        if (marketCap.signum() <= 0) {
            marketCap = DexScreenerClient.decimal(pair.path("fdv"));
        }
        JsonNode txns = pair.path("txns").path("h24");
        return new AssetSnapshot(
                symbol,
                marketCap,
                DexScreenerClient.decimal(pair.path("liquidity").path("usd")),
                DexScreenerClient.decimal(pair.path("volume").path("h24")),
                txns.path("buys").asInt(0),
                txns.path("sells").asInt(0),
                DexScreenerClient.decimal(pair.path("priceUsd")));
    }
}
