package com.smartmoneyradar.valuation.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DexScreenerSnapshotProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static final String TOKEN_RESPONSE = """
            {"schemaVersion":"1.0.0","pairs":[
              {"chainId":"base","baseToken":{"symbol":"TKN"},"liquidity":{"usd":900000},"marketCap":5000000},
              {"chainId":"solana","dexId":"raydium","baseToken":{"symbol":"TKN"},"priceUsd":"0.00012",
               "liquidity":{"usd":45000.5},"marketCap":120000,"fdv":130000,
               "volume":{"h24":250000},"txns":{"h24":{"buys":310,"sells":190}}},
              {"chainId":"solana","dexId":"orca","baseToken":{"symbol":"TKN"},"liquidity":{"usd":8000},
               "marketCap":121000}
            ]}""";

    @Test
    void selectBestPair_prefersMostLiquidSolanaPair() throws Exception {
        Optional<JsonNode> best = DexScreenerClient.selectBestPair(mapper.readTree(TOKEN_RESPONSE));

        assertThat(best).isPresent();
        assertThat(best.get().path("dexId").asText()).isEqualTo("raydium");
    }

    @Test
    void selectBestPair_noPairs_isEmpty() throws Exception {
        assertThat(DexScreenerClient.selectBestPair(mapper.readTree("{\"pairs\":null}"))).isEmpty();
        assertThat(DexScreenerClient.selectBestPair(mapper.readTree("{\"pairs\":[]}"))).isEmpty();
    }

    @Test
    void toSnapshot_mapsMarketFields() throws Exception {
        JsonNode pair = DexScreenerClient.selectBestPair(mapper.readTree(TOKEN_RESPONSE)).orElseThrow();

        AssetSnapshot snapshot = DexScreenerSnapshotProvider.toSnapshot(pair);

        assertThat(snapshot.symbol()).isEqualTo("TKN");
        assertThat(snapshot.marketValuationUsd()).isEqualByComparingTo("120000");
        assertThat(snapshot.liquidityUsd()).isEqualByComparingTo("45000.5");
        assertThat(snapshot.volume24hUsd()).isEqualByComparingTo("250000");
        assertThat(snapshot.txns24h()).isEqualTo(500);
        assertThat(snapshot.priceUsd()).isEqualByComparingTo("0.00012");
    }

    @Test
    void toSnapshot_missingMarketCap_fallsBackToFdv_andUnknownSymbol() throws Exception {
        JsonNode pair = mapper.readTree("{\"fdv\":75000,\"liquidity\":{\"usd\":6000}}");

        AssetSnapshot snapshot = DexScreenerSnapshotProvider.toSnapshot(pair);

        assertThat(snapshot.marketValuationUsd()).isEqualByComparingTo("75000");
        assertThat(snapshot.symbol()).isEqualTo(AssetSnapshot.UNKNOWN_SYMBOL);
        assertThat(snapshot.txns24h()).isZero();
    }
}
