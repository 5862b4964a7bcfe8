package com.smartmoneyradar.valuation.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartmoneyradar.common.ExcludedAssetRegistry;
import com.smartmoneyradar.config.CaffeineConfig;
import com.smartmoneyradar.valuation.config.ValuationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;

/**
 * SOL/USD used by the dust filter. Chain: most liquid wSOL pair on DexScreener, then CoinGecko simple price,
 * then the configured hard fallback. Cached 60s in {@value CaffeineConfig#NATIVE_PRICE_CACHE}.
 */
@Component
@Slf4j
public class NativePriceResolver {

    private static final int SCALE = 8;

    private final DexScreenerClient dexScreenerClient;
    private final ValuationProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public NativePriceResolver(DexScreenerClient dexScreenerClient,
                               ValuationProperties properties,
                               WebClient.Builder webClientBuilder,
                               ObjectMapper objectMapper) {
        this.dexScreenerClient = dexScreenerClient;
        this.properties = properties;
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
    }

    @Cacheable(cacheNames = CaffeineConfig.NATIVE_PRICE_CACHE, key = "'SOL'")
    public BigDecimal getNativeUsdPrice() {
        Optional<BigDecimal> fromDex = dexScreenerClient.findBestPair(ExcludedAssetRegistry.WRAPPED_SOL_MINT)
                .flatMap(NativePriceResolver::priceFromPair);
        if (fromDex.isPresent()) {
            return fromDex.get();
        }
        Optional<BigDecimal> fromCoinGecko = coinGeckoPrice();
        if (fromCoinGecko.isPresent()) {
            return fromCoinGecko.get();
        }
        log.warn("SOL price unavailable, using fallback {}", properties.getFallbackNativePriceUsd());
        return properties.getFallbackNativePriceUsd();
    }

    /**
     * SOL as base token: priceUsd. SOL as quote token: priceUsd / priceNative.
     */
    static Optional<BigDecimal> priceFromPair(JsonNode pair) {
        String baseSymbol = pair.path("baseToken").path("symbol").asText("");
        BigDecimal priceUsd = DexScreenerClient.decimal(pair.path("priceUsd"));
        BigDecimal price;
        if ("SOL".equals(baseSymbol) || "WSOL".equals(baseSymbol)) {
            price = priceUsd;
        } else {
            BigDecimal priceNative = DexScreenerClient.decimal(pair.path("priceNative"));
            if (priceNative.signum() <= 0 || priceUsd.signum() <= 0) {
                return Optional.empty();
            }
            price = priceUsd.divide(priceNative, SCALE, RoundingMode.HALF_UP);
        }
        return price.signum() > 0 ? Optional.of(price) : Optional.empty();
    }

    private Optional<BigDecimal> coinGeckoPrice() {
        String url = properties.getCoingeckoBaseUrl() + "/simple/price?ids=solana&vs_currencies=usd";
        try {
            String response = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
                    .block();
            if (response == null) {
                return Optional.empty();
            }
            BigDecimal usd = DexScreenerClient.decimal(objectMapper.readTree(response).path("solana").path("usd"));
            return usd.signum() > 0 ? Optional.of(usd) : Optional.empty();
        } catch (Exception e) {
            log.warn("CoinGecko SOL price error: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
