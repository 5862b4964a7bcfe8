package com.smartmoneyradar.valuation.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartmoneyradar.valuation.config.ValuationProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DexScreener /tokens/{mint} lookup: returns the pair with the highest USD liquidity, preferring Solana pairs.
 * Throttled by the shared "dexscreener" Resilience4j limiter.
 */
@Component
@Slf4j
public class DexScreenerClient {

    private static final String SOLANA_CHAIN = "solana";

    private final WebClient webClient;
    private final ValuationProperties properties;
    private final RateLimiter dexScreenerRateLimiter;
    private final ObjectMapper objectMapper;

    public DexScreenerClient(WebClient.Builder webClientBuilder,
                             ValuationProperties properties,
                             @Qualifier("dexScreenerRateLimiter") RateLimiter dexScreenerRateLimiter,
                             ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
        this.dexScreenerRateLimiter = dexScreenerRateLimiter;
        this.objectMapper = objectMapper;
    }

    /**
     * @return most liquid pair for {@code mint}, empty when unlisted, throttled or on any transport error
     */
    public Optional<JsonNode> findBestPair(String mint) {
        if (!dexScreenerRateLimiter.acquirePermission()) {
            log.warn("DexScreener limiter timeout before lookup of {}", mint);
            return Optional.empty();
        }
        String url = properties.getDexscreenerBaseUrl() + "/tokens/" + mint;
        try {
            String response = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
                    .block();
            return selectBestPair(response == null ? null : objectMapper.readTree(response));
        } catch (WebClientResponseException e) {
            log.warn("DexScreener lookup failed for {}: HTTP {}", mint, e.getStatusCode().value());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("DexScreener lookup error for {}: {}", mint, e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<JsonNode> selectBestPair(JsonNode root) {
        if (root == null) {
            return Optional.empty();
        }
        JsonNode pairs = root.path("pairs");
        if (!pairs.isArray() || pairs.isEmpty()) {
            return Optional.empty();
        }
        List<JsonNode> candidates = new ArrayList<>();
        pairs.forEach(p -> {
            if (SOLANA_CHAIN.equals(p.path("chainId").asText())) {
                candidates.add(p);
            }
        });
        if (candidates.isEmpty()) {
            pairs.forEach(candidates::add);
        }
        JsonNode best = null;
        BigDecimal bestLiquidity = null;
        for (JsonNode p : candidates) {
            BigDecimal liquidity = decimal(p.path("liquidity").path("usd"));
            if (best == null || liquidity.compareTo(bestLiquidity) > 0) {
                best = p;
                bestLiquidity = liquidity;
            }
        }
        return Optional.ofNullable(best);
    }

    /** Reads a numeric or numeric-string node; missing, null or unparsable is zero. */
    static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return BigDecimal.ZERO;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        String text = node.asText();
        if (text == null || text.isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(text.strip());
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }
}
