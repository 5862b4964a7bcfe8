package com.smartmoneyradar.ingestion.adapter.helius;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartmoneyradar.ingestion.adapter.CallResult;
import com.smartmoneyradar.ingestion.adapter.ChainDataProvider;
import com.smartmoneyradar.ingestion.adapter.ProviderException;
import com.smartmoneyradar.ingestion.adapter.ProviderRateLimitedException;
import com.smartmoneyradar.ingestion.adapter.RateLimitedClient;
import com.smartmoneyradar.ingestion.model.EnhancedTransaction;
import com.smartmoneyradar.ingestion.model.TransactionIdInfo;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Helius-backed chain data: getSignaturesForAddress (bounded by {@code until}) and the Enhanced Transactions API.
 * Every call goes through the shared {@link RateLimitedClient} and carries a timeout.
 */
@Slf4j
public class HeliusChainDataProvider implements ChainDataProvider {

    /** JSON-RPC error code Helius returns instead of HTTP 429 on some endpoints. */
    static final int RPC_RATE_LIMIT_CODE = -32429;

    private static final TypeReference<List<EnhancedTransaction>> ENHANCED_LIST = new TypeReference<>() {
    };

    private final HeliusHttpClient httpClient;
    private final RateLimitedClient rateLimitedClient;
    private final ObjectMapper objectMapper;
    private final Duration rpcTimeout;
    private final Duration enhancedTimeout;

    public HeliusChainDataProvider(HeliusHttpClient httpClient,
                                   RateLimitedClient rateLimitedClient,
                                   ObjectMapper objectMapper,
                                   Duration rpcTimeout,
                                   Duration enhancedTimeout) {
        this.httpClient = httpClient;
        this.rateLimitedClient = rateLimitedClient;
        this.objectMapper = objectMapper;
        this.rpcTimeout = rpcTimeout;
        this.enhancedTimeout = enhancedTimeout;
    }

    @Override
    public CallResult<List<TransactionIdInfo>> getLatestTransactionIds(String wallet, int limit, String sinceId) {
        List<Object> params = new ArrayList<>();
        params.add(wallet);
        Map<String, Object> config = new HashMap<>();
        config.put("limit", limit);
        config.put("commitment", "confirmed");
        if (sinceId != null && !sinceId.isBlank()) {
            config.put("until", sinceId);
        }
        params.add(config);
        return rateLimitedClient.call("getSignaturesForAddress", () -> {
            String json = httpClient.rpc("getSignaturesForAddress", params).timeout(rpcTimeout).block();
            return parseSignatures(json);
        });
    }

    @Override
    public CallResult<List<EnhancedTransaction>> getEnhancedTransactions(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return CallResult.ok(List.of());
        }
        List<String> batch = ids.size() > MAX_ENHANCED_BATCH ? ids.subList(0, MAX_ENHANCED_BATCH) : ids;
        return rateLimitedClient.call("enhancedTransactions", () -> {
            String json = httpClient.enhancedTransactions(List.copyOf(batch)).timeout(enhancedTimeout).block();
            return parseEnhanced(json);
        });
    }

    private List<TransactionIdInfo> parseSignatures(String json) {
        JsonNode root = readTree(json);
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            if (error.path("code").asInt() == RPC_RATE_LIMIT_CODE) {
                throw new ProviderRateLimitedException("getSignaturesForAddress rate limited: " + error.path("message").asText());
            }
            throw new ProviderException("getSignaturesForAddress error: " + error);
        }
        JsonNode result = root.path("result");
        if (!result.isArray()) {
            return List.of();
        }
        List<TransactionIdInfo> out = new ArrayList<>();
        for (JsonNode node : result) {
            String signature = node.path("signature").asText(null);
            if (signature == null || signature.isBlank()) {
                continue;
            }
            JsonNode blockTime = node.path("blockTime");
            Instant occurredAt = blockTime.isNumber() ? Instant.ofEpochSecond(blockTime.asLong()) : null;
            JsonNode err = node.path("err");
            boolean failed = !err.isMissingNode() && !err.isNull();
            out.add(new TransactionIdInfo(signature, occurredAt, failed));
        }
        return out;
    }

    private List<EnhancedTransaction> parseEnhanced(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<EnhancedTransaction> list = objectMapper.readValue(json, ENHANCED_LIST);
            return list == null ? List.of() : list;
        } catch (JsonProcessingException e) {
            throw new ProviderException("Malformed enhanced transactions payload", e);
        }
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new ProviderException("Empty JSON-RPC response");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Malformed JSON-RPC response", e);
        }
    }
}
