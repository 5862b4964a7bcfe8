package com.smartmoneyradar.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartmoneyradar.common.ExcludedAssetRegistry;
import com.smartmoneyradar.common.RateLimiter;
import com.smartmoneyradar.common.RetryPolicy;
import com.smartmoneyradar.ingestion.adapter.ChainDataProvider;
import com.smartmoneyradar.ingestion.adapter.RateLimitedClient;
import com.smartmoneyradar.ingestion.adapter.helius.HeliusChainDataProvider;
import com.smartmoneyradar.ingestion.adapter.helius.HeliusHttpClient;
import com.smartmoneyradar.ingestion.adapter.helius.WebClientHeliusHttpClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the Helius provider behind one shared {@link RateLimitedClient} (one throttle for the whole process).
 */
@Configuration
@EnableConfigurationProperties({ HeliusProperties.class, IngestionRetryProperties.class, PollingProperties.class,
        DexProgramProperties.class, ExclusionProperties.class, TrackedWalletProperties.class })
public class IngestionConfig {

    @Autowired
    private IngestionRetryProperties retryProperties;

    private RetryPolicy retryPolicy() {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxRetries());
    }

    @Bean
    public ExcludedAssetRegistry excludedAssetRegistry(ExclusionProperties properties) {
        return new ExcludedAssetRegistry(properties.getMints(), properties.getSymbols());
    }

    @Bean
    public RateLimitedClient heliusRateLimitedClient(HeliusProperties properties) {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(Math.max(1L, properties.getMinRequestIntervalMs())));
        return new RateLimitedClient(limiter, retryPolicy());
    }

    @Bean
    public HeliusHttpClient heliusHttpClient(WebClient.Builder webClientBuilder, HeliusProperties properties) {
        return new WebClientHeliusHttpClient(webClientBuilder, properties.getRpcUrl(), properties.getApiUrl(),
                properties.getApiKey());
    }

    @Bean
    public ChainDataProvider chainDataProvider(HeliusHttpClient heliusHttpClient,
                                               RateLimitedClient heliusRateLimitedClient,
                                               ObjectMapper objectMapper,
                                               HeliusProperties properties) {
        return new HeliusChainDataProvider(heliusHttpClient, heliusRateLimitedClient, objectMapper,
                Duration.ofMillis(properties.getRpcTimeoutMs()),
                Duration.ofMillis(properties.getEnhancedTimeoutMs()));
    }
}
