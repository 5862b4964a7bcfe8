package com.smartmoneyradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Helius endpoints, credentials and client limits. Documented in application.yml (smartmoney.ingestion.helius).
 */
@ConfigurationProperties(prefix = "smartmoney.ingestion.helius")
@NoArgsConstructor
@Getter
@Setter
public class HeliusProperties {

    /** Solana JSON-RPC base URL; the api key is appended as ?api-key=. */
    private String rpcUrl = "https://mainnet.helius-rpc.com";

    /** Enhanced Transactions API base URL. */
    private String apiUrl = "https://api.helius.xyz/v0";

    private String apiKey = "";

    /** Timeout for JSON-RPC calls (getSignaturesForAddress). Default 15000. */
    private long rpcTimeoutMs = 15_000L;

    /** Timeout for enhanced-transaction batches. Default 20000. */
    private long enhancedTimeoutMs = 20_000L;

    /** Minimum interval between two provider requests (free tier: 10 req/s). Default 150. */
    private long minRequestIntervalMs = 150L;
}
