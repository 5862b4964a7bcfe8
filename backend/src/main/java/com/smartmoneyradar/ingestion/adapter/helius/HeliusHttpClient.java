package com.smartmoneyradar.ingestion.adapter.helius;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Raw HTTP access to Helius: Solana JSON-RPC and the Enhanced Transactions API.
 * Errors are signalled as {@code ProviderRateLimitedException} (HTTP 429) or {@code ProviderException}.
 */
public interface HeliusHttpClient {

    /** JSON-RPC 2.0 call; emits the raw response body. */
    Mono<String> rpc(String method, Object params);

    /** POST {apiUrl}/transactions?api-key=... with {"transactions": signatures}; emits the raw JSON array. */
    Mono<String> enhancedTransactions(List<String> signatures);
}
