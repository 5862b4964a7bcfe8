package com.smartmoneyradar.ingestion.adapter.helius;

import com.smartmoneyradar.ingestion.adapter.ProviderException;
import com.smartmoneyradar.ingestion.adapter.ProviderRateLimitedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Helius client using WebClient. Same JSON-RPC 2.0 envelope as any Solana RPC node.
 */
public class WebClientHeliusHttpClient implements HeliusHttpClient {

    private final WebClient webClient;
    private final String rpcUrl;
    private final String enhancedTransactionsUrl;

    public WebClientHeliusHttpClient(WebClient.Builder builder, String rpcUrl, String apiUrl, String apiKey) {
        this.webClient = builder.build();
        this.rpcUrl = rpcUrl + "/?api-key=" + apiKey;
        this.enhancedTransactionsUrl = apiUrl + "/transactions?api-key=" + apiKey;
    }

    @Override
    public Mono<String> rpc(String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return post(rpcUrl, body);
    }

    @Override
    public Mono<String> enhancedTransactions(List<String> signatures) {
        return post(enhancedTransactionsUrl, Map.of("transactions", signatures));
    }

    private Mono<String> post(String url, Object body) {
        return webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, WebClientHeliusHttpClient::toProviderException);
    }

    private static ProviderException toProviderException(WebClientResponseException e) {
        if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return new ProviderRateLimitedException("HTTP 429 from Helius", e);
        }
        return new ProviderException("HTTP " + e.getStatusCode().value() + " from Helius", e);
    }
}
