package com.smartmoneyradar.ingestion.adapter;

/**
 * Thrown when the provider signals a rate limit (HTTP 429 or JSON-RPC error -32429). Retried with backoff by
 * {@link RateLimitedClient}; every other {@link ProviderException} is not.
 */
public class ProviderRateLimitedException extends ProviderException {

    public ProviderRateLimitedException(String message) {
        super(message);
    }

    public ProviderRateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
