package com.smartmoneyradar.ingestion.adapter;

/**
 * Thrown when a chain-data provider call fails (HTTP, JSON-RPC error, malformed payload, timeout).
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
