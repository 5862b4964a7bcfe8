package com.smartmoneyradar.ingestion.adapter;

import java.util.Optional;

/**
 * Outcome of one provider call. {@code OK} with an empty payload means "asked, nothing new";
 * {@code RATE_LIMITED} and {@code FAILED} mean "could not ask" and carry no data.
 */
public record CallResult<T>(Status status, T data, String error) {

    public enum Status {
        OK,
        /** Backoff retries exhausted. */
        RATE_LIMITED,
        /** Transport or protocol failure, not retried. */
        FAILED
    }

    public static <T> CallResult<T> ok(T data) {
        return new CallResult<>(Status.OK, data, null);
    }

    public static <T> CallResult<T> rateLimited(String error) {
        return new CallResult<>(Status.RATE_LIMITED, null, error);
    }

    public static <T> CallResult<T> failed(String error) {
        return new CallResult<>(Status.FAILED, null, error);
    }

    public boolean hasData() {
        return status == Status.OK;
    }

    public boolean isRateLimited() {
        return status == Status.RATE_LIMITED;
    }

    public Optional<T> value() {
        return hasData() ? Optional.ofNullable(data) : Optional.empty();
    }
}
