package com.smartmoneyradar.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Native SOL movement. {@code amount} is in lamports.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NativeTransfer(
        Long amount,
        String fromUserAccount,
        String toUserAccount
) {

    public long lamports() {
        return amount == null ? 0L : amount;
    }
}
