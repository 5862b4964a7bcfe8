package com.smartmoneyradar.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

/**
 * SPL token movement inside an enhanced transaction. {@code tokenAmount} is in UI units (decimals applied).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenTransfer(
        String mint,
        BigDecimal tokenAmount,
        String fromUserAccount,
        String toUserAccount
) {

    public BigDecimal amountOrZero() {
        return tokenAmount == null ? BigDecimal.ZERO : tokenAmount;
    }
}
