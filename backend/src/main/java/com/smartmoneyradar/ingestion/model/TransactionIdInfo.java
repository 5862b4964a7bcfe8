package com.smartmoneyradar.ingestion.model;

import java.time.Instant;

/**
 * One entry of getSignaturesForAddress: signature, block time (may be null) and whether the transaction failed on chain.
 */
public record TransactionIdInfo(String signature, Instant occurredAt, boolean failed) {
}
