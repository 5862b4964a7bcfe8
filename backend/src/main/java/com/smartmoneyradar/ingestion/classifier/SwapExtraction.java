package com.smartmoneyradar.ingestion.classifier;

import java.util.Optional;

/**
 * Result of {@link SwapClassifier#extractSwap}: either details or a rejection reason.
 */
public record SwapExtraction(SwapDetails details, String rejectionReason) {

    public static SwapExtraction valid(SwapDetails details) {
        return new SwapExtraction(details, null);
    }

    public static SwapExtraction rejected(String reason) {
        return new SwapExtraction(null, reason);
    }

    public boolean isValid() {
        return details != null;
    }

    public Optional<SwapDetails> detailsOptional() {
        return Optional.ofNullable(details);
    }
}
